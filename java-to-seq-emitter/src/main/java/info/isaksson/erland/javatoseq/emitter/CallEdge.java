package info.isaksson.erland.javatoseq.emitter;

import info.isaksson.erland.javatoseq.diagram.PlantUml;

/**
 * One resolved invocation or member access, drawn as a call line and a matching return line.
 *
 * @param callerType simple name of the type whose code makes the call
 * @param targetType simple name for same-type calls, fully qualified name otherwise
 * @param member     method or field name
 * @param returnType simple return type, {@code void} when there is none
 */
public record CallEdge(String callerType, String targetType, String member, String returnType) {

    public static final String VOID = "void";

    public String callLine(int depth) {
        return PlantUml.call(depth, callerType, targetType, member);
    }

    public String returnLine(int depth) {
        return PlantUml.reply(depth, callerType, targetType, returnType);
    }
}
