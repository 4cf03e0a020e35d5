package info.isaksson.erland.javatoseq.diagram;

import java.util.List;

/** PlantUML sequence diagram vocabulary used by the emitter. */
public final class PlantUml {

    public static final String START = "@startuml";
    public static final String END = "@enduml";
    public static final String AUTOACTIVATE = "autoactivate on";
    public static final String HIDE_FOOTBOX = "hide footbox";

    public static final String INDENT_UNIT = "  ";

    private PlantUml() {}

    /** The four lines every diagram starts with. */
    public static List<String> header(String title) {
        return List.of(START, "title " + title, AUTOACTIVATE, HIDE_FOOTBOX);
    }

    public static String indent(int depth) {
        if (depth < 0) throw new IllegalArgumentException("depth must be >= 0: " + depth);
        return INDENT_UNIT.repeat(depth);
    }

    public static String group(int depth, String kind) {
        return indent(depth) + "group " + kind;
    }

    public static String end(int depth) {
        return indent(depth) + "end";
    }

    public static String call(int depth, String caller, String target, String member) {
        return indent(depth) + caller + " -> " + target + ": " + member;
    }

    public static String reply(int depth, String caller, String target, String returnType) {
        return indent(depth) + target + " --> " + caller + ": " + returnType;
    }
}
