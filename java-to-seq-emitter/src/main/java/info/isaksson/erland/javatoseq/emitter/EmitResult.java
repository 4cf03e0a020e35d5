package info.isaksson.erland.javatoseq.emitter;

import java.util.List;
import java.util.Map;

/** Diagrams of one emitter run and the methods that could not be classified. */
public final class EmitResult {

    /** Title to PlantUML lines, in source order. */
    public final Map<String, List<String>> diagrams;

    /** Methods whose declaration could not be resolved, as {@code module:File.java:line Type.signature}. */
    public final List<String> unresolvedMethods;

    public EmitResult(Map<String, List<String>> diagrams, List<String> unresolvedMethods) {
        this.diagrams = diagrams == null ? Map.of() : diagrams;
        this.unresolvedMethods = unresolvedMethods == null ? List.of() : List.copyOf(unresolvedMethods);
    }
}
