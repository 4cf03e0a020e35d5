package info.isaksson.erland.javatoseq.core;

import info.isaksson.erland.javatoseq.model.JModule;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/** Generation result container for programmatic usage. */
public final class JavaToSeqResult {
    /** Title to PlantUML lines, in source order. */
    public final Map<String, List<String>> diagrams;

    public final List<JModule> modules;

    public final List<Path> javaFiles;

    /** Files that could not be parsed; they contribute nothing. */
    public final List<String> parseErrors;

    /** Methods skipped because their declaration could not be resolved. */
    public final List<String> unresolvedMethods;

    /** Calls whose target could not be resolved; they do not count as callers. */
    public final List<String> unresolvedCallSites;

    JavaToSeqResult(
            Map<String, List<String>> diagrams,
            List<JModule> modules,
            List<Path> javaFiles,
            List<String> parseErrors,
            List<String> unresolvedMethods,
            List<String> unresolvedCallSites
    ) {
        this.diagrams = diagrams;
        this.modules = List.copyOf(modules);
        this.javaFiles = List.copyOf(javaFiles);
        this.parseErrors = List.copyOf(parseErrors);
        this.unresolvedMethods = List.copyOf(unresolvedMethods);
        this.unresolvedCallSites = List.copyOf(unresolvedCallSites);
    }
}
