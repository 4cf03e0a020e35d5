package info.isaksson.erland.javatoseq.model;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * A loaded program: its modules, parsed compilation units, semantic model and load diagnostics.
 */
public final class JProgram {
    public final Path sourceRoot;
    public final List<JModule> modules;

    /** Parsed units in module order, then file order. */
    public final List<SourceUnit> units = new ArrayList<>();

    public final List<String> parseErrors = new ArrayList<>();

    /** Call sites whose target could not be resolved; they count as callers of nothing. */
    public final List<String> unresolvedCallSites = new ArrayList<>();

    private SourceModel sourceModel;

    public JProgram(Path sourceRoot, List<JModule> modules) {
        this.sourceRoot = sourceRoot;
        this.modules = modules == null ? List.of() : List.copyOf(modules);
    }

    public SourceModel sourceModel() {
        if (sourceModel == null) throw new IllegalStateException("program has no source model attached");
        return sourceModel;
    }

    public void attach(SourceModel sourceModel) {
        this.sourceModel = sourceModel;
    }

    public int fileCount() {
        int n = 0;
        for (JModule m : modules) n += m.files.size();
        return n;
    }
}
