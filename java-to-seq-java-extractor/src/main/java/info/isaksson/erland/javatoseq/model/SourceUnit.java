package info.isaksson.erland.javatoseq.model;

import com.github.javaparser.ast.CompilationUnit;

import java.nio.file.Path;

/** A parsed compilation unit and the module it belongs to. */
public final class SourceUnit {
    public final String moduleName;
    public final Path file;
    public final CompilationUnit cu;

    public SourceUnit(String moduleName, Path file, CompilationUnit cu) {
        this.moduleName = moduleName;
        this.file = file;
        this.cu = cu;
    }
}
