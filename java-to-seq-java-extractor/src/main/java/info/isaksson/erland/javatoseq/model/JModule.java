package info.isaksson.erland.javatoseq.model;

import java.nio.file.Path;
import java.util.List;

/**
 * A named group of source files analyzed together. Its name is the first segment of every diagram
 * title produced for methods declared in it.
 */
public final class JModule {
    public final String name;
    public final Path directory;
    public final List<Path> files;

    public JModule(String name, Path directory, List<Path> files) {
        if (name == null || name.isBlank()) throw new IllegalArgumentException("module name must not be blank");
        this.name = name;
        this.directory = directory;
        this.files = files == null ? List.of() : List.copyOf(files);
    }

    @Override
    public String toString() {
        return name + " (" + files.size() + " files)";
    }
}
