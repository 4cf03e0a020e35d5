package info.isaksson.erland.javatoseq.io;

import java.io.IOException;
import java.nio.file.FileSystems;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Deterministic discovery of {@code .java} files under a source root.
 *
 * <p>Build output and tool folders are pruned while walking. Descriptor files
 * ({@code module-info.java}, {@code package-info.java}) are skipped since they declare no methods.
 * The result is sorted by relative path using '/' separators.</p>
 */
public final class SourceScanner {

    private static final Set<String> PRUNED_DIRS = Set.of(
            "target", "build", "out", "bin", ".git", ".idea", ".gradle", ".mvn", "node_modules"
    );

    private static final Set<String> DESCRIPTOR_FILES = Set.of("module-info.java", "package-info.java");

    private SourceScanner() {}

    /**
     * Scan for source files under {@code sourceRoot}.
     *
     * @param excludeGlobs glob patterns matched against the path relative to {@code sourceRoot}
     *                     ('/' separators). A pattern without wildcards excludes that directory.
     * @param includeTests whether to keep files under test folders ({@code src/test}, {@code test}, {@code tests})
     */
    public static List<Path> scan(Path sourceRoot, List<String> excludeGlobs, boolean includeTests) throws IOException {
        Objects.requireNonNull(sourceRoot, "sourceRoot");
        final Path root = sourceRoot.toAbsolutePath().normalize();
        final List<PathMatcher> excludes = compileExcludes(excludeGlobs);
        final List<Path> out = new ArrayList<>();

        Files.walkFileTree(root, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                if (dir.equals(root)) return FileVisitResult.CONTINUE;
                String name = dir.getFileName().toString();
                if (PRUNED_DIRS.contains(name)) return FileVisitResult.SKIP_SUBTREE;
                String rel = relative(root, dir);
                if (!includeTests && isTestDirectory(rel)) return FileVisitResult.SKIP_SUBTREE;
                if (matches(excludes, rel)) return FileVisitResult.SKIP_SUBTREE;
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                String name = file.getFileName().toString();
                if (!attrs.isRegularFile() || !name.endsWith(".java")) return FileVisitResult.CONTINUE;
                if (DESCRIPTOR_FILES.contains(name)) return FileVisitResult.CONTINUE;
                if (matches(excludes, relative(root, file))) return FileVisitResult.CONTINUE;
                out.add(file);
                return FileVisitResult.CONTINUE;
            }
        });

        out.sort(Comparator.comparing(p -> relative(root, p)));
        return out;
    }

    static boolean isTestDirectory(String rel) {
        return rel.equals("test")
                || rel.equals("tests")
                || rel.endsWith("/test")
                || rel.endsWith("/tests")
                || rel.equals("src/integrationTest")
                || rel.endsWith("/src/integrationTest")
                || rel.equals("src/it")
                || rel.endsWith("/src/it");
    }

    private static List<PathMatcher> compileExcludes(List<String> excludeGlobs) {
        List<PathMatcher> out = new ArrayList<>();
        if (excludeGlobs == null) return out;
        for (String raw : excludeGlobs) {
            if (raw == null || raw.isBlank()) continue;
            String pattern = raw.trim().replace('\\', '/');
            if (!pattern.contains("*") && !pattern.contains("?") && !pattern.contains("[")) {
                // Plain directory: match it and everything below it.
                if (pattern.endsWith("/")) pattern = pattern.substring(0, pattern.length() - 1);
                pattern = "{" + pattern + "," + pattern + "/**}";
            }
            out.add(FileSystems.getDefault().getPathMatcher("glob:" + pattern));
        }
        return out;
    }

    private static boolean matches(List<PathMatcher> matchers, String rel) {
        if (matchers.isEmpty()) return false;
        Path p = Path.of(rel);
        for (PathMatcher m : matchers) {
            if (m.matches(p)) return true;
        }
        return false;
    }

    static String relative(Path root, Path p) {
        return root.relativize(p).toString().replace('\\', '/');
    }
}
