package info.isaksson.erland.javatoseq.io;

import info.isaksson.erland.javatoseq.model.JModule;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Groups scanned source files into modules.
 *
 * <p>A directory is a module if it holds a build descriptor ({@code pom.xml}, {@code build.gradle},
 * {@code build.gradle.kts}) or a {@code src/main/java} folder. Each file belongs to its deepest
 * enclosing module directory; files outside every module directory belong to the source root, which
 * is always a module.</p>
 */
public final class ModuleDiscovery {

    private static final List<String> MODULE_MARKERS = List.of("pom.xml", "build.gradle", "build.gradle.kts", "src/main/java");

    private ModuleDiscovery() {}

    /**
     * @param rootModuleName name for the module rooted at {@code sourceRoot}; the directory name when blank
     */
    public static List<JModule> group(Path sourceRoot, List<Path> files, String rootModuleName) {
        Path root = sourceRoot.toAbsolutePath().normalize();
        String rootName = (rootModuleName != null && !rootModuleName.isBlank()) ? rootModuleName : directoryName(root);

        Map<Path, List<Path>> byModuleDir = new LinkedHashMap<>();
        Map<Path, Boolean> isModuleDirCache = new HashMap<>();
        for (Path f : files) {
            Path file = f.toAbsolutePath().normalize();
            Path dir = owningModuleDir(root, file, isModuleDirCache);
            byModuleDir.computeIfAbsent(dir, k -> new ArrayList<>()).add(file);
        }

        List<Path> dirs = new ArrayList<>(byModuleDir.keySet());
        dirs.sort(Comparator.comparing(d -> d.equals(root) ? "" : SourceScanner.relative(root, d)));

        Map<String, Integer> nameCounts = new HashMap<>();
        for (Path d : dirs) {
            nameCounts.merge(d.equals(root) ? rootName : directoryName(d), 1, Integer::sum);
        }

        List<JModule> out = new ArrayList<>();
        for (Path d : dirs) {
            String name;
            if (d.equals(root)) {
                name = rootName;
            } else {
                name = directoryName(d);
                if (nameCounts.get(name) > 1) {
                    name = SourceScanner.relative(root, d).replace('/', '-');
                }
            }
            out.add(new JModule(name, d, byModuleDir.get(d)));
        }
        return out;
    }

    /** All files in one module rooted at {@code sourceRoot}. */
    public static List<JModule> single(Path sourceRoot, List<Path> files, String moduleName) {
        Path root = sourceRoot.toAbsolutePath().normalize();
        String name = (moduleName != null && !moduleName.isBlank()) ? moduleName : directoryName(root);
        List<Path> normalized = new ArrayList<>();
        for (Path f : files) normalized.add(f.toAbsolutePath().normalize());
        return List.of(new JModule(name, root, normalized));
    }

    private static Path owningModuleDir(Path root, Path file, Map<Path, Boolean> cache) {
        Path dir = file.getParent();
        while (dir != null && dir.startsWith(root) && !dir.equals(root)) {
            if (cache.computeIfAbsent(dir, ModuleDiscovery::isModuleDir)) return dir;
            dir = dir.getParent();
        }
        return root;
    }

    static boolean isModuleDir(Path dir) {
        for (String marker : MODULE_MARKERS) {
            if (Files.exists(dir.resolve(marker))) return true;
        }
        return false;
    }

    private static String directoryName(Path p) {
        Path name = p.getFileName();
        return name == null ? "module" : name.toString();
    }
}
