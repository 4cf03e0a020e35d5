package info.isaksson.erland.javatoseq.extract;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ast.CompilationUnit;
import info.isaksson.erland.javatoseq.model.JModule;
import info.isaksson.erland.javatoseq.model.JProgram;
import info.isaksson.erland.javatoseq.model.SourceUnit;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Parses every module's files into {@link SourceUnit}s. Files that fail to parse are recorded in
 * {@link JProgram#parseErrors} and skipped.
 */
final class JavaCompilationUnitParser {

    private JavaCompilationUnitParser() {}

    static List<SourceUnit> parseAll(JavaParser parser, JProgram program) {
        List<SourceUnit> units = new ArrayList<>();
        for (JModule module : program.modules) {
            for (Path f : module.files) {
                parseOne(parser, program, module, f).ifPresent(units::add);
            }
        }
        return units;
    }

    private static Optional<SourceUnit> parseOne(JavaParser parser, JProgram program, JModule module, Path f) {
        String where = module.name + "/" + rel(program.sourceRoot, f);
        try {
            String code = Files.readString(f, StandardCharsets.UTF_8);
            ParseResult<CompilationUnit> result = parser.parse(code);
            if (!result.isSuccessful() || result.getResult().isEmpty()) {
                program.parseErrors.add(where + ": parse error (" + result.getProblems().size() + " problems)");
                return Optional.empty();
            }
            CompilationUnit cu = result.getResult().get();
            cu.setStorage(f, StandardCharsets.UTF_8);
            return Optional.of(new SourceUnit(module.name, f, cu));
        } catch (IOException e) {
            program.parseErrors.add(where + ": IO error (" + e.getMessage() + ")");
        } catch (RuntimeException e) {
            program.parseErrors.add(where + ": error (" + e.getClass().getSimpleName() + ": " + e.getMessage() + ")");
        }
        return Optional.empty();
    }

    /** Source root implied by the unit's package declaration, if the file path agrees with it. */
    static Optional<Path> sourceRootOf(SourceUnit unit) {
        Path dir = unit.file.toAbsolutePath().normalize().getParent();
        if (dir == null) return Optional.empty();
        String pkg = unit.cu.getPackageDeclaration().map(pd -> pd.getNameAsString()).orElse("");
        if (pkg.isEmpty()) return Optional.of(dir);
        String[] parts = pkg.split("\\.");
        for (int i = parts.length - 1; i >= 0; i--) {
            if (dir == null || dir.getFileName() == null || !dir.getFileName().toString().equals(parts[i])) {
                return Optional.empty();
            }
            dir = dir.getParent();
        }
        return Optional.ofNullable(dir);
    }

    private static String rel(Path root, Path file) {
        if (root == null) return file.toString().replace('\\', '/');
        try {
            return root.relativize(file).toString().replace('\\', '/');
        } catch (IllegalArgumentException e) {
            return file.toString().replace('\\', '/');
        }
    }
}
