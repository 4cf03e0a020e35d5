package info.isaksson.erland.javatoseq.extract;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.symbolsolver.JavaSymbolSolver;
import com.github.javaparser.symbolsolver.resolution.typesolvers.CombinedTypeSolver;
import com.github.javaparser.symbolsolver.resolution.typesolvers.JarTypeSolver;
import com.github.javaparser.symbolsolver.resolution.typesolvers.JavaParserTypeSolver;
import com.github.javaparser.symbolsolver.resolution.typesolvers.ReflectionTypeSolver;
import info.isaksson.erland.javatoseq.model.CallerIndex;
import info.isaksson.erland.javatoseq.model.JModule;
import info.isaksson.erland.javatoseq.model.JProgram;
import info.isaksson.erland.javatoseq.model.SourceUnit;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Loads a whole program for analysis.
 *
 * <ol>
 *   <li>{@link JavaCompilationUnitParser}: parse every module's files (parse errors are collected, not thrown)</li>
 *   <li>register one {@link JavaParserTypeSolver} per source root implied by the parsed package declarations,
 *       plus the JDK ({@link ReflectionTypeSolver}) and any classpath jars</li>
 *   <li>{@link CallerIndexBuilder}: resolve every call site once into the caller index</li>
 * </ol>
 */
public final class JavaProgramLoader {

    private final List<Path> classpath;

    public JavaProgramLoader() {
        this(List.of());
    }

    /** @param classpath jar files whose types should resolve (library receivers, return types) */
    public JavaProgramLoader(List<Path> classpath) {
        this.classpath = classpath == null ? List.of() : List.copyOf(classpath);
    }

    public JProgram load(Path sourceRoot, List<JModule> modules) throws IOException {
        if (sourceRoot == null) throw new IllegalArgumentException("sourceRoot must not be null");
        JProgram program = new JProgram(sourceRoot.toAbsolutePath().normalize(), modules);

        CombinedTypeSolver typeSolver = new CombinedTypeSolver();
        typeSolver.add(new ReflectionTypeSolver());
        for (Path jar : classpath) {
            if (!Files.isRegularFile(jar)) throw new IOException("classpath entry is not a file: " + jar);
            typeSolver.add(new JarTypeSolver(jar));
        }

        ParserConfiguration cfg = baseConfiguration();
        cfg.setSymbolResolver(new JavaSymbolSolver(typeSolver));
        JavaParser parser = new JavaParser(cfg);

        // 1) Parse
        program.units.addAll(JavaCompilationUnitParser.parseAll(parser, program));

        // 2) Source roots for cross-file resolution
        Set<Path> roots = new LinkedHashSet<>();
        for (SourceUnit unit : program.units) {
            JavaCompilationUnitParser.sourceRootOf(unit).ifPresent(roots::add);
        }
        for (Path root : roots) {
            typeSolver.add(new JavaParserTypeSolver(root, baseConfiguration()));
        }

        // 3) Caller index, computed once for the whole run
        JavaParserSourceModel model = new JavaParserSourceModel(typeSolver);
        CallerIndex index = CallerIndexBuilder.build(program, model);
        program.attach(model.withCallerIndex(index));
        return program;
    }

    private static ParserConfiguration baseConfiguration() {
        ParserConfiguration cfg = new ParserConfiguration();
        cfg.setCharacterEncoding(StandardCharsets.UTF_8);
        cfg.setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_17);
        return cfg;
    }
}
