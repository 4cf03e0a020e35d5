package info.isaksson.erland.javatoseq.core;

import info.isaksson.erland.javatoseq.emitter.EmitResult;
import info.isaksson.erland.javatoseq.emitter.EmitterOptions;
import info.isaksson.erland.javatoseq.emitter.SequenceDiagramEmitter;
import info.isaksson.erland.javatoseq.extract.JavaProgramLoader;
import info.isaksson.erland.javatoseq.io.ModuleDiscovery;
import info.isaksson.erland.javatoseq.io.SourceScanner;
import info.isaksson.erland.javatoseq.model.JModule;
import info.isaksson.erland.javatoseq.model.JProgram;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Core (server-friendly) API for generating PlantUML sequence diagrams.
 *
 * <p>CLI and server wrappers should use this class instead of re-implementing the pipeline.</p>
 */
public final class JavaToSeqService {

    /** Generate one sequence diagram per entry-point method found under {@code sourceRoot}. */
    public JavaToSeqResult generateFromSource(Path sourceRoot, List<String> excludeGlobs, JavaToSeqOptions options) throws IOException {
        if (sourceRoot == null) throw new IllegalArgumentException("sourceRoot must not be null");
        if (!Files.isDirectory(sourceRoot)) throw new IllegalArgumentException("sourceRoot is not a directory: " + sourceRoot);
        if (options == null) options = new JavaToSeqOptions();

        List<Path> javaFiles = SourceScanner.scan(sourceRoot, excludeGlobs == null ? List.of() : excludeGlobs, options.includeTests);

        List<JModule> modules = options.discoverModules
                ? ModuleDiscovery.group(sourceRoot, javaFiles, options.moduleName)
                : ModuleDiscovery.single(sourceRoot, javaFiles, options.moduleName);

        JProgram program = new JavaProgramLoader(options.classpath).load(sourceRoot, modules);

        EmitterOptions emitterOptions = new EmitterOptions();
        emitterOptions.parallelism = options.parallelism;
        emitterOptions.drawUnresolvedMethods = options.drawUnresolvedMethods;
        EmitResult emitted = new SequenceDiagramEmitter().emit(program, emitterOptions);

        return new JavaToSeqResult(
                emitted.diagrams,
                program.modules,
                javaFiles,
                program.parseErrors,
                emitted.unresolvedMethods,
                program.unresolvedCallSites
        );
    }
}
