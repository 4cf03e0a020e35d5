package info.isaksson.erland.javatoseq;

import info.isaksson.erland.javatoseq.core.JavaToSeqOptions;
import info.isaksson.erland.javatoseq.core.JavaToSeqResult;
import info.isaksson.erland.javatoseq.core.JavaToSeqService;
import info.isaksson.erland.javatoseq.diagram.DiagramJson;
import info.isaksson.erland.javatoseq.output.DiagramFileWriter;
import info.isaksson.erland.javatoseq.report.ReportGenerator;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * CLI entrypoint: scan a source tree, write one {@code .puml} file per entry-point method, plus a
 * markdown report and an optional JSON export.
 */
public final class Main {

    private static final JavaToSeqService SERVICE = new JavaToSeqService();

    public static void main(String[] args) {
        System.exit(run(args));
    }

    /**
     * Testable entrypoint that returns an exit code instead of calling System.exit.
     */
    public static int run(String[] args) {
        CliArgs parsed;
        try {
            parsed = CliArgs.parse(args);
        } catch (IllegalArgumentException ex) {
            System.err.println("Error: " + ex.getMessage());
            System.err.println();
            CliArgs.printHelp();
            return 1;
        }

        if (parsed.help) {
            CliArgs.printHelp();
            return 0;
        }

        if (parsed.source == null) {
            System.err.println("Error: --source is required.");
            System.err.println();
            CliArgs.printHelp();
            return 1;
        }

        final Path sourcePath = Paths.get(parsed.source).toAbsolutePath().normalize();
        if (!Files.exists(sourcePath)) {
            System.err.println("Error: --source does not exist: " + sourcePath);
            return 1;
        }
        if (!Files.isDirectory(sourcePath)) {
            System.err.println("Error: --source must be a directory: " + sourcePath);
            return 1;
        }

        final Path outDir = Paths.get(parsed.output).toAbsolutePath().normalize();
        final Path reportOut = resolveReportOutput(parsed.report, outDir);

        try {
            Files.createDirectories(outDir);
        } catch (IOException e) {
            System.err.println("Error: could not create output directory.");
            System.err.println(e.getMessage());
            return 2;
        }

        // Core pipeline (scan + load + index + walk)
        final JavaToSeqResult res;
        final List<Path> written;
        try {
            res = SERVICE.generateFromSource(sourcePath, parsed.excludes, toCoreOptions(parsed));
            written = DiagramFileWriter.writeAll(res.diagrams, outDir);
        } catch (RuntimeException | IOException e) {
            System.err.println("Error: diagram generation failed.");
            System.err.println(e.getMessage());
            return 2;
        }

        // Optional: JSON export of all diagrams
        if (parsed.writeJson != null && !parsed.writeJson.isBlank()) {
            final Path jsonOut = resolveJsonOutput(parsed.writeJson);
            try {
                DiagramJson.write(res.diagrams, jsonOut);
            } catch (IOException e) {
                System.err.println("Error: could not write JSON to: " + jsonOut);
                System.err.println(e.getMessage());
                return 2;
            }
        }

        try {
            ReportGenerator.writeMarkdown(
                    reportOut,
                    sourcePath,
                    outDir,
                    res,
                    parsed.includeTests,
                    parsed.excludes,
                    parsed.drawUnresolved
            );
        } catch (IOException e) {
            System.err.println("Error: could not write report to: " + reportOut);
            System.err.println(e.getMessage());
            return 2;
        }

        System.out.println(
                "java-to-seq\n" +
                "- Source: " + sourcePath + "\n" +
                "- Output: " + outDir + "\n" +
                "- Report: " + reportOut + "\n" +
                "- Modules: " + res.modules.size() + "\n" +
                "- Java files: " + res.javaFiles.size() + "\n" +
                "- Diagrams: " + written.size() + "\n" +
                "- Parse errors: " + res.parseErrors.size() + "\n" +
                "- Unresolved methods: " + res.unresolvedMethods.size() + "\n" +
                "- Unresolved call sites: " + res.unresolvedCallSites.size()
        );
        for (String pe : res.parseErrors) {
            System.err.println("Warning: " + pe);
        }
        return 0;
    }

    private static JavaToSeqOptions toCoreOptions(CliArgs parsed) {
        JavaToSeqOptions o = new JavaToSeqOptions();
        o.moduleName = parsed.name;
        o.includeTests = parsed.includeTests;
        o.parallelism = parsed.parallelism;
        o.drawUnresolvedMethods = parsed.drawUnresolved;
        for (String jar : parsed.classpath) {
            o.classpath.add(Paths.get(jar).toAbsolutePath().normalize());
        }
        return o;
    }

    private static Path resolveJsonOutput(String jsonArg) {
        if (jsonArg.toLowerCase().endsWith(".json")) {
            return Paths.get(jsonArg).toAbsolutePath().normalize();
        }
        return Paths.get(jsonArg).toAbsolutePath().normalize().resolve("diagrams.json");
    }

    private static Path resolveReportOutput(String reportArg, Path outDir) {
        if (reportArg != null && !reportArg.isBlank()) {
            return Paths.get(reportArg).toAbsolutePath().normalize();
        }
        return outDir.resolve("report.md");
    }

    /** Minimal CLI argument parsing without external dependencies. */
    static final class CliArgs {
        boolean help = false;
        String source;
        String output = "./output";
        String name;
        String report;
        String writeJson;

        boolean includeTests = false;
        final List<String> excludes = new ArrayList<>();
        final List<String> classpath = new ArrayList<>();

        int parallelism = 1;
        boolean drawUnresolved = false;

        static CliArgs parse(String[] args) {
            CliArgs out = new CliArgs();

            for (int i = 0; i < args.length; i++) {
                String a = args[i];
                if (a == null) continue;

                // support --exclude=glob
                if (a.startsWith("--exclude=")) {
                    out.excludes.add(a.substring("--exclude=".length()));
                    continue;
                }

                switch (a) {
                    case "--help":
                    case "-h":
                        out.help = true;
                        break;
                    case "--source":
                        out.source = requireValue(args, ++i, "--source");
                        break;
                    case "--output":
                        out.output = requireValue(args, ++i, "--output");
                        break;
                    case "--name":
                        out.name = requireValue(args, ++i, "--name");
                        break;
                    case "--report":
                        out.report = requireValue(args, ++i, "--report");
                        break;
                    case "--write-json":
                        out.writeJson = requireValue(args, ++i, "--write-json");
                        break;
                    case "--exclude":
                        out.excludes.add(requireValue(args, ++i, "--exclude"));
                        break;
                    case "--include-tests":
                        out.includeTests = true;
                        break;
                    case "--classpath":
                        for (String jar : requireValue(args, ++i, "--classpath").split(java.io.File.pathSeparator)) {
                            if (!jar.isBlank()) out.classpath.add(jar.trim());
                        }
                        break;
                    case "--parallelism":
                        out.parallelism = parsePositiveInt(requireValue(args, ++i, "--parallelism"), "--parallelism");
                        break;
                    case "--draw-unresolved":
                        out.drawUnresolved = parseBoolean(requireValue(args, ++i, "--draw-unresolved"), "--draw-unresolved");
                        break;
                    default:
                        if (a.startsWith("--")) {
                            throw new IllegalArgumentException("Unknown argument: " + a);
                        }
                        // allow a bare path as shorthand for --source
                        if (out.source == null) {
                            out.source = a;
                        } else {
                            throw new IllegalArgumentException("Unexpected extra argument: " + a);
                        }
                }
            }

            return out;
        }

        static String requireValue(String[] args, int index, String flag) {
            if (index >= args.length) {
                throw new IllegalArgumentException("Missing value for " + flag);
            }
            String v = args[index];
            if (v == null || v.isBlank() || v.startsWith("--")) {
                throw new IllegalArgumentException("Invalid value for " + flag + ": " + v);
            }
            return v;
        }

        static boolean parseBoolean(String v, String flag) {
            if (v == null) throw new IllegalArgumentException("Missing value for " + flag);
            String s = v.trim().toLowerCase();
            if (s.equals("true") || s.equals("1") || s.equals("yes")) return true;
            if (s.equals("false") || s.equals("0") || s.equals("no")) return false;
            throw new IllegalArgumentException("Invalid boolean for " + flag + ": " + v);
        }

        static int parsePositiveInt(String v, String flag) {
            try {
                int n = Integer.parseInt(v.trim());
                if (n < 1) throw new IllegalArgumentException("Value for " + flag + " must be >= 1: " + v);
                return n;
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid number for " + flag + ": " + v);
            }
        }

        static void printHelp() {
            System.out.println(
                    "java-to-seq\n" +
                    "\n" +
                    "Usage:\n" +
                    "  java -jar java-to-seq.jar --source <path> [--output <dir>] [options]\n" +
                    "\n" +
                    "Options:\n" +
                    "  --source <path>        Root folder containing Java sources (required)\n" +
                    "  --output <dir>         Folder for the .puml files and report.md (default: ./output)\n" +
                    "  --name <module>        Name of the module rooted at --source (default: folder name).\n" +
                    "                         Diagram titles are <module>_<Type>_<method>.\n" +
                    "  --exclude <glob>       Exclude paths matching glob (repeatable). Matches are evaluated\n" +
                    "                         against paths *relative to --source* using '/' separators.\n" +
                    "                         Also supports --exclude=<glob>.\n" +
                    "  --include-tests        Include common test folders (default: excluded)\n" +
                    "  --classpath <jars>     Library jars used to resolve types, separated by '" + java.io.File.pathSeparator + "'\n" +
                    "  --parallelism <n>      Compilation units walked concurrently (default: 1)\n" +
                    "  --draw-unresolved <bool>  Draw methods whose callers cannot be determined.\n" +
                    "                         Default: false (they are listed in the report instead).\n" +
                    "  --write-json <path>    Also write all diagrams as JSON (file.json or folder)\n" +
                    "  --report <file>        Report path (default: <output>/report.md)\n" +
                    "  -h, --help             Show help\n" +
                    "\n" +
                    "Examples:\n" +
                    "  java -jar target/java-to-seq.jar --source samples/mini --output out\n" +
                    "  java -jar target/java-to-seq.jar samples/mini\n" +
                    "  java -jar target/java-to-seq.jar --source . --exclude \"**/generated/**\" --parallelism 4\n"
            );
        }
    }
}
