package info.isaksson.erland.javatoseq.report;

import info.isaksson.erland.javatoseq.core.JavaToSeqResult;
import info.isaksson.erland.javatoseq.model.JModule;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Human-readable markdown report of one generation run.
 *
 * NOTE: "Unresolved methods" were not drawn because their declaration could not be resolved, so their
 * callers are unknown. "Unresolved call sites" are calls whose target could not be resolved (missing
 * classpath jars, excluded sources); they do not make their target a non-entry method.
 */
public final class ReportGenerator {

    private ReportGenerator() {}

    public static void writeMarkdown(Path reportPath,
                                     Path sourcePath,
                                     Path outputDir,
                                     JavaToSeqResult res,
                                     boolean includeTests,
                                     List<String> excludes,
                                     boolean drawUnresolved) throws IOException {
        Files.createDirectories(reportPath.toAbsolutePath().normalize().getParent());
        Files.writeString(reportPath, toMarkdown(sourcePath, outputDir, res, includeTests, excludes, drawUnresolved));
    }

    static String toMarkdown(Path sourcePath,
                             Path outputDir,
                             JavaToSeqResult res,
                             boolean includeTests,
                             List<String> excludes,
                             boolean drawUnresolved) {
        StringBuilder report = new StringBuilder();
        report.append("# java-to-seq report\n\n");

        report.append("## Summary\n\n");
        report.append("- Source: `").append(sourcePath).append("`\n");
        report.append("- Output: `").append(outputDir).append("`\n");
        report.append("- Modules: **").append(res.modules.size()).append("**\n");
        report.append("- Java files discovered: **").append(res.javaFiles.size()).append("**\n");
        report.append("- Diagrams: **").append(res.diagrams.size()).append("**\n");
        report.append("- Parse errors: **").append(res.parseErrors.size()).append("**\n");
        report.append("- Unresolved methods: **").append(res.unresolvedMethods.size()).append("**\n");
        report.append("- Unresolved call sites: **").append(res.unresolvedCallSites.size()).append("**\n");
        report.append("- Include tests: **").append(includeTests).append("**\n");
        report.append("- Draw unresolved methods: **").append(drawUnresolved).append("**\n");
        report.append("- Excludes: ").append(excludes == null || excludes.isEmpty() ? "_(none)_" : "`" + String.join("`, `", excludes) + "`").append("\n\n");

        report.append("## Modules\n\n");
        if (res.modules.isEmpty()) {
            report.append("_(none)_\n");
        } else {
            report.append("| Module | Directory | Files |\n");
            report.append("|---|---|---:|\n");
            for (JModule m : res.modules) {
                report.append("| `").append(m.name).append("` | `")
                        .append(relative(sourcePath, m.directory)).append("` | ")
                        .append(m.files.size()).append(" |\n");
            }
        }

        report.append("\n## Diagrams\n\n");
        if (res.diagrams.isEmpty()) {
            report.append("_(none)_\n");
        } else {
            report.append("| Title | Lines |\n");
            report.append("|---|---:|\n");
            for (Map.Entry<String, List<String>> e : res.diagrams.entrySet()) {
                report.append("| `").append(e.getKey()).append("` | ").append(e.getValue().size()).append(" |\n");
            }
        }

        appendList(report, "Parse errors", res.parseErrors);
        appendList(report, "Unresolved methods", res.unresolvedMethods);
        appendList(report, "Unresolved call sites", res.unresolvedCallSites);

        report.append("\n## Notes\n\n");
        report.append("- One diagram is produced per method that is never called from the analyzed sources.\n");
        report.append("- Only calls on a plain name (`bar()`, `x.bar()`, `Type.field`) are drawn; chained calls are traversed but not drawn.\n");
        report.append("- Add library jars with `--classpath` to resolve more receivers and return types.\n");
        return report.toString();
    }

    private static void appendList(StringBuilder report, String heading, List<String> items) {
        report.append("\n## ").append(heading).append("\n\n");
        if (items.isEmpty()) {
            report.append("_(none)_\n");
            return;
        }
        for (String s : items) {
            report.append("- ").append(s).append("\n");
        }
    }

    private static String relative(Path root, Path p) {
        if (root == null || p == null) return String.valueOf(p);
        Path r = root.toAbsolutePath().normalize();
        Path q = p.toAbsolutePath().normalize();
        if (r.equals(q)) return ".";
        if (!q.startsWith(r)) return q.toString().replace("\\", "/");
        return r.relativize(q).toString().replace("\\", "/");
    }
}
