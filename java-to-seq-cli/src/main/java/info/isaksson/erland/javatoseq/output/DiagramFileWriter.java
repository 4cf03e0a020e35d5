package info.isaksson.erland.javatoseq.output;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Writes each diagram to {@code <title>.puml}.
 *
 * <p>Characters outside {@code [A-Za-z0-9._-]} in titles are replaced by '_' for the file name. Titles
 * that map to the same file name get a numeric suffix ({@code -2}, {@code -3}, ...).</p>
 */
public final class DiagramFileWriter {

    public static final String EXTENSION = ".puml";

    private DiagramFileWriter() {}

    /** @return the written files, in diagram order */
    public static List<Path> writeAll(Map<String, List<String>> diagrams, Path outputDir) throws IOException {
        if (outputDir == null) throw new IllegalArgumentException("outputDir must not be null");
        Files.createDirectories(outputDir);

        List<Path> written = new ArrayList<>();
        Set<String> used = new HashSet<>();
        for (Map.Entry<String, List<String>> e : diagrams.entrySet()) {
            String base = sanitize(e.getKey());
            String name = base;
            for (int n = 2; !used.add(name.toLowerCase()); n++) {
                name = base + "-" + n;
            }
            Path file = outputDir.resolve(name + EXTENSION);
            Files.writeString(file, render(e.getValue()), StandardCharsets.UTF_8);
            written.add(file);
        }
        return written;
    }

    /** Lines joined with '\n', plus a trailing newline. */
    public static String render(List<String> lines) {
        return String.join("\n", lines) + "\n";
    }

    static String sanitize(String title) {
        if (title == null || title.isBlank()) return "diagram";
        StringBuilder sb = new StringBuilder(title.length());
        for (char c : title.toCharArray()) {
            boolean ok = (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z') || (c >= '0' && c <= '9')
                    || c == '.' || c == '_' || c == '-';
            sb.append(ok ? c : '_');
        }
        return sb.toString();
    }
}
