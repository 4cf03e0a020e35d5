package info.isaksson.erland.javatoseq.diagram;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * JSON serialization of generated diagrams.
 *
 * <p>Diagrams are written in the order given; line order is never changed.</p>
 */
public final class DiagramJson {

    private static final ObjectMapper MAPPER = createMapper();
    private static final DefaultPrettyPrinter PRETTY = createPrettyPrinter();

    private DiagramJson() {}

    public static DiagramDocument read(Path path) throws IOException {
        if (path == null) throw new IllegalArgumentException("path is null");
        try (var in = Files.newInputStream(path)) {
            return MAPPER.readValue(in, DiagramDocument.class);
        }
    }

    public static DiagramDocument readFromString(String json) throws IOException {
        if (json == null) throw new IllegalArgumentException("json is null");
        return MAPPER.readValue(json, DiagramDocument.class);
    }

    public static void write(Map<String, List<String>> diagrams, Path path) throws IOException {
        if (path == null) throw new IllegalArgumentException("path is null");
        Files.createDirectories(path.toAbsolutePath().normalize().getParent());
        try (var out = Files.newOutputStream(path)) {
            MAPPER.writer(PRETTY).writeValue(out, DiagramDocument.of(diagrams));
            out.write('\n');
        }
    }

    public static String toJsonString(Map<String, List<String>> diagrams) throws IOException {
        return MAPPER.writer(PRETTY).writeValueAsString(DiagramDocument.of(diagrams)) + "\n";
    }

    private static ObjectMapper createMapper() {
        ObjectMapper om = new ObjectMapper();
        // Prevent Jackson from closing the provided OutputStream/Writer.
        om.getFactory().disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET);
        om.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return om;
    }

    private static DefaultPrettyPrinter createPrettyPrinter() {
        DefaultPrettyPrinter pp = new DefaultPrettyPrinter();
        DefaultIndenter indenter = new DefaultIndenter("  ", "\n");
        pp.indentObjectsWith(indenter);
        pp.indentArraysWith(indenter);
        return pp;
    }
}
