package info.isaksson.erland.javatoseq.diagram;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * JSON form of a set of diagrams.
 */
@JsonPropertyOrder({"schemaVersion", "diagrams"})
public final class DiagramDocument {
    public final String schemaVersion;
    public final List<Entry> diagrams;

    @JsonCreator
    public DiagramDocument(
            @JsonProperty("schemaVersion") String schemaVersion,
            @JsonProperty("diagrams") List<Entry> diagrams
    ) {
        this.schemaVersion = schemaVersion == null ? "1.0" : schemaVersion;
        this.diagrams = diagrams == null ? List.of() : List.copyOf(diagrams);
    }

    public static DiagramDocument of(Map<String, List<String>> diagrams) {
        List<Entry> entries = new ArrayList<>();
        if (diagrams != null) {
            diagrams.forEach((title, lines) -> entries.add(new Entry(title, lines)));
        }
        return new DiagramDocument("1.0", entries);
    }

    /** Title to lines, in document order. */
    public Map<String, List<String>> toMap() {
        Map<String, List<String>> out = new LinkedHashMap<>();
        for (Entry e : diagrams) {
            if (e == null || e.title == null) continue;
            out.put(e.title, e.lines);
        }
        return out;
    }

    @JsonPropertyOrder({"title", "lines"})
    public static final class Entry {
        public final String title;
        public final List<String> lines;

        @JsonCreator
        public Entry(
                @JsonProperty("title") String title,
                @JsonProperty("lines") List<String> lines
        ) {
            this.title = title;
            this.lines = lines == null ? List.of() : List.copyOf(lines);
        }

        @Override public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Entry)) return false;
            Entry that = (Entry) o;
            return Objects.equals(title, that.title) && Objects.equals(lines, that.lines);
        }

        @Override public int hashCode() {
            return Objects.hash(title, lines);
        }
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DiagramDocument)) return false;
        DiagramDocument that = (DiagramDocument) o;
        return Objects.equals(schemaVersion, that.schemaVersion) && Objects.equals(diagrams, that.diagrams);
    }

    @Override public int hashCode() {
        return Objects.hash(schemaVersion, diagrams);
    }
}
