package info.isaksson.erland.javatoseq.diagram;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Title to {@link CommandBuffer} table for one emitter run.
 *
 * <p>A diagram survives {@link #finish(String)} only if something was written after its header.
 * Titles keep first-seen order.</p>
 */
public final class DiagramStore {

    /** Number of header lines written by {@link #begin(String)}; the survival threshold. */
    public static final int HEADER_LINES = 4;

    private final Map<String, CommandBuffer> diagrams = new LinkedHashMap<>();

    /**
     * Open the diagram for {@code title}, writing the header if it is new.
     *
     * <p>If the title was already finished and kept, its {@code @enduml} is retracted so the new body
     * continues the same diagram.</p>
     */
    public CommandBuffer begin(String title) {
        if (title == null || title.isBlank()) throw new IllegalArgumentException("title must not be blank");
        CommandBuffer existing = diagrams.get(title);
        if (existing != null) {
            existing.retractLast(PlantUml.END);
            return existing;
        }
        CommandBuffer buffer = new CommandBuffer();
        for (String line : PlantUml.header(title)) {
            buffer.add(line);
        }
        diagrams.put(title, buffer);
        return buffer;
    }

    /**
     * Close the diagram: keep it with a terminating {@code @enduml} if its body is non-empty,
     * otherwise drop it.
     *
     * @return true if the diagram was kept
     */
    public boolean finish(String title) {
        CommandBuffer buffer = diagrams.get(title);
        if (buffer == null) return false;
        if (buffer.size() > HEADER_LINES) {
            buffer.add(PlantUml.END);
            return true;
        }
        diagrams.remove(title);
        return false;
    }

    public boolean contains(String title) {
        return diagrams.containsKey(title);
    }

    public int size() {
        return diagrams.size();
    }

    /**
     * Fold the finished diagrams of {@code other} into this store, in {@code other}'s order.
     * A title present in both continues this store's diagram with the other body.
     */
    public void merge(DiagramStore other) {
        if (other == null || other == this) return;
        for (Map.Entry<String, CommandBuffer> e : other.diagrams.entrySet()) {
            CommandBuffer target = begin(e.getKey());
            List<String> lines = e.getValue().lines();
            for (int i = HEADER_LINES; i < lines.size(); i++) {
                target.add(lines.get(i));
            }
            if (!PlantUml.END.equals(target.last())) {
                finish(e.getKey());
            }
        }
    }

    /** Immutable snapshot: title to lines. */
    public Map<String, List<String>> diagrams() {
        Map<String, List<String>> out = new LinkedHashMap<>();
        for (Map.Entry<String, CommandBuffer> e : diagrams.entrySet()) {
            out.put(e.getKey(), e.getValue().lines());
        }
        return Collections.unmodifiableMap(out);
    }
}
