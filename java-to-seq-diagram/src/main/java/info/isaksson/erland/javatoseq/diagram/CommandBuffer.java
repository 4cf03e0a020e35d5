package info.isaksson.erland.javatoseq.diagram;

import java.util.ArrayList;
import java.util.List;

/**
 * Ordered, append-only PlantUML command lines of one sequence diagram.
 *
 * <p>The only way to take a line back is {@link #addOrCollapse(String, String)}, which looks at the
 * single most recent line and never further back.</p>
 */
public final class CommandBuffer {

    private final List<String> lines = new ArrayList<>();

    public void add(String line) {
        if (line == null) throw new IllegalArgumentException("line must not be null");
        lines.add(line);
    }

    /**
     * Append {@code line} unless the most recent line equals {@code unlessFollowing}.
     * In that case the most recent line is removed and nothing is appended.
     *
     * @return true if {@code line} was appended, false if the previous line was collapsed
     */
    public boolean addOrCollapse(String line, String unlessFollowing) {
        if (unlessFollowing != null && !lines.isEmpty() && unlessFollowing.equals(last())) {
            lines.remove(lines.size() - 1);
            return false;
        }
        add(line);
        return true;
    }

    /** Remove the most recent line if it equals {@code expected}. */
    boolean retractLast(String expected) {
        if (lines.isEmpty() || !lines.get(lines.size() - 1).equals(expected)) return false;
        lines.remove(lines.size() - 1);
        return true;
    }

    public String last() {
        return lines.isEmpty() ? null : lines.get(lines.size() - 1);
    }

    public int size() {
        return lines.size();
    }

    public List<String> lines() {
        return List.copyOf(lines);
    }

    @Override
    public String toString() {
        return String.join("\n", lines);
    }
}
