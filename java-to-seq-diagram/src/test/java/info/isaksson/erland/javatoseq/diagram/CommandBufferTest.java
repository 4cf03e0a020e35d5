package info.isaksson.erland.javatoseq.diagram;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class CommandBufferTest {

    @Test
    void addOrCollapseRemovesOnlyTheMatchingMostRecentLine() {
        CommandBuffer b = new CommandBuffer();
        b.add("group for");
        b.add("  group if");

        assertFalse(b.addOrCollapse("  end", "  group if"));
        assertEquals(List.of("group for"), b.lines());

        assertFalse(b.addOrCollapse("end", "group for"));
        assertEquals(List.of(), b.lines());
    }

    @Test
    void addOrCollapseAppendsWhenTheBodyWroteSomething() {
        CommandBuffer b = new CommandBuffer();
        b.add("group while");
        b.add("  A -> A: run");
        b.add("  A --> A: void");

        assertTrue(b.addOrCollapse("end", "group while"));
        assertEquals("end", b.last());
        assertEquals(4, b.size());
    }

    @Test
    void collapseNeverLooksPastTheLastLine() {
        CommandBuffer b = new CommandBuffer();
        b.add("group if");
        b.add("  group if");
        b.add("    A -> A: x");
        b.add("    A --> A: void");
        b.add("  end");

        // Same kind, different depth: the outer opening line is not the most recent one.
        assertTrue(b.addOrCollapse("end", "group if"));
        assertEquals(6, b.size());
    }

    @Test
    void linesSnapshotIsImmutable() {
        CommandBuffer b = new CommandBuffer();
        b.add("x");
        assertThrows(UnsupportedOperationException.class, () -> b.lines().add("y"));
        assertNull(new CommandBuffer().last());
    }
}
