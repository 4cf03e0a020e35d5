package info.isaksson.erland.javatoseq.diagram;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class DiagramStoreTest {

    @Test
    void beginWritesTheFourLineHeader() {
        DiagramStore store = new DiagramStore();
        CommandBuffer b = store.begin("Asm_Foo_m");

        assertEquals(List.of("@startuml", "title Asm_Foo_m", "autoactivate on", "hide footbox"), b.lines());
        assertEquals(DiagramStore.HEADER_LINES, b.size());
    }

    @Test
    void finishKeepsNonEmptyDiagramsAndDropsHeaderOnlyOnes() {
        DiagramStore store = new DiagramStore();

        store.begin("Asm_Foo_empty");
        assertFalse(store.finish("Asm_Foo_empty"));
        assertFalse(store.contains("Asm_Foo_empty"));

        CommandBuffer b = store.begin("Asm_Foo_m");
        b.add("Foo -> Foo: bar");
        b.add("Foo --> Foo: void");
        assertTrue(store.finish("Asm_Foo_m"));

        assertEquals(List.of(
                "@startuml", "title Asm_Foo_m", "autoactivate on", "hide footbox",
                "Foo -> Foo: bar", "Foo --> Foo: void", "@enduml"
        ), store.diagrams().get("Asm_Foo_m"));
        assertEquals(1, store.size());
    }

    @Test
    void recurringTitleContinuesTheKeptDiagram() {
        DiagramStore store = new DiagramStore();
        store.begin("M_T_run").add("T -> T: a");
        store.finish("M_T_run");

        CommandBuffer again = store.begin("M_T_run");
        again.add("T -> T: b");
        store.finish("M_T_run");

        List<String> lines = store.diagrams().get("M_T_run");
        assertEquals(List.of("@startuml", "title M_T_run", "autoactivate on", "hide footbox",
                "T -> T: a", "T -> T: b", "@enduml"), lines);
    }

    @Test
    void recurringTitleWithEmptySecondBodyStaysWellFormed() {
        DiagramStore store = new DiagramStore();
        store.begin("M_T_run").add("T -> T: a");
        store.finish("M_T_run");

        store.begin("M_T_run");
        assertTrue(store.finish("M_T_run"));
        assertEquals(1, store.diagrams().get("M_T_run").stream().filter("@enduml"::equals).count());
    }

    @Test
    void mergeBehavesLikeSequentialWalk() {
        DiagramStore sequential = new DiagramStore();
        sequential.begin("M_A_x").add("A -> A: one");
        sequential.finish("M_A_x");
        sequential.begin("M_B_y").add("B -> B: two");
        sequential.finish("M_B_y");
        sequential.begin("M_A_x").add("A -> A: three");
        sequential.finish("M_A_x");

        DiagramStore first = new DiagramStore();
        first.begin("M_A_x").add("A -> A: one");
        first.finish("M_A_x");
        first.begin("M_B_y").add("B -> B: two");
        first.finish("M_B_y");
        DiagramStore second = new DiagramStore();
        second.begin("M_A_x").add("A -> A: three");
        second.finish("M_A_x");

        DiagramStore merged = new DiagramStore();
        merged.merge(first);
        merged.merge(second);

        assertEquals(sequential.diagrams(), merged.diagrams());
        assertEquals(List.of("M_A_x", "M_B_y"), List.copyOf(merged.diagrams().keySet()));
    }

    @Test
    void rejectsBlankTitle() {
        assertThrows(IllegalArgumentException.class, () -> new DiagramStore().begin(" "));
    }
}
