package info.isaksson.erland.javatoseq.emitter;

import info.isaksson.erland.javatoseq.extract.JavaProgramLoader;
import info.isaksson.erland.javatoseq.io.ModuleDiscovery;
import info.isaksson.erland.javatoseq.io.SourceScanner;
import info.isaksson.erland.javatoseq.model.JProgram;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/** Shared helpers: write sources to a temp dir and load them as module {@code Asm}. */
final class EmitterFixtures {

    static final boolean DEBUG = Boolean.parseBoolean(System.getProperty("javaToSeq.debugTests", "false"));

    private EmitterFixtures() {}

    static JProgram load(Map<String, String> sources) throws Exception {
        Path root = Files.createTempDirectory("j2s-emit-");
        for (Map.Entry<String, String> e : sources.entrySet()) {
            Path p = root.resolve(e.getKey());
            Files.createDirectories(p.getParent());
            Files.writeString(p, e.getValue());
        }
        List<Path> files = SourceScanner.scan(root, List.of(), false);
        JProgram program = new JavaProgramLoader().load(root, ModuleDiscovery.group(root, files, "Asm"));
        assertTrue(program.parseErrors.isEmpty(), "parse errors: " + program.parseErrors);
        return program;
    }

    static Map<String, List<String>> emit(Map<String, String> sources) throws Exception {
        Map<String, List<String>> diagrams = new SequenceDiagramEmitter().emit(load(sources)).diagrams;
        if (DEBUG) {
            diagrams.forEach((t, lines) -> System.out.println("[DEBUG] " + t + "\n" + String.join("\n", lines)));
        }
        return diagrams;
    }

    static List<String> diagram(String title, String... body) {
        List<String> out = new ArrayList<>();
        out.add("@startuml");
        out.add("title " + title);
        out.add("autoactivate on");
        out.add("hide footbox");
        out.addAll(List.of(body));
        out.add("@enduml");
        return out;
    }

    /** Header, footer, balanced groups and matching call/return indentation. */
    static void assertWellFormed(List<String> lines) {
        assertTrue(lines.size() > 5, "diagram too short: " + lines);
        assertEquals("@startuml", lines.get(0));
        assertEquals("@enduml", lines.get(lines.size() - 1));
        Deque<Integer> open = new ArrayDeque<>();
        int depth = 0;
        for (String line : lines.subList(4, lines.size() - 1)) {
            int indent = (line.length() - line.stripLeading().length()) / 2;
            String text = line.strip();
            if (text.startsWith("group ")) {
                assertEquals(depth, indent, "group at wrong depth: " + line);
                open.push(indent);
                depth++;
            } else if (text.equals("end")) {
                assertFalse(open.isEmpty(), "unmatched end");
                depth--;
                assertEquals(open.pop(), indent, "end at wrong depth: " + line);
            } else {
                assertEquals(depth, indent, "edge at wrong depth: " + line);
            }
        }
        assertTrue(open.isEmpty(), "dangling group in " + lines);
    }
}
