package info.isaksson.erland.javatoseq.output;

import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class DiagramFileWriterTest {

    @Test
    void writesOneFilePerDiagramWithTrailingNewline() throws Exception {
        Path out = Files.createTempDirectory("j2s-writer-").resolve("nested");
        Map<String, List<String>> diagrams = new LinkedHashMap<>();
        diagrams.put("Asm_Foo_m", List.of("@startuml", "title Asm_Foo_m", "autoactivate on", "hide footbox",
                "Foo -> Foo: bar", "Foo --> Foo: void", "@enduml"));

        List<Path> written = DiagramFileWriter.writeAll(diagrams, out);

        assertEquals(List.of(out.resolve("Asm_Foo_m.puml")), written);
        assertEquals("@startuml\ntitle Asm_Foo_m\nautoactivate on\nhide footbox\nFoo -> Foo: bar\nFoo --> Foo: void\n@enduml\n",
                Files.readString(written.get(0)));
    }

    @Test
    void unsafeTitlesAreSanitizedAndKeptApart() throws Exception {
        Path out = Files.createTempDirectory("j2s-writer-names-");
        Map<String, List<String>> diagrams = new LinkedHashMap<>();
        diagrams.put("my app_Foo$Bar_run", List.of("@startuml"));
        diagrams.put("my/app_Foo$Bar_run", List.of("@startuml"));

        List<Path> written = DiagramFileWriter.writeAll(diagrams, out);

        assertEquals("my_app_Foo_Bar_run.puml", written.get(0).getFileName().toString());
        assertEquals("my_app_Foo_Bar_run-2.puml", written.get(1).getFileName().toString());
        assertEquals("diagram", DiagramFileWriter.sanitize(" "));
    }
}
