package info.isaksson.erland.javatoseq.io;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class SourceScannerTest {

    private static void write(Path root, String rel, String code) throws Exception {
        Path p = root.resolve(rel);
        Files.createDirectories(p.getParent());
        Files.writeString(p, code);
    }

    private static List<String> rel(Path root, List<Path> files) {
        return files.stream().map(f -> root.relativize(f).toString().replace("\\", "/")).collect(Collectors.toList());
    }

    @Test
    void scansSortedAndPrunesBuildFolders(@TempDir Path tmp) throws Exception {
        write(tmp, "src/main/java/com/acme/B.java", "package com.acme; class B {}");
        write(tmp, "src/main/java/com/acme/A.java", "package com.acme; class A {}");
        write(tmp, "target/generated-sources/Gen.java", "class Gen {}");
        write(tmp, "sub/build/Out.java", "class Out {}");

        List<Path> files = SourceScanner.scan(tmp, List.of(), false);

        assertEquals(List.of("src/main/java/com/acme/A.java", "src/main/java/com/acme/B.java"), rel(tmp, files));
    }

    @Test
    void skipsDescriptorFiles(@TempDir Path tmp) throws Exception {
        write(tmp, "src/main/java/module-info.java", "module m {}");
        write(tmp, "src/main/java/p/package-info.java", "package p;");
        write(tmp, "src/main/java/p/A.java", "package p; class A {}");

        assertEquals(List.of("src/main/java/p/A.java"), rel(tmp, SourceScanner.scan(tmp, List.of(), false)));
    }

    @Test
    void excludesTestFoldersByDefaultButCanInclude(@TempDir Path tmp) throws Exception {
        write(tmp, "src/main/java/p/A.java", "package p; class A {}");
        write(tmp, "src/test/java/p/ATest.java", "package p; class ATest {}");
        write(tmp, "core/src/test/java/p/CoreTest.java", "package p; class CoreTest {}");

        assertEquals(List.of("src/main/java/p/A.java"), rel(tmp, SourceScanner.scan(tmp, List.of(), false)));
        assertEquals(3, SourceScanner.scan(tmp, List.of(), true).size());
    }

    @Test
    void supportsGlobAndPlainDirectoryExcludes(@TempDir Path tmp) throws Exception {
        write(tmp, "src/main/java/p/Keep.java", "package p; class Keep {}");
        write(tmp, "src/main/java/p/generated/Gen.java", "package p.generated; class Gen {}");
        write(tmp, "legacy/Old.java", "class Old {}");

        List<Path> files = SourceScanner.scan(tmp, List.of("**/generated/**", "legacy"), false);

        assertEquals(List.of("src/main/java/p/Keep.java"), rel(tmp, files));
    }
}
