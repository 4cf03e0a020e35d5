package info.isaksson.erland.javatoseq.core;

import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end smoke test over a two-module source tree: module naming, cross-module callers,
 * test-folder exclusion and diagnostics.
 */
public class JavaToSeqServiceSmokeTest {

    private static final boolean DEBUG = Boolean.parseBoolean(System.getProperty("javaToSeq.debugTests", "false"));

    private static void write(Path root, String rel, String code) throws Exception {
        Path p = root.resolve(rel);
        Files.createDirectories(p.getParent());
        Files.writeString(p, code);
    }

    private static Path twoModuleTree() throws Exception {
        Path root = Files.createTempDirectory("j2s-smoke-");
        write(root, "pom.xml", "<project/>");

        write(root, "store/pom.xml", "<project/>");
        write(root, "store/src/main/java/com/example/store/OrderStore.java", """
                package com.example.store;

                import java.util.ArrayList;
                import java.util.List;

                public class OrderStore {
                    private final List<String> orders = new ArrayList<>();

                    public void save(String order) {
                        orders.add(order);
                    }

                    public int size() {
                        return orders.size();
                    }
                }
                """);

        write(root, "app/pom.xml", "<project/>");
        write(root, "app/src/main/java/com/example/app/Checkout.java", """
                package com.example.app;

                import com.example.store.OrderStore;
                import java.util.List;

                public class Checkout {
                    private final OrderStore store = new OrderStore();

                    public int checkout(List<String> cart) {
                        for (String item : cart) {
                            if (valid(item)) {
                                store.save(item);
                            }
                        }
                        return store.size();
                    }

                    boolean valid(String item) {
                        return !item.isBlank();
                    }
                }
                """);
        write(root, "app/src/test/java/com/example/app/CheckoutTest.java", """
                package com.example.app;
                public class CheckoutTest {
                    private final Checkout checkout = new Checkout();
                    void runs() { checkout.checkout(java.util.List.of("a")); }
                }
                """);
        return root;
    }

    @Test
    void generatesOneDiagramPerEntryPointAcrossModules() throws Exception {
        Path root = twoModuleTree();

        JavaToSeqResult res = new JavaToSeqService().generateFromSource(root, List.of(), new JavaToSeqOptions());
        if (DEBUG) res.diagrams.forEach((t, l) -> System.out.println("[DEBUG] " + t + "\n" + String.join("\n", l)));

        assertEquals(List.of("app", "store"), res.modules.stream().map(m -> m.name).collect(Collectors.toList()));
        assertEquals(2, res.javaFiles.size(), "test sources are excluded by default");
        assertTrue(res.parseErrors.isEmpty(), res.parseErrors.toString());

        assertEquals(List.of("app_Checkout_checkout"), List.copyOf(res.diagrams.keySet()));
        assertEquals(List.of(
                "@startuml",
                "title app_Checkout_checkout",
                "autoactivate on",
                "hide footbox",
                "group foreach",
                "  group if",
                "    Checkout -> Checkout: valid",
                "    Checkout --> Checkout: boolean",
                "    Checkout -> com.example.store.OrderStore: save",
                "    com.example.store.OrderStore --> Checkout: void",
                "  end",
                "end",
                "Checkout -> com.example.store.OrderStore: size",
                "com.example.store.OrderStore --> Checkout: int",
                "@enduml"), res.diagrams.get("app_Checkout_checkout"));
    }

    @Test
    void includedTestsBecomeCallersAndEntryPoints() throws Exception {
        Path root = twoModuleTree();
        JavaToSeqOptions opt = new JavaToSeqOptions();
        opt.includeTests = true;

        JavaToSeqResult res = new JavaToSeqService().generateFromSource(root, List.of(), opt);

        assertEquals(3, res.javaFiles.size());
        assertFalse(res.diagrams.containsKey("app_Checkout_checkout"), "checkout is now called from a test");
        assertTrue(res.diagrams.containsKey("app_CheckoutTest_runs"), res.diagrams.keySet().toString());
    }

    @Test
    void singleModuleModeUsesTheGivenName() throws Exception {
        Path root = twoModuleTree();
        JavaToSeqOptions opt = new JavaToSeqOptions();
        opt.discoverModules = false;
        opt.moduleName = "Shop";
        opt.parallelism = 2;

        JavaToSeqResult res = new JavaToSeqService().generateFromSource(root, List.of("store"), opt);

        assertEquals(1, res.modules.size());
        Map<String, List<String>> diagrams = res.diagrams;
        assertTrue(diagrams.containsKey("Shop_Checkout_checkout"), diagrams.keySet().toString());
        // OrderStore was excluded: its calls are unresolved and receivers are declined.
        assertFalse(res.unresolvedCallSites.isEmpty());
        assertFalse(String.join("\n", diagrams.get("Shop_Checkout_checkout")).contains("OrderStore"));
    }

    @Test
    void rejectsMissingSourceDirectory() {
        JavaToSeqService service = new JavaToSeqService();
        assertThrows(IllegalArgumentException.class, () -> service.generateFromSource(null, List.of(), null));
        assertThrows(IllegalArgumentException.class,
                () -> service.generateFromSource(Path.of("does-not-exist-" + System.nanoTime()), List.of(), null));
    }
}
