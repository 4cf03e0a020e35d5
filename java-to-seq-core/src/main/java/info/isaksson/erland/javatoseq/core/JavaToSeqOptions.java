package info.isaksson.erland.javatoseq.core;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Core (server-friendly) options for java-to-seq generation.
 *
 * <p>This mirrors the CLI flags in a structured form.</p>
 */
public final class JavaToSeqOptions {
    /** Name of the module rooted at the source directory; the directory name when null or blank. */
    public String moduleName = null;

    /** Source scanning controls. */
    public boolean includeTests = false;

    /**
     * Split the source tree into modules at {@code pom.xml}, {@code build.gradle(.kts)} and
     * {@code src/main/java} directories. When false everything is one module.
     */
    public boolean discoverModules = true;

    /** Jar files used to resolve library types. */
    public List<Path> classpath = new ArrayList<>();

    /** Compilation units walked concurrently. */
    public int parallelism = 1;

    /** Draw methods whose callers cannot be determined instead of skipping them. */
    public boolean drawUnresolvedMethods = false;
}
