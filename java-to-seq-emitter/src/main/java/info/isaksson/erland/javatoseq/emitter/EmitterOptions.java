package info.isaksson.erland.javatoseq.emitter;

/** Emitter settings. */
public final class EmitterOptions {

    /** Number of compilation units walked concurrently. Values below 1 mean 1. */
    public int parallelism = 1;

    /**
     * Draw methods whose declaration cannot be resolved (and whose callers are therefore unknown) as if
     * they were entry points. By default they are skipped and reported.
     */
    public boolean drawUnresolvedMethods = false;
}
