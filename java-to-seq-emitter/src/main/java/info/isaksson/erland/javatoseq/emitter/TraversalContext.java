package info.isaksson.erland.javatoseq.emitter;

import info.isaksson.erland.javatoseq.diagram.CommandBuffer;

/**
 * Per-path walk state, passed by value as the visitor argument.
 *
 * <p>Derived contexts are new instances, so leaving a visit restores the caller's state on every
 * exit path.</p>
 *
 * @param title          active diagram title, or null
 * @param buffer         active diagram buffer, or null
 * @param suppressed     true inside a constructor, initializer or non-entry method
 * @param depth          indent depth of the next line
 * @param insideCallable true once the walk has entered a callable body
 */
record TraversalContext(String title, CommandBuffer buffer, boolean suppressed, int depth, boolean insideCallable) {

    static final TraversalContext ROOT = new TraversalContext(null, null, false, 0, false);

    TraversalContext {
        if (depth < 0) throw new IllegalArgumentException("depth must be >= 0: " + depth);
    }

    static TraversalContext diagram(String title, CommandBuffer buffer) {
        return new TraversalContext(title, buffer, false, 0, true);
    }

    boolean emitting() {
        return buffer != null && !suppressed;
    }

    TraversalContext deeper() {
        return new TraversalContext(title, buffer, suppressed, depth + 1, insideCallable);
    }

    TraversalContext suppress() {
        return new TraversalContext(title, buffer, true, depth, true);
    }

    void emit(String line) {
        if (emitting()) buffer.add(line);
    }
}
