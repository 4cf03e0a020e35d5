package info.isaksson.erland.javatoseq.emitter;

import info.isaksson.erland.javatoseq.diagram.PlantUml;

import java.util.function.Consumer;

/**
 * Brackets a loop or conditional body in {@code group <kind>} ... {@code end}.
 *
 * <p>A body that wrote nothing leaves no trace: the closing write sees its own opening line as the most
 * recent line and removes it instead. Nested empty blocks therefore collapse one after the other.</p>
 */
final class ControlFlowGrouper {

    private ControlFlowGrouper() {}

    static void group(BlockKind kind, TraversalContext ctx, Consumer<TraversalContext> body) {
        if (!ctx.emitting()) {
            body.accept(ctx.deeper());
            return;
        }
        String open = PlantUml.group(ctx.depth(), kind.label());
        ctx.buffer().add(open);
        body.accept(ctx.deeper());
        ctx.buffer().addOrCollapse(PlantUml.end(ctx.depth()), open);
    }
}
