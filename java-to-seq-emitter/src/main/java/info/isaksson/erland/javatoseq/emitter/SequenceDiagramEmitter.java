package info.isaksson.erland.javatoseq.emitter;

import info.isaksson.erland.javatoseq.diagram.DiagramStore;
import info.isaksson.erland.javatoseq.model.JProgram;
import info.isaksson.erland.javatoseq.model.SourceModel;
import info.isaksson.erland.javatoseq.model.SourceUnit;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Emits PlantUML sequence diagrams for every entry-point method of a loaded program.
 *
 * <p>Each compilation unit is walked into its own {@link DiagramStore}. The stores are merged in unit
 * order afterwards, so the result does not depend on {@link EmitterOptions#parallelism}.</p>
 */
public final class SequenceDiagramEmitter {

    public EmitResult emit(JProgram program) {
        return emit(program, new EmitterOptions());
    }

    public EmitResult emit(JProgram program, EmitterOptions options) {
        if (program == null) throw new IllegalArgumentException("program must not be null");
        EmitterOptions opt = options == null ? new EmitterOptions() : options;
        SourceModel model = program.sourceModel();

        List<UnitWalk> walks = opt.parallelism > 1 && program.units.size() > 1
                ? walkParallel(program.units, model, opt)
                : walkSequential(program.units, model, opt);

        DiagramStore merged = new DiagramStore();
        List<String> unresolved = new ArrayList<>();
        for (UnitWalk w : walks) {
            merged.merge(w.store);
            unresolved.addAll(w.unresolvedMethods);
        }
        return new EmitResult(merged.diagrams(), unresolved);
    }

    private static List<UnitWalk> walkSequential(List<SourceUnit> units, SourceModel model, EmitterOptions opt) {
        List<UnitWalk> out = new ArrayList<>(units.size());
        for (SourceUnit u : units) {
            out.add(walk(u, model, opt));
        }
        return out;
    }

    private static List<UnitWalk> walkParallel(List<SourceUnit> units, SourceModel model, EmitterOptions opt) {
        ExecutorService pool = Executors.newFixedThreadPool(Math.min(opt.parallelism, units.size()));
        try {
            List<Future<UnitWalk>> futures = new ArrayList<>(units.size());
            for (SourceUnit u : units) {
                futures.add(pool.submit(() -> walk(u, model, opt)));
            }
            List<UnitWalk> out = new ArrayList<>(units.size());
            for (Future<UnitWalk> f : futures) {
                out.add(f.get());
            }
            return out;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while emitting diagrams", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) throw (RuntimeException) cause;
            throw new IllegalStateException("Diagram walk failed: " + cause, cause);
        } finally {
            pool.shutdownNow();
        }
    }

    private static UnitWalk walk(SourceUnit unit, SourceModel model, EmitterOptions opt) {
        UnitWalk w = new UnitWalk();
        new DiagramWalker(unit, model, w.store, opt, w.unresolvedMethods).walk();
        return w;
    }

    private static final class UnitWalk {
        final DiagramStore store = new DiagramStore();
        final List<String> unresolvedMethods = new ArrayList<>();
    }
}
