package info.isaksson.erland.javatoseq.extract;

import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.expr.MethodReferenceExpr;
import info.isaksson.erland.javatoseq.model.CallSite;
import info.isaksson.erland.javatoseq.model.CallerIndex;
import info.isaksson.erland.javatoseq.model.JProgram;
import info.isaksson.erland.javatoseq.model.SourceUnit;

import java.util.Optional;

/**
 * Builds the whole-program {@link CallerIndex} in a single pass over every unit.
 *
 * <p>Method calls and method references both count as callers. Targets that cannot be resolved are
 * recorded in {@link JProgram#unresolvedCallSites}.</p>
 */
final class CallerIndexBuilder {

    private CallerIndexBuilder() {}

    static CallerIndex build(JProgram program, JavaParserSourceModel model) {
        CallerIndex.Builder index = CallerIndex.builder();
        for (SourceUnit unit : program.units) {
            unit.cu.walk(MethodCallExpr.class, call -> record(program, model, index, unit, call));
            unit.cu.walk(MethodReferenceExpr.class, ref -> record(program, model, index, unit, ref));
        }
        return index.build();
    }

    private static void record(JProgram program,
                               JavaParserSourceModel model,
                               CallerIndex.Builder index,
                               SourceUnit unit,
                               Node call) {
        CallSite site = new CallSite(unit.moduleName, unit.file, lineOf(call), call.toString());
        Optional<String> target = model.invokedSymbol(call);
        if (target.isPresent()) {
            index.add(target.get(), site);
        } else {
            program.unresolvedCallSites.add(site.toString());
        }
    }

    private static int lineOf(Node n) {
        return n.getBegin().map(p -> p.line).orElse(-1);
    }
}
