package info.isaksson.erland.javatoseq.model;

import com.github.javaparser.ast.body.CallableDeclaration;
import com.github.javaparser.ast.expr.Expression;

import java.util.Optional;
import java.util.Set;

/**
 * Semantic queries over a loaded program.
 *
 * <p>Implementations never throw for lookups that cannot be answered; they return an empty result.</p>
 */
public interface SourceModel {

    /** Qualified signature of a method or constructor declaration, e.g. {@code p.Foo.bar(int)}. */
    Optional<String> declaredSymbol(CallableDeclaration<?> declaration);

    /** All call sites of {@code symbol} in the whole program. */
    Set<CallSite> callersOf(String symbol);

    /** Static type of {@code expression}. Empty for {@code void} and for anything that cannot be resolved. */
    Optional<TypeName> staticTypeOf(Expression expression);

    /** Name of the member an invocation or access refers to. */
    Optional<String> inferredMemberName(Expression expression);
}
