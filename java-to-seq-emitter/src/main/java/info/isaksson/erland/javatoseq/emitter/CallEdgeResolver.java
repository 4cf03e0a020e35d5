package info.isaksson.erland.javatoseq.emitter;

import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.CallableDeclaration;
import com.github.javaparser.ast.body.TypeDeclaration;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.FieldAccessExpr;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.expr.NameExpr;
import info.isaksson.erland.javatoseq.model.SourceModel;
import info.isaksson.erland.javatoseq.model.TypeName;

import java.util.Optional;

/**
 * Turns a call or field access with a simple receiver into a {@link CallEdge}.
 *
 * <ul>
 *   <li>{@code bar()}: same-type call, target is the enclosing type</li>
 *   <li>{@code x.bar()} / {@code x.field} where {@code x} has a class, interface, enum or record type
 *       (or names one): cross-type call, target is that type's qualified name</li>
 * </ul>
 * Every other shape is declined; the walker still descends into it.
 */
final class CallEdgeResolver {

    private final SourceModel model;

    CallEdgeResolver(SourceModel model) {
        this.model = model;
    }

    Optional<CallEdge> resolve(MethodCallExpr call) {
        Optional<String> caller = callerTypeOf(call);
        if (caller.isEmpty()) return Optional.empty();

        Optional<Expression> scope = call.getScope();
        if (scope.isEmpty()) {
            return Optional.of(new CallEdge(caller.get(), caller.get(), call.getNameAsString(), returnTypeOf(call)));
        }
        return crossType(caller.get(), scope.get(), call);
    }

    Optional<CallEdge> resolve(FieldAccessExpr access) {
        Optional<String> caller = callerTypeOf(access);
        if (caller.isEmpty()) return Optional.empty();
        return crossType(caller.get(), access.getScope(), access);
    }

    private Optional<CallEdge> crossType(String caller, Expression receiver, Expression whole) {
        if (!(receiver instanceof NameExpr)) return Optional.empty();

        Optional<TypeName> receiverType = model.staticTypeOf(receiver);
        if (receiverType.isEmpty() || !receiverType.get().named()) return Optional.empty();

        Optional<String> member = model.inferredMemberName(whole).filter(m -> !m.isBlank());
        if (member.isEmpty()) return Optional.empty();

        return Optional.of(new CallEdge(caller, receiverType.get().qualifiedName(), member.get(), returnTypeOf(whole)));
    }

    private String returnTypeOf(Expression expression) {
        return model.staticTypeOf(expression).map(TypeName::simpleName).orElse(CallEdge.VOID);
    }

    /** Simple name of the type declaring the callable that contains {@code node}. */
    @SuppressWarnings({"rawtypes", "unchecked"})
    static Optional<String> callerTypeOf(Node node) {
        Optional<CallableDeclaration> host = node.findAncestor(CallableDeclaration.class);
        if (host.isEmpty()) return Optional.empty();
        Optional<TypeDeclaration> owner = host.get().findAncestor(TypeDeclaration.class);
        return owner.map(TypeDeclaration::getNameAsString);
    }
}
