package info.isaksson.erland.javatoseq.extract;

import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.CallableDeclaration;
import com.github.javaparser.ast.body.ConstructorDeclaration;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.FieldAccessExpr;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.expr.MethodReferenceExpr;
import com.github.javaparser.ast.expr.NameExpr;
import com.github.javaparser.resolution.TypeSolver;
import com.github.javaparser.resolution.declarations.ResolvedTypeDeclaration;
import com.github.javaparser.resolution.model.SymbolReference;
import com.github.javaparser.resolution.types.ResolvedType;
import com.github.javaparser.symbolsolver.javaparsermodel.JavaParserFactory;
import info.isaksson.erland.javatoseq.model.CallSite;
import info.isaksson.erland.javatoseq.model.CallerIndex;
import info.isaksson.erland.javatoseq.model.SourceModel;
import info.isaksson.erland.javatoseq.model.TypeName;

import java.util.Optional;
import java.util.Set;

/**
 * {@link SourceModel} backed by the JavaParser symbol solver.
 *
 * <p>Resolution failures of any kind ({@code UnsolvedSymbolException}, unsupported constructs,
 * missing library types) become empty results. Solver access is serialized on one lock; the
 * solver's caches are not safe for concurrent use.</p>
 */
public final class JavaParserSourceModel implements SourceModel {

    private final TypeSolver typeSolver;
    private final Object lock;
    private final CallerIndex callerIndex;

    JavaParserSourceModel(TypeSolver typeSolver) {
        this(typeSolver, new Object(), CallerIndex.EMPTY);
    }

    private JavaParserSourceModel(TypeSolver typeSolver, Object lock, CallerIndex callerIndex) {
        this.typeSolver = typeSolver;
        this.lock = lock;
        this.callerIndex = callerIndex;
    }

    JavaParserSourceModel withCallerIndex(CallerIndex index) {
        return new JavaParserSourceModel(typeSolver, lock, index == null ? CallerIndex.EMPTY : index);
    }

    public CallerIndex callerIndex() {
        return callerIndex;
    }

    @Override
    public Optional<String> declaredSymbol(CallableDeclaration<?> declaration) {
        if (declaration == null) return Optional.empty();
        synchronized (lock) {
            try {
                if (declaration instanceof MethodDeclaration) {
                    return Optional.of(((MethodDeclaration) declaration).resolve().getQualifiedSignature());
                }
                if (declaration instanceof ConstructorDeclaration) {
                    return Optional.of(((ConstructorDeclaration) declaration).resolve().getQualifiedSignature());
                }
            } catch (RuntimeException e) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    @Override
    public Set<CallSite> callersOf(String symbol) {
        return callerIndex.callersOf(symbol);
    }

    @Override
    public Optional<TypeName> staticTypeOf(Expression expression) {
        if (expression == null) return Optional.empty();
        synchronized (lock) {
            try {
                return toTypeName(expression.calculateResolvedType());
            } catch (RuntimeException e) {
                // A bare name that is not a value may still name a type (static member access).
                if (expression instanceof NameExpr) {
                    return solveAsType((NameExpr) expression);
                }
                return Optional.empty();
            }
        }
    }

    @Override
    public Optional<String> inferredMemberName(Expression expression) {
        if (expression instanceof MethodCallExpr) {
            return Optional.of(((MethodCallExpr) expression).getNameAsString());
        }
        if (expression instanceof FieldAccessExpr) {
            return Optional.of(((FieldAccessExpr) expression).getNameAsString());
        }
        if (expression instanceof MethodReferenceExpr) {
            return Optional.of(((MethodReferenceExpr) expression).getIdentifier());
        }
        return Optional.empty();
    }

    /** Qualified signature of the method a call or method reference targets. */
    Optional<String> invokedSymbol(Node call) {
        synchronized (lock) {
            try {
                if (call instanceof MethodCallExpr) {
                    return Optional.of(((MethodCallExpr) call).resolve().getQualifiedSignature());
                }
                if (call instanceof MethodReferenceExpr) {
                    return Optional.of(((MethodReferenceExpr) call).resolve().getQualifiedSignature());
                }
            } catch (RuntimeException e) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    private Optional<TypeName> solveAsType(NameExpr name) {
        try {
            SymbolReference<ResolvedTypeDeclaration> ref =
                    JavaParserFactory.getContext(name, typeSolver).solveType(name.getNameAsString());
            if (!ref.isSolved()) return Optional.empty();
            ResolvedTypeDeclaration decl = ref.getCorrespondingDeclaration();
            if (decl.isTypeParameter()) return Optional.of(TypeName.unnamed(decl.getName()));
            return Optional.of(TypeName.named(decl.getQualifiedName(), decl.getQualifiedName()));
        } catch (RuntimeException e) {
            return Optional.empty();
        }
    }

    static Optional<TypeName> toTypeName(ResolvedType type) {
        if (type == null || type.isVoid()) return Optional.empty();
        if (type.isReferenceType()) {
            return Optional.of(TypeName.named(type.asReferenceType().getQualifiedName(), type.describe()));
        }
        return Optional.of(TypeName.unnamed(type.describe()));
    }
}
