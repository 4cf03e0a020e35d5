package info.isaksson.erland.javatoseq.emitter;

import com.github.javaparser.ast.body.ConstructorDeclaration;
import com.github.javaparser.ast.body.InitializerDeclaration;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.body.TypeDeclaration;
import com.github.javaparser.ast.expr.FieldAccessExpr;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.stmt.DoStmt;
import com.github.javaparser.ast.stmt.ForEachStmt;
import com.github.javaparser.ast.stmt.ForStmt;
import com.github.javaparser.ast.stmt.IfStmt;
import com.github.javaparser.ast.stmt.WhileStmt;
import com.github.javaparser.ast.visitor.VoidVisitorAdapter;
import info.isaksson.erland.javatoseq.diagram.CommandBuffer;
import info.isaksson.erland.javatoseq.diagram.DiagramStore;
import info.isaksson.erland.javatoseq.model.SourceModel;
import info.isaksson.erland.javatoseq.model.SourceUnit;

import java.util.List;
import java.util.Optional;

/**
 * Walks one compilation unit and writes a sequence diagram for every entry-point method into a
 * {@link DiagramStore}.
 *
 * <p>Handled node kinds have their own {@code visit} overload; everything else falls through to
 * {@link VoidVisitorAdapter}'s structural descent with the context unchanged.</p>
 */
final class DiagramWalker extends VoidVisitorAdapter<TraversalContext> {

    private final SourceUnit unit;
    private final SourceModel model;
    private final DiagramStore store;
    private final EmitterOptions options;
    private final List<String> unresolvedMethods;
    private final CallEdgeResolver resolver;

    DiagramWalker(SourceUnit unit,
                  SourceModel model,
                  DiagramStore store,
                  EmitterOptions options,
                  List<String> unresolvedMethods) {
        this.unit = unit;
        this.model = model;
        this.store = store;
        this.options = options;
        this.unresolvedMethods = unresolvedMethods;
        this.resolver = new CallEdgeResolver(model);
    }

    void walk() {
        unit.cu.accept(this, TraversalContext.ROOT);
    }

    // ---- declarations ----

    @Override
    public void visit(MethodDeclaration md, TraversalContext ctx) {
        // Methods of anonymous and local classes belong to the enclosing body.
        if (ctx.insideCallable()) {
            md.getBody().ifPresent(b -> b.accept(this, ctx));
            return;
        }

        if (!isEntryPoint(md)) {
            md.getBody().ifPresent(b -> b.accept(this, ctx.suppress()));
            return;
        }

        String title = titleOf(md);
        CommandBuffer buffer = store.begin(title);
        md.getBody().ifPresent(b -> b.accept(this, TraversalContext.diagram(title, buffer)));
        store.finish(title);
    }

    @Override
    public void visit(ConstructorDeclaration cd, TraversalContext ctx) {
        cd.getBody().accept(this, ctx.suppress());
    }

    @Override
    public void visit(InitializerDeclaration init, TraversalContext ctx) {
        init.getBody().accept(this, ctx.suppress());
    }

    // ---- calls ----

    @Override
    public void visit(MethodCallExpr call, TraversalContext ctx) {
        Optional<CallEdge> edge = ctx.emitting() ? resolver.resolve(call) : Optional.empty();
        edge.ifPresent(e -> ctx.emit(e.callLine(ctx.depth())));
        // Receiver first, then arguments left to right.
        call.getScope().ifPresent(s -> s.accept(this, ctx));
        call.getArguments().forEach(a -> a.accept(this, ctx));
        edge.ifPresent(e -> ctx.emit(e.returnLine(ctx.depth())));
    }

    @Override
    public void visit(FieldAccessExpr access, TraversalContext ctx) {
        Optional<CallEdge> edge = ctx.emitting() ? resolver.resolve(access) : Optional.empty();
        edge.ifPresent(e -> ctx.emit(e.callLine(ctx.depth())));
        access.getScope().accept(this, ctx);
        edge.ifPresent(e -> ctx.emit(e.returnLine(ctx.depth())));
    }

    // ---- control flow ----

    @Override
    public void visit(IfStmt stmt, TraversalContext ctx) {
        ControlFlowGrouper.group(BlockKind.IF, ctx, inner -> super.visit(stmt, inner));
    }

    @Override
    public void visit(ForStmt stmt, TraversalContext ctx) {
        ControlFlowGrouper.group(BlockKind.FOR, ctx, inner -> super.visit(stmt, inner));
    }

    @Override
    public void visit(ForEachStmt stmt, TraversalContext ctx) {
        ControlFlowGrouper.group(BlockKind.FOREACH, ctx, inner -> super.visit(stmt, inner));
    }

    @Override
    public void visit(WhileStmt stmt, TraversalContext ctx) {
        ControlFlowGrouper.group(BlockKind.WHILE, ctx, inner -> super.visit(stmt, inner));
    }

    @Override
    public void visit(DoStmt stmt, TraversalContext ctx) {
        ControlFlowGrouper.group(BlockKind.DO_WHILE, ctx, inner -> super.visit(stmt, inner));
    }

    // ---- helpers ----

    private boolean isEntryPoint(MethodDeclaration md) {
        Optional<String> symbol = model.declaredSymbol(md);
        if (symbol.isEmpty()) {
            unresolvedMethods.add(describe(md));
            return options.drawUnresolvedMethods;
        }
        return model.callersOf(symbol.get()).isEmpty();
    }

    /** {@code module_Type_method}. */
    String titleOf(MethodDeclaration md) {
        return unit.moduleName + "_" + declaringTypeOf(md) + "_" + md.getNameAsString();
    }

    @SuppressWarnings({"rawtypes", "unchecked"})
    private static String declaringTypeOf(MethodDeclaration md) {
        Optional<TypeDeclaration> owner = md.findAncestor(TypeDeclaration.class);
        return owner.map(TypeDeclaration::getNameAsString).orElse("");
    }

    private String describe(MethodDeclaration md) {
        String file = unit.file == null ? "?" : unit.file.getFileName().toString();
        int line = md.getBegin().map(p -> p.line).orElse(-1);
        return unit.moduleName + ":" + file + ":" + line + " " + declaringTypeOf(md) + "." + md.getDeclarationAsString(false, false, false);
    }
}
