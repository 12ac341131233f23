package ai.p8ls.analyzer.ast;

import static java.util.Objects.requireNonNull;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.jetbrains.annotations.Nullable;

/**
 * Depth-first traversal base for analyses that need lexical scope.
 *
 * <p>{@code S} is whatever the analysis tracks per scope. Scope-creating hooks (blocks, loops, functions, if
 * clauses, table constructors) return the value to push while their children are visited; every other hook is a
 * no-op notification. Subclasses override only the hooks they care about; recursion into children always happens
 * here.
 *
 * <p>Alongside the scope stack the walker keeps a stack of the nodes currently being visited, so hooks can ask
 * about their parent. While an initializer of an assignment is visited, its target sits on the node stack marked
 * as an assignment target, which lets {@code x = function() end} learn its name from {@code x}.
 *
 * <p>Ordering:
 * <ul>
 *   <li>assignments visit target 1, value 1, target 2, value 2, and so on;
 *   <li>loop bounds and iterators are visited before the loop scope is entered, loop variables inside it;
 *   <li>if/elseif and while conditions are visited outside their body scope;
 *   <li>a repeat condition is visited inside the body scope, so body locals are visible in {@code until};
 *   <li>for a function, a member-expression name is visited before the function scope, parameters inside it.
 * </ul>
 */
public abstract class AstWalker<S> {

    /** An entry of the node stack. */
    protected record Frame(Node node, boolean assignmentTarget) {}

    private final List<S> scopeStack = new ArrayList<>();
    private final List<Frame> nodeStack = new ArrayList<>();
    private final Dispatcher dispatcher = new Dispatcher();

    /** Scope value pushed for a scope-creating node whose hook is not overridden. */
    protected abstract S createDefaultScope(@Nullable Node owner);

    /** Bottom of the scope stack. Pushed without an {@link #onEnterScope} notification. */
    protected S startingScope() {
        return createDefaultScope(null);
    }

    protected void onEnterScope(S scope) {}

    protected void onExitScope(S scope) {}

    /** Walks the statements of a chunk directly in the starting scope. */
    protected final void walk(Block block) {
        ensureStarted();
        visitAll(block.statements());
    }

    /** Walks the statements of a chunk inside {@code chunkScope}, which sits on top of the starting scope. */
    protected final void walk(Block block, S chunkScope) {
        ensureStarted();
        pushScope(chunkScope);
        visitAll(block.statements());
        popScope();
    }

    private void ensureStarted() {
        if (scopeStack.isEmpty()) {
            scopeStack.add(requireNonNull(startingScope(), "startingScope"));
        }
    }

    // -- stack access

    protected final S topScope() {
        return topScope(0);
    }

    /** Scope {@code depth} levels below the top; 0 is the innermost. */
    protected final S topScope(int depth) {
        return scopeStack.get(scopeStack.size() - 1 - depth);
    }

    /** Scopes from outermost (the starting scope) to innermost. */
    protected final List<S> scopes() {
        return Collections.unmodifiableList(scopeStack);
    }

    protected final @Nullable Frame topNode() {
        return topNode(0);
    }

    protected final @Nullable Frame topNode(int depth) {
        int i = nodeStack.size() - 1 - depth;
        return i >= 0 ? nodeStack.get(i) : null;
    }

    /** The innermost node being visited, or null at statement level of the chunk. */
    protected final @Nullable Node parentNode() {
        var frame = topNode();
        return frame == null ? null : frame.node();
    }

    /**
     * True while visiting the value of an assignment ({@code target = <here>}) or of a named table field
     * ({@code {name = <here>}}).
     */
    protected final boolean isInAssignment() {
        var previous = topNode(0);
        var prePrevious = topNode(1);
        if (previous == null || prePrevious == null) {
            return false;
        }
        var node = previous.node();
        var parent = prePrevious.node();
        if ((node instanceof Identifier || node instanceof MemberExpression)
                && (parent instanceof AssignmentStatement || parent instanceof LocalStatement)) {
            return true;
        }
        return node instanceof TableKeyString && parent instanceof TableConstructorExpression;
    }

    /** True when the innermost stack entry is an assignment target whose value is being visited. */
    protected final boolean isInAssignmentTarget() {
        var previous = topNode();
        return previous != null && previous.assignmentTarget();
    }

    // -- scope-creating hooks

    protected S visitIfClause(IfClause node) {
        return createDefaultScope(node);
    }

    protected S visitDoStatement(DoStatement node) {
        return createDefaultScope(node);
    }

    protected S visitWhileStatement(WhileStatement node) {
        return createDefaultScope(node);
    }

    protected S visitRepeatStatement(RepeatStatement node) {
        return createDefaultScope(node);
    }

    protected S visitForNumericStatement(ForNumericStatement node) {
        return createDefaultScope(node);
    }

    protected S visitForGenericStatement(ForGenericStatement node) {
        return createDefaultScope(node);
    }

    protected S visitFunctionDeclaration(FunctionDeclaration node) {
        return createDefaultScope(node);
    }

    protected S visitTableConstructorExpression(TableConstructorExpression node) {
        return createDefaultScope(node);
    }

    // -- notification hooks

    protected void visitAssignmentStatement(AssignmentStatement node) {}

    protected void visitLocalStatement(LocalStatement node) {}

    /** Called after the targets and values of a local statement have been visited. */
    protected void leaveLocalStatement(LocalStatement node) {}

    protected void visitIfStatement(IfStatement node) {}

    protected void visitReturnStatement(ReturnStatement node) {}

    protected void visitBreakStatement(BreakStatement node) {}

    protected void visitGotoStatement(GotoStatement node) {}

    protected void visitLabelStatement(LabelStatement node) {}

    protected void visitCallStatement(CallStatement node) {}

    protected void visitIncludeStatement(IncludeStatement node) {}

    protected void visitIdentifier(Identifier node) {}

    protected void visitStringLiteral(StringLiteral node) {}

    protected void visitNumericLiteral(NumericLiteral node) {}

    protected void visitBooleanLiteral(BooleanLiteral node) {}

    protected void visitNilLiteral(NilLiteral node) {}

    protected void visitVarargLiteral(VarargLiteral node) {}

    protected void visitTableKey(TableKey node) {}

    protected void visitTableKeyString(TableKeyString node) {}

    protected void visitTableValue(TableValue node) {}

    protected void visitBinaryExpression(BinaryExpression node) {}

    protected void visitLogicalExpression(LogicalExpression node) {}

    protected void visitUnaryExpression(UnaryExpression node) {}

    protected void visitMemberExpression(MemberExpression node) {}

    protected void visitIndexExpression(IndexExpression node) {}

    protected void visitCallExpression(CallExpression node) {}

    protected void visitTableCallExpression(TableCallExpression node) {}

    protected void visitStringCallExpression(StringCallExpression node) {}

    // -- traversal

    private void pushScope(S scope) {
        scopeStack.add(requireNonNull(scope, "scope"));
        onEnterScope(scope);
    }

    private void popScope() {
        var scope = scopeStack.remove(scopeStack.size() - 1);
        onExitScope(scope);
    }

    private void pushNode(Node node) {
        nodeStack.add(new Frame(node, false));
    }

    private void pushTarget(Node node) {
        nodeStack.add(new Frame(node, true));
    }

    private void popNode() {
        nodeStack.remove(nodeStack.size() - 1);
    }

    private void visitNode(Node node) {
        node.accept(dispatcher);
    }

    private void visitAll(List<? extends Node> nodes) {
        for (var node : nodes) {
            visitNode(node);
        }
    }

    private void visitScoped(S scope, Block body) {
        pushScope(scope);
        visitAll(body.statements());
        popScope();
    }

    private void visitTargetsAndValues(List<? extends Expression> targets, List<Expression> values) {
        for (int i = 0; i < targets.size(); i++) {
            var target = targets.get(i);
            visitNode(target);
            if (i < values.size()) {
                pushTarget(target);
                visitNode(values.get(i));
                popNode();
            }
        }
        // surplus values have no target of their own
        for (int i = targets.size(); i < values.size(); i++) {
            visitNode(values.get(i));
        }
    }

    private final class Dispatcher implements NodeVisitor<Void> {
        @Override
        public Void visitAssignmentStatement(AssignmentStatement node) {
            AstWalker.this.visitAssignmentStatement(node);
            pushNode(node);
            visitTargetsAndValues(node.targets(), node.values());
            popNode();
            return null;
        }

        @Override
        public Void visitLocalStatement(LocalStatement node) {
            AstWalker.this.visitLocalStatement(node);
            pushNode(node);
            visitTargetsAndValues(node.variables(), node.values());
            popNode();
            leaveLocalStatement(node);
            return null;
        }

        @Override
        public Void visitIfStatement(IfStatement node) {
            AstWalker.this.visitIfStatement(node);
            pushNode(node);
            visitAll(node.clauses());
            popNode();
            return null;
        }

        @Override
        public Void visitIfClause(IfClause node) {
            var scope = AstWalker.this.visitIfClause(node);
            pushNode(node);
            if (node.condition() != null) {
                visitNode(node.condition());
            }
            visitScoped(scope, node.body());
            popNode();
            return null;
        }

        @Override
        public Void visitWhileStatement(WhileStatement node) {
            var scope = AstWalker.this.visitWhileStatement(node);
            pushNode(node);
            visitNode(node.condition());
            visitScoped(scope, node.body());
            popNode();
            return null;
        }

        @Override
        public Void visitRepeatStatement(RepeatStatement node) {
            var scope = AstWalker.this.visitRepeatStatement(node);
            pushNode(node);
            pushScope(scope);
            visitAll(node.body().statements());
            visitNode(node.condition());
            popScope();
            popNode();
            return null;
        }

        @Override
        public Void visitForNumericStatement(ForNumericStatement node) {
            var scope = AstWalker.this.visitForNumericStatement(node);
            pushNode(node);
            visitNode(node.start());
            visitNode(node.end());
            if (node.step() != null) {
                visitNode(node.step());
            }
            pushScope(scope);
            visitNode(node.variable());
            visitAll(node.body().statements());
            popScope();
            popNode();
            return null;
        }

        @Override
        public Void visitForGenericStatement(ForGenericStatement node) {
            var scope = AstWalker.this.visitForGenericStatement(node);
            pushNode(node);
            visitAll(node.iterators());
            pushScope(scope);
            visitAll(node.variables());
            visitAll(node.body().statements());
            popScope();
            popNode();
            return null;
        }

        @Override
        public Void visitFunctionDeclaration(FunctionDeclaration node) {
            var scope = AstWalker.this.visitFunctionDeclaration(node);
            pushNode(node);
            if (node.identifier() instanceof MemberExpression) {
                visitNode(node.identifier());
            }
            pushScope(scope);
            visitAll(node.parameters());
            visitAll(node.body().statements());
            popScope();
            popNode();
            return null;
        }

        @Override
        public Void visitReturnStatement(ReturnStatement node) {
            AstWalker.this.visitReturnStatement(node);
            pushNode(node);
            visitAll(node.arguments());
            popNode();
            return null;
        }

        @Override
        public Void visitBreakStatement(BreakStatement node) {
            AstWalker.this.visitBreakStatement(node);
            return null;
        }

        @Override
        public Void visitGotoStatement(GotoStatement node) {
            AstWalker.this.visitGotoStatement(node);
            pushNode(node);
            visitNode(node.label());
            popNode();
            return null;
        }

        @Override
        public Void visitLabelStatement(LabelStatement node) {
            AstWalker.this.visitLabelStatement(node);
            pushNode(node);
            visitNode(node.label());
            popNode();
            return null;
        }

        @Override
        public Void visitCallStatement(CallStatement node) {
            AstWalker.this.visitCallStatement(node);
            pushNode(node);
            visitNode(node.expression());
            popNode();
            return null;
        }

        @Override
        public Void visitDoStatement(DoStatement node) {
            var scope = AstWalker.this.visitDoStatement(node);
            pushNode(node);
            visitScoped(scope, node.body());
            popNode();
            return null;
        }

        @Override
        public Void visitIncludeStatement(IncludeStatement node) {
            AstWalker.this.visitIncludeStatement(node);
            return null;
        }

        @Override
        public Void visitIdentifier(Identifier node) {
            AstWalker.this.visitIdentifier(node);
            return null;
        }

        @Override
        public Void visitStringLiteral(StringLiteral node) {
            AstWalker.this.visitStringLiteral(node);
            return null;
        }

        @Override
        public Void visitNumericLiteral(NumericLiteral node) {
            AstWalker.this.visitNumericLiteral(node);
            return null;
        }

        @Override
        public Void visitBooleanLiteral(BooleanLiteral node) {
            AstWalker.this.visitBooleanLiteral(node);
            return null;
        }

        @Override
        public Void visitNilLiteral(NilLiteral node) {
            AstWalker.this.visitNilLiteral(node);
            return null;
        }

        @Override
        public Void visitVarargLiteral(VarargLiteral node) {
            AstWalker.this.visitVarargLiteral(node);
            return null;
        }

        @Override
        public Void visitTableConstructorExpression(TableConstructorExpression node) {
            var scope = AstWalker.this.visitTableConstructorExpression(node);
            pushNode(node);
            pushScope(scope);
            visitAll(node.fields());
            popScope();
            popNode();
            return null;
        }

        @Override
        public Void visitTableKey(TableKey node) {
            AstWalker.this.visitTableKey(node);
            pushNode(node);
            visitNode(node.key());
            visitNode(node.value());
            popNode();
            return null;
        }

        @Override
        public Void visitTableKeyString(TableKeyString node) {
            AstWalker.this.visitTableKeyString(node);
            pushNode(node);
            visitNode(node.value());
            popNode();
            return null;
        }

        @Override
        public Void visitTableValue(TableValue node) {
            AstWalker.this.visitTableValue(node);
            pushNode(node);
            visitNode(node.value());
            popNode();
            return null;
        }

        @Override
        public Void visitBinaryExpression(BinaryExpression node) {
            AstWalker.this.visitBinaryExpression(node);
            pushNode(node);
            visitNode(node.left());
            visitNode(node.right());
            popNode();
            return null;
        }

        @Override
        public Void visitLogicalExpression(LogicalExpression node) {
            AstWalker.this.visitLogicalExpression(node);
            pushNode(node);
            visitNode(node.left());
            visitNode(node.right());
            popNode();
            return null;
        }

        @Override
        public Void visitUnaryExpression(UnaryExpression node) {
            AstWalker.this.visitUnaryExpression(node);
            pushNode(node);
            visitNode(node.argument());
            popNode();
            return null;
        }

        @Override
        public Void visitMemberExpression(MemberExpression node) {
            AstWalker.this.visitMemberExpression(node);
            pushNode(node);
            visitNode(node.base());
            visitNode(node.identifier());
            popNode();
            return null;
        }

        @Override
        public Void visitIndexExpression(IndexExpression node) {
            AstWalker.this.visitIndexExpression(node);
            pushNode(node);
            visitNode(node.base());
            visitNode(node.index());
            popNode();
            return null;
        }

        @Override
        public Void visitCallExpression(CallExpression node) {
            AstWalker.this.visitCallExpression(node);
            pushNode(node);
            visitNode(node.base());
            visitAll(node.arguments());
            popNode();
            return null;
        }

        @Override
        public Void visitTableCallExpression(TableCallExpression node) {
            AstWalker.this.visitTableCallExpression(node);
            pushNode(node);
            visitNode(node.base());
            visitNode(node.argument());
            popNode();
            return null;
        }

        @Override
        public Void visitStringCallExpression(StringCallExpression node) {
            AstWalker.this.visitStringCallExpression(node);
            pushNode(node);
            visitNode(node.base());
            visitNode(node.argument());
            popNode();
            return null;
        }
    }
}
