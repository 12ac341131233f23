package ai.p8ls.analyzer.symbols;

import static java.util.Objects.requireNonNull;

import ai.p8ls.analyzer.Bounds;
import ai.p8ls.analyzer.ast.AssignmentStatement;
import ai.p8ls.analyzer.ast.AstWalker;
import ai.p8ls.analyzer.ast.Block;
import ai.p8ls.analyzer.ast.Expression;
import ai.p8ls.analyzer.ast.ForGenericStatement;
import ai.p8ls.analyzer.ast.ForNumericStatement;
import ai.p8ls.analyzer.ast.FunctionDeclaration;
import ai.p8ls.analyzer.ast.Identifier;
import ai.p8ls.analyzer.ast.LocalStatement;
import ai.p8ls.analyzer.ast.MemberExpression;
import ai.p8ls.analyzer.ast.Node;
import ai.p8ls.analyzer.ast.Statement;
import ai.p8ls.analyzer.ast.TableConstructorExpression;
import ai.p8ls.analyzer.ast.TableKeyString;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import org.jetbrains.annotations.Nullable;

/**
 * Builds the outline of a file: functions, variables, parameters, loop variables and table keys.
 *
 * <p>Globals always go to the top level. Locals nest under the function (or assigned table) that declares them.
 * A function assigned to a variable ({@code f = function(a) end}) turns that variable's symbol into a function
 * instead of adding a second entry.
 */
public final class SymbolFinder extends AstWalker<SymbolFinder.SymbolScope> {
    private static final Pattern SELF = Pattern.compile("\\bself\\b");

    private final List<SymbolBuilder> roots = new ArrayList<>();
    private final Map<Node, SymbolBuilder> symbolsByTarget = new IdentityHashMap<>();
    private @Nullable SymbolBuilder lastAdded;

    /** Names declared in one lexical scope, plus the symbol new locals attach to and what {@code self} means. */
    static final class SymbolScope {
        final Set<String> names = new HashSet<>();
        final @Nullable SymbolBuilder parent;
        final @Nullable String self;

        SymbolScope(@Nullable SymbolBuilder parent, @Nullable String self) {
            this.parent = parent;
            this.self = self;
        }
    }

    private static final class SymbolBuilder {
        final String name;
        @Nullable String detail;
        CodeSymbolKind kind;
        final Bounds bounds;
        final Bounds selectionBounds;
        final List<SymbolBuilder> children = new ArrayList<>();

        SymbolBuilder(String name, CodeSymbolKind kind, Bounds bounds, Bounds selectionBounds) {
            this.name = name;
            this.kind = kind;
            this.bounds = bounds;
            this.selectionBounds = selectionBounds;
        }

        CodeSymbol build() {
            var built = children.stream().map(SymbolBuilder::build).toList();
            return new CodeSymbol(name, detail, kind, bounds, selectionBounds, built);
        }
    }

    private SymbolFinder() {}

    public static List<CodeSymbol> findSymbols(Block block) {
        requireNonNull(block, "block");
        var finder = new SymbolFinder();
        finder.walk(block, new SymbolScope(null, null));
        return finder.roots.stream().map(SymbolBuilder::build).toList();
    }

    @Override
    protected SymbolScope createDefaultScope(@Nullable Node owner) {
        if (scopes().isEmpty()) {
            return new SymbolScope(null, null);
        }
        // nested blocks keep attaching to the enclosing symbol
        return new SymbolScope(topScope().parent, topScope().self);
    }

    private boolean isInLocalScope(String name) {
        var stack = scopes();
        for (int i = stack.size() - 1; i > 0; i--) {
            if (stack.get(i).names.contains(name)) {
                return true;
            }
        }
        return false;
    }

    private SymbolBuilder addSymbol(
            String name, CodeSymbolKind kind, Bounds bounds, Bounds selectionBounds, boolean local) {
        var symbol = new SymbolBuilder(name, kind, bounds, selectionBounds);
        var parent = topScope().parent;
        if (parent != null && local) {
            parent.children.add(symbol);
        } else {
            roots.add(symbol);
        }
        if (local) {
            topScope().names.add(name);
        }
        lastAdded = symbol;
        return symbol;
    }

    private static String signature(FunctionDeclaration function) {
        return function.parameters().stream()
                .map(p -> p instanceof Identifier id ? id.name() : "...")
                .collect(Collectors.joining(",", "(", ")"));
    }

    @Override
    protected SymbolScope visitFunctionDeclaration(FunctionDeclaration node) {
        if (node.identifier() == null && isInAssignment()) {
            return visitAssignedFunction(node);
        }

        String self = null;
        if (node.isMethod()) {
            var base = ((MemberExpression) requireNonNull(node.identifier())).base();
            if (base instanceof Identifier id) {
                self = id.name();
            } else if (base instanceof MemberExpression member) {
                self = member.dottedName();
            }
        }

        var selection = node.identifier() != null ? node.identifier().bounds() : node.bounds();
        var symbol = addSymbol(
                node.displayName(),
                CodeSymbolKind.FUNCTION,
                node.bounds(),
                selection,
                node.isLocal() || topScope().parent != null);
        symbol.detail = signature(node);
        return new SymbolScope(symbol, self);
    }

    /** {@code target = function() end}: the target already has a symbol, which becomes a function. */
    private SymbolScope visitAssignedFunction(FunctionDeclaration node) {
        var frame = requireNonNull(topNode(), "assignment target");
        var symbol = symbolsByTarget.get(frame.node());
        if (symbol == null) {
            // targets like a[i] or f().x get no symbol
            return createDefaultScope(node);
        }
        symbol.detail = signature(node);
        symbol.kind = CodeSymbolKind.FUNCTION;

        String self;
        int split = Math.max(symbol.name.lastIndexOf('.'), symbol.name.lastIndexOf(':'));
        if (split > 0) {
            self = symbol.name.substring(0, split).replace(':', '.');
        } else {
            self = topScope().parent == null ? null : topScope().parent.name;
        }
        return new SymbolScope(symbol, self);
    }

    @Override
    protected void visitIdentifier(Identifier node) {
        // parameters are the only identifiers that declare on their own
        if (parentNode() instanceof FunctionDeclaration) {
            addSymbol(node.name(), CodeSymbolKind.LOCAL_VARIABLE, node.bounds(), node.bounds(), true);
        }
    }

    @Override
    protected void visitAssignmentStatement(AssignmentStatement node) {
        addAssignmentSymbols(node, node.targets(), node.values(), false);
    }

    @Override
    protected void visitLocalStatement(LocalStatement node) {
        addAssignmentSymbols(node, node.variables(), node.values(), true);
    }

    private void addAssignmentSymbols(
            Statement statement, List<? extends Expression> targets, List<Expression> values, boolean local) {
        for (int i = 0; i < targets.size(); i++) {
            var target = targets.get(i);
            boolean isFunction = i < values.size() && values.get(i) instanceof FunctionDeclaration;
            SymbolBuilder symbol = null;
            if (target instanceof Identifier id) {
                symbol = addIdentifierSymbol(id, statement, local, isFunction);
            } else if (target instanceof MemberExpression member) {
                symbol = addMemberSymbol(member, statement, isFunction);
            }
            if (symbol != null) {
                symbolsByTarget.put(target, symbol);
            }
        }
    }

    private SymbolBuilder addIdentifierSymbol(Identifier target, Statement statement, boolean local, boolean isFunction) {
        boolean isLocal = local || isInLocalScope(target.name());
        var kind = isFunction
                ? CodeSymbolKind.FUNCTION
                : isLocal ? CodeSymbolKind.LOCAL_VARIABLE : CodeSymbolKind.GLOBAL_VARIABLE;
        return addSymbol(target.name(), kind, statement.bounds(), target.bounds(), isLocal);
    }

    private @Nullable SymbolBuilder addMemberSymbol(MemberExpression target, Statement statement, boolean isFunction) {
        var root = target.rootIdentifier();
        var name = target.dottedName();
        if (root == null || name == null) {
            return null;
        }

        var baseName = root.name();
        var scopedSelf = topScope().self;
        if (baseName.equals("self") && scopedSelf != null) {
            baseName = scopedSelf;
            name = SELF.matcher(name).replaceFirst(Matcher.quoteReplacement(scopedSelf));
        }

        boolean isLocal = isInLocalScope(baseName);
        var kind = isFunction
                ? CodeSymbolKind.FUNCTION
                : isLocal ? CodeSymbolKind.LOCAL_VARIABLE : CodeSymbolKind.GLOBAL_VARIABLE;
        return addSymbol(name, kind, statement.bounds(), target.bounds(), isLocal);
    }

    @Override
    protected SymbolScope visitTableConstructorExpression(TableConstructorExpression node) {
        if (isInAssignment()) {
            // keys of t = { ... } nest under t
            var frame = requireNonNull(topNode(), "assignment target");
            var owner = symbolsByTarget.getOrDefault(frame.node(), lastAdded);
            return new SymbolScope(owner, null);
        }
        return createDefaultScope(node);
    }

    @Override
    protected void visitTableKeyString(TableKeyString node) {
        var symbol = addSymbol(node.key().name(), CodeSymbolKind.LOCAL_VARIABLE, node.bounds(), node.bounds(), true);
        symbolsByTarget.put(node, symbol);
    }

    @Override
    protected SymbolScope visitForGenericStatement(ForGenericStatement node) {
        var scope = createDefaultScope(node);
        for (var variable : node.variables()) {
            addLoopVariable(scope, variable);
        }
        return scope;
    }

    @Override
    protected SymbolScope visitForNumericStatement(ForNumericStatement node) {
        var scope = createDefaultScope(node);
        addLoopVariable(scope, node.variable());
        return scope;
    }

    private void addLoopVariable(SymbolScope loopScope, Identifier variable) {
        var symbol = new SymbolBuilder(
                variable.name(), CodeSymbolKind.LOCAL_VARIABLE, variable.bounds(), variable.bounds());
        var parent = topScope().parent;
        if (parent != null) {
            parent.children.add(symbol);
        } else {
            roots.add(symbol);
        }
        loopScope.names.add(variable.name());
        lastAdded = symbol;
    }
}
