package ai.p8ls.analyzer.scope;

import static java.util.Objects.requireNonNull;

import ai.p8ls.analyzer.Bounds;
import ai.p8ls.analyzer.ast.AssignmentStatement;
import ai.p8ls.analyzer.ast.AstWalker;
import ai.p8ls.analyzer.ast.Expression;
import ai.p8ls.analyzer.ast.ForGenericStatement;
import ai.p8ls.analyzer.ast.ForNumericStatement;
import ai.p8ls.analyzer.ast.FunctionDeclaration;
import ai.p8ls.analyzer.ast.GotoStatement;
import ai.p8ls.analyzer.ast.Identifier;
import ai.p8ls.analyzer.ast.LabelStatement;
import ai.p8ls.analyzer.ast.LocalStatement;
import ai.p8ls.analyzer.ast.MemberExpression;
import ai.p8ls.analyzer.ast.Node;
import ai.p8ls.analyzer.ast.TableConstructorExpression;
import ai.p8ls.analyzer.ast.TableKeyString;
import ai.p8ls.analyzer.diagnostics.ErrorMessages;
import ai.p8ls.analyzer.diagnostics.Warning;
import ai.p8ls.analyzer.parser.Chunk;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Binds every identifier occurrence of a file to its declaration.
 *
 * <p>Locals follow Lua block scoping: a {@code local} becomes visible after its own statement and shadows outer
 * declarations for the rest of its block. Everything else is global. Function names and member assignments
 * ({@code a.b = 1}) are always defined globally, because a table member can be reached from anywhere.
 *
 * <p>A name used before any definition is an early reference. Once the whole file has been walked, early
 * references are resolved against the global scope, chopping member paths from the left ({@code a.b.c}, then
 * {@code b.c}, then {@code c}). Plain names that still resolve to nothing are reported as undefined and declared
 * as implicit globals.
 */
public final class DefinitionsUsagesFinder extends AstWalker<Scope> {
    private static final Logger logger = LogManager.getLogger(DefinitionsUsagesFinder.class);

    private static final Pattern SELF = Pattern.compile("\\bself\\b");

    private final Chunk chunk;
    private final boolean suppressBuiltinGlobals;
    private final @Nullable Scope injectedGlobalScope;

    private final DefinitionsUsagesLookup lookup = new DefinitionsUsagesLookup();
    private final Map<String, List<Bounds>> earlyRefs = new LinkedHashMap<>();
    private final List<Warning> warnings = new ArrayList<>();
    private final Set<String> implicitGlobals = new LinkedHashSet<>();
    private final List<PendingGoto> gotos = new ArrayList<>();
    private @Nullable ScopeTree tree;

    private record PendingGoto(Scope scope, String label, Bounds bounds) {}

    private DefinitionsUsagesFinder(Chunk chunk, boolean suppressBuiltinGlobals, @Nullable Scope injectedGlobalScope) {
        this.chunk = chunk;
        this.suppressBuiltinGlobals = suppressBuiltinGlobals;
        this.injectedGlobalScope = injectedGlobalScope;
    }

    public static DefinitionsUsagesResult findDefinitionsUsages(Chunk chunk) {
        return findDefinitionsUsages(chunk, chunk.suppressBuiltinGlobals(), null);
    }

    public static DefinitionsUsagesResult findDefinitionsUsages(Chunk chunk, boolean suppressBuiltinGlobals) {
        return findDefinitionsUsages(chunk, suppressBuiltinGlobals, null);
    }

    /**
     * Resolves {@code chunk}.
     *
     * @param injectedGlobalScope the global scope of the project root when this file is included by it; names the
     *     root defines resolve through it and globals defined here are added to it
     */
    public static DefinitionsUsagesResult findDefinitionsUsages(
            Chunk chunk, boolean suppressBuiltinGlobals, @Nullable Scope injectedGlobalScope) {
        requireNonNull(chunk, "chunk");
        if (injectedGlobalScope != null && injectedGlobalScope.kind() != ScopeKind.GLOBAL) {
            throw new IllegalArgumentException("injected scope must be a global scope, got " + injectedGlobalScope);
        }
        var finder = new DefinitionsUsagesFinder(chunk, suppressBuiltinGlobals, injectedGlobalScope);
        finder.walkChunk();
        return finder.finish();
    }

    /**
     * Resolves the files of one project against a single global scope. The first chunk is the project root and
     * creates the global scope. Early references are resolved only after every file has been walked, so a name
     * defined in any file of the project is not reported as undefined in another.
     *
     * @return one result per chunk, in the same order
     */
    public static List<DefinitionsUsagesResult> findDefinitionsUsages(List<Chunk> projectChunks) {
        if (projectChunks.isEmpty()) {
            return List.of();
        }
        var finders = new ArrayList<DefinitionsUsagesFinder>();
        Scope global = null;
        for (var chunk : projectChunks) {
            var finder = new DefinitionsUsagesFinder(chunk, chunk.suppressBuiltinGlobals(), global);
            finder.walkChunk();
            if (global == null) {
                global = finder.globalScope();
            }
            finders.add(finder);
        }
        return finders.stream().map(DefinitionsUsagesFinder::finish).toList();
    }

    private void walkChunk() {
        walk(chunk.block(), new Scope(ScopeKind.FILE, null, null, null));
    }

    private DefinitionsUsagesResult finish() {
        resolveGotos();
        resolveEarlyRefs();
        var scopeTree = requireNonNull(tree, "tree");
        logger.debug(
                "Resolved {}: {} scopes, {} warnings, {} implicit globals",
                chunk.file() == null ? "<anonymous>" : chunk.file().path(),
                scopeTree.size(),
                warnings.size(),
                implicitGlobals.size());
        return new DefinitionsUsagesResult(warnings, lookup, scopeTree, implicitGlobals);
    }

    // -- scopes

    @Override
    protected Scope startingScope() {
        Scope global;
        if (injectedGlobalScope != null) {
            global = injectedGlobalScope;
        } else {
            global = new Scope(ScopeKind.GLOBAL, null, null, null);
            if (!suppressBuiltinGlobals) {
                for (var name : BuiltinGlobals.instance().names()) {
                    global.getOrCreate(name);
                }
            }
        }
        tree = new ScopeTree(global);
        return global;
    }

    @Override
    protected Scope createDefaultScope(@Nullable Node owner) {
        var kind = owner instanceof TableConstructorExpression ? ScopeKind.TABLE : ScopeKind.OTHER;
        var bounds = owner == null ? null : owner.bounds();
        if (scopes().isEmpty()) {
            return new Scope(kind, bounds, null, null);
        }
        // name and self carry into nested blocks
        return new Scope(kind, bounds, topScope().name(), topScope().self());
    }

    @Override
    protected void onEnterScope(Scope scope) {
        requireNonNull(tree, "tree").add(scope, topScope(1));
    }

    private Scope globalScope() {
        return scopes().get(0);
    }

    /** Declared in a scope below the global one. */
    private boolean isSymbolLocal(String name) {
        var stack = scopes();
        for (int i = stack.size() - 1; i > 0; i--) {
            if (stack.get(i).has(name)) {
                return true;
            }
        }
        return false;
    }

    private @Nullable DefinitionsUsages findDefinition(String name) {
        var stack = scopes();
        for (int i = stack.size() - 1; i >= 0; i--) {
            var found = stack.get(i).get(name);
            if (found != null) {
                return found;
            }
        }
        return null;
    }

    // -- recording

    private void addDefinition(String name, Bounds bounds, @Nullable Scope target) {
        var scope = target != null ? target : topScope();
        var definitionsUsages = scope.getOrCreate(name);
        definitionsUsages.addDefinition(bounds);
        lookup.add(bounds, definitionsUsages);
    }

    private void addUsage(String name, Bounds bounds) {
        var definitionsUsages = findDefinition(name);
        if (definitionsUsages == null) {
            earlyRefs.computeIfAbsent(name, k -> new ArrayList<>()).add(bounds);
            return;
        }
        definitionsUsages.addUsage(bounds);
        lookup.add(bounds, definitionsUsages);
        checkDeprecated(name, definitionsUsages, bounds);
    }

    private void checkDeprecated(String name, DefinitionsUsages definitionsUsages, Bounds bounds) {
        if (suppressBuiltinGlobals || !definitionsUsages.definitions().isEmpty()) {
            return;
        }
        if (globalScope().get(name) != definitionsUsages) {
            return;
        }
        var hint = BuiltinGlobals.instance().deprecation(name);
        if (hint != null) {
            warnings.add(new Warning(ErrorMessages.DEPRECATED_BUILTIN.formatted(name, hint), bounds));
        }
    }

    private void resolveGotos() {
        var scopeTree = requireNonNull(tree, "tree");
        for (var pending : gotos) {
            var label = ScopeTree.LABEL_PREFIX + pending.label() + ScopeTree.LABEL_PREFIX;
            for (Scope scope = pending.scope(); scope != null; scope = scopeTree.parent(scope)) {
                var definitionsUsages = scope.get(label);
                if (definitionsUsages != null) {
                    definitionsUsages.addUsage(pending.bounds());
                    lookup.add(pending.bounds(), definitionsUsages);
                    break;
                }
                if (scope.kind() == ScopeKind.FUNCTION) {
                    // labels are not visible across function boundaries
                    break;
                }
            }
        }
    }

    private void resolveEarlyRefs() {
        var global = globalScope();
        for (var entry : earlyRefs.entrySet()) {
            var originalName = entry.getKey();
            var name = originalName;
            boolean isMember = name.indexOf('.') >= 0;

            while (!global.has(name) && name.indexOf('.') >= 0) {
                name = name.substring(name.indexOf('.') + 1);
            }

            if (!global.has(name)) {
                if (!isMember && !name.equals("self")) {
                    for (var bounds : entry.getValue()) {
                        warnings.add(new Warning(ErrorMessages.UNDEFINED_GLOBAL.formatted(originalName), bounds));
                    }
                }
                global.getOrCreate(name);
                implicitGlobals.add(name);
            }

            for (var bounds : entry.getValue()) {
                addUsage(name, bounds);
            }
        }
    }

    // -- names

    private static @Nullable String parentName(MemberExpression member) {
        var base = member.base();
        if (base instanceof Identifier id) {
            return id.name();
        }
        if (base instanceof MemberExpression inner) {
            return inner.dottedName();
        }
        return null;
    }

    /** Dotted name of a member expression with a leading {@code self} replaced by what it refers to here. */
    private String resolveSelf(MemberExpression member) {
        var name = member.dottedName();
        if (name == null) {
            name = "self." + member.identifier().name();
        }
        var root = member.rootIdentifier();
        var scopedSelf = topScope().self();
        if (root != null && root.name().equals("self") && scopedSelf != null) {
            name = SELF.matcher(name).replaceFirst(Matcher.quoteReplacement(scopedSelf));
        }
        return name;
    }

    // -- visitor hooks

    @Override
    protected Scope visitFunctionDeclaration(FunctionDeclaration node) {
        String name = null;
        Bounds nameBounds = null;
        String self = null;
        boolean define = true;
        Scope target = globalScope();

        var identifier = node.identifier();
        if (identifier instanceof Identifier id) {
            name = id.name();
            nameBounds = id.bounds();
            if (node.isLocal()) {
                // visible inside its own body, so recursion resolves
                target = topScope();
            }
        } else if (identifier instanceof MemberExpression member) {
            var dotted = member.dottedName();
            name = dotted != null ? dotted : member.identifier().name();
            nameBounds = member.bounds();
            self = parentName(member);
        } else if (isInAssignment()) {
            // an anonymous function takes its name from what it is assigned to
            var assignee = requireNonNull(topNode(), "assignee").node();
            if (assignee instanceof Identifier id) {
                name = id.name();
                define = false;
            } else if (assignee instanceof MemberExpression member) {
                var dotted = member.dottedName();
                name = dotted != null ? dotted : member.identifier().name();
                self = parentName(member);
                define = false;
            } else if (assignee instanceof TableKeyString key) {
                name = key.key().name();
                nameBounds = key.key().bounds();
                self = topScope().name();
            }
        }

        if (name != null && nameBounds != null && define) {
            addDefinition(name, nameBounds, target);
        }
        return new Scope(ScopeKind.FUNCTION, node.bounds(), name, self);
    }

    @Override
    protected Scope visitTableConstructorExpression(TableConstructorExpression node) {
        if (!isInAssignment()) {
            return createDefaultScope(node);
        }
        var name = topScope().name();
        var assignee = requireNonNull(topNode(), "assignee").node();
        if (assignee instanceof Identifier id) {
            name = id.name();
        } else if (assignee instanceof TableKeyString key) {
            name = key.key().name();
        } else if (assignee instanceof MemberExpression member && member.dottedName() != null) {
            name = member.dottedName();
        }
        return new Scope(ScopeKind.TABLE, node.bounds(), name, topScope().self());
    }

    @Override
    protected void visitIdentifier(Identifier node) {
        var frame = topNode();
        if (frame == null || frame.assignmentTarget()) {
            // a value being assigned, not a child of the node on the stack
            addUsage(node.name(), node.bounds());
            return;
        }
        var parent = frame.node();
        if (isDeclaredBy(parent, node)) {
            addDefinition(node.name(), node.bounds(), null);
            return;
        }
        if (parent instanceof AssignmentStatement
                || parent instanceof LocalStatement
                || parent instanceof LabelStatement
                || parent instanceof GotoStatement
                || parent instanceof MemberExpression) {
            // recorded by the hook for the parent
            return;
        }
        addUsage(node.name(), node.bounds());
    }

    /** Parameters and loop variables, which declare in the scope just entered. */
    private static boolean isDeclaredBy(Node parent, Identifier node) {
        if (parent instanceof FunctionDeclaration function) {
            return containsSame(function.parameters(), node);
        }
        if (parent instanceof ForNumericStatement loop) {
            return loop.variable() == node;
        }
        if (parent instanceof ForGenericStatement loop) {
            return containsSame(loop.variables(), node);
        }
        return false;
    }

    private static boolean containsSame(List<? extends Expression> nodes, Node node) {
        for (var candidate : nodes) {
            if (candidate == node) {
                return true;
            }
        }
        return false;
    }

    @Override
    protected void visitAssignmentStatement(AssignmentStatement node) {
        for (var target : node.targets()) {
            if (target instanceof Identifier id) {
                defineOrReassign(id);
            } else if (target instanceof MemberExpression member) {
                defineMember(member);
            }
            // a[b] = c declares nothing; a and b are picked up as usages
        }
    }

    private void defineOrReassign(Identifier target) {
        var existing = findDefinition(target.name());
        if (existing == null) {
            addDefinition(target.name(), target.bounds(), globalScope());
            return;
        }
        existing.addUsage(target.bounds());
        if (!isSymbolLocal(target.name())) {
            // reassigning a global counts as another definition
            existing.addRedefinition(target.bounds());
        }
        lookup.add(target.bounds(), existing);
    }

    private void defineMember(MemberExpression member) {
        var name = resolveSelf(member);
        var root = member.rootIdentifier();
        if (root != null) {
            var baseName = root.name();
            var scopedSelf = topScope().self();
            if (baseName.equals("self") && scopedSelf != null) {
                baseName = scopedSelf;
            }
            addUsage(baseName, root.bounds());
        }
        addDefinition(name, member.bounds(), globalScope());
    }

    @Override
    protected void leaveLocalStatement(LocalStatement node) {
        for (var variable : node.variables()) {
            addDefinition(variable.name(), variable.bounds(), null);
        }
    }

    @Override
    protected void visitTableKeyString(TableKeyString node) {
        addDefinition(node.key().name(), node.key().bounds(), null);
    }

    @Override
    protected void visitLabelStatement(LabelStatement node) {
        var label = ScopeTree.LABEL_PREFIX + node.label().name() + ScopeTree.LABEL_PREFIX;
        addDefinition(label, node.label().bounds(), null);
    }

    @Override
    protected void visitGotoStatement(GotoStatement node) {
        gotos.add(new PendingGoto(topScope(), node.label().name(), node.label().bounds()));
    }

    @Override
    protected void visitMemberExpression(MemberExpression node) {
        var frame = topNode();
        if (frame != null && !frame.assignmentTarget()) {
            var parent = frame.node();
            if (parent instanceof AssignmentStatement) {
                // assignment target, handled by visitAssignmentStatement
                return;
            }
            if (parent instanceof MemberExpression outer && outer.base() == node) {
                // already counted as a base of the enclosing chain
                return;
            }
        }
        addUsagesOfBases(node);
        addUsage(resolveSelf(node), node.bounds());
    }

    /** {@code a.b.c.d} adds usages of {@code a.b.c}, {@code a.b} and {@code a}. */
    private void addUsagesOfBases(MemberExpression member) {
        Expression current = member.base();
        while (true) {
            if (current instanceof Identifier id) {
                addUsage(id.name(), id.bounds());
                return;
            }
            if (current instanceof MemberExpression inner) {
                addUsage(resolveSelf(inner), inner.bounds());
                current = inner.base();
                continue;
            }
            return;
        }
    }
}
