package ai.p8ls.analyzer.scope;

import static java.util.Objects.requireNonNull;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import org.jetbrains.annotations.Nullable;

/**
 * The scopes of one resolved file, root first. Parent and child links are indices into this arena; the root is
 * the (possibly shared) global scope.
 */
public final class ScopeTree {
    static final String LABEL_PREFIX = "::";

    private final List<Scope> scopes = new ArrayList<>();
    private final List<Integer> parents = new ArrayList<>();
    private final List<List<Integer>> children = new ArrayList<>();
    private final Map<Scope, Integer> indices = new IdentityHashMap<>();

    ScopeTree(Scope root) {
        append(root, -1);
    }

    void add(Scope scope, Scope parent) {
        int parentIndex = indexOf(parent);
        int index = append(scope, parentIndex);
        children.get(parentIndex).add(index);
    }

    private int append(Scope scope, int parentIndex) {
        if (indices.containsKey(scope)) {
            throw new IllegalStateException("scope already in tree: " + scope);
        }
        int index = scopes.size();
        scopes.add(scope);
        parents.add(parentIndex);
        children.add(new ArrayList<>());
        indices.put(scope, index);
        return index;
    }

    private int indexOf(Scope scope) {
        var index = indices.get(requireNonNull(scope, "scope"));
        if (index == null) {
            throw new IllegalArgumentException("scope not in this tree: " + scope);
        }
        return index;
    }

    public Scope root() {
        return scopes.get(0);
    }

    public int size() {
        return scopes.size();
    }

    public @Nullable Scope parent(Scope scope) {
        int parent = parents.get(indexOf(scope));
        return parent < 0 ? null : scopes.get(parent);
    }

    public List<Scope> children(Scope scope) {
        return children.get(indexOf(scope)).stream().map(scopes::get).toList();
    }

    /** The innermost scope containing the position. */
    public Scope lookupScopeFor(int line, int column) {
        int current = 0;
        outer:
        while (true) {
            for (int child : children.get(current)) {
                if (scopes.get(child).contains(line, column)) {
                    current = child;
                    continue outer;
                }
            }
            return scopes.get(current);
        }
    }

    /** Names visible from {@code scope}, innermost first, each once. Labels are not included. */
    public List<String> allSymbols(Scope scope) {
        var names = new LinkedHashSet<String>();
        for (int i = indexOf(scope); i >= 0; i = parents.get(i)) {
            for (var name : scopes.get(i).names()) {
                if (!name.startsWith(LABEL_PREFIX)) {
                    names.add(name);
                }
            }
        }
        return List.copyOf(names);
    }
}
