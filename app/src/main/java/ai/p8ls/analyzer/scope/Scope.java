package ai.p8ls.analyzer.scope;

import static java.util.Objects.requireNonNull;

import ai.p8ls.analyzer.Bounds;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import org.jetbrains.annotations.Nullable;

/**
 * A lexical binding environment: names declared in one block, function, table or file. Nesting lives in the
 * owning {@link ScopeTree}, so a scope itself has no parent pointer and the global scope of a project can be
 * shared by the trees of all its files.
 */
public final class Scope {
    private final ScopeKind kind;
    private final @Nullable Bounds bounds;
    private final @Nullable String name;
    private final @Nullable String self;
    private final Map<String, DefinitionsUsages> symbols = new LinkedHashMap<>();

    /**
     * @param bounds source span; null for the global and file scopes, which cover everything
     * @param name the function or table this scope belongs to, when known
     * @param self what {@code self} refers to inside this scope, when known
     */
    public Scope(ScopeKind kind, @Nullable Bounds bounds, @Nullable String name, @Nullable String self) {
        this.kind = requireNonNull(kind, "kind");
        this.bounds = bounds;
        this.name = name;
        this.self = self;
    }

    public ScopeKind kind() {
        return kind;
    }

    public @Nullable Bounds bounds() {
        return bounds;
    }

    public @Nullable String name() {
        return name;
    }

    public @Nullable String self() {
        return self;
    }

    public @Nullable DefinitionsUsages get(String symbolName) {
        return symbols.get(symbolName);
    }

    public boolean has(String symbolName) {
        return symbols.containsKey(symbolName);
    }

    /** Declared names in declaration order. */
    public Set<String> names() {
        return Collections.unmodifiableSet(symbols.keySet());
    }

    DefinitionsUsages getOrCreate(String symbolName) {
        return symbols.computeIfAbsent(symbolName, DefinitionsUsages::new);
    }

    public boolean contains(int line, int column) {
        return bounds == null || bounds.contains(line, column);
    }

    @Override
    public String toString() {
        return "Scope[" + kind + (name == null ? "" : " " + name) + ", " + symbols.keySet() + "]";
    }
}
