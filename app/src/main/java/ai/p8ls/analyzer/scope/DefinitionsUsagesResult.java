package ai.p8ls.analyzer.scope;

import static java.util.Objects.requireNonNull;

import ai.p8ls.analyzer.diagnostics.Warning;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Output of scope resolution for one file.
 *
 * @param warnings undefined variables and deprecated builtins, in the order found
 * @param implicitGlobals names used without any definition, in order of first use; the
 *     resolver declares them in the global scope
 */
public record DefinitionsUsagesResult(
        List<Warning> warnings, DefinitionsUsagesLookup lookup, ScopeTree scopeTree, Set<String> implicitGlobals) {

    public DefinitionsUsagesResult {
        warnings = List.copyOf(warnings);
        requireNonNull(lookup, "lookup");
        requireNonNull(scopeTree, "scopeTree");
        implicitGlobals = Collections.unmodifiableSet(new LinkedHashSet<>(implicitGlobals));
    }

    /** The global scope, for injection into the files this one includes. */
    public Scope globalScope() {
        return scopeTree.root();
    }
}
