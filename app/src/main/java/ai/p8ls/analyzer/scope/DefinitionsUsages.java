package ai.p8ls.analyzer.scope;

import static java.util.Objects.requireNonNull;

import ai.p8ls.analyzer.Bounds;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Every occurrence of one binding. A declaration counts as both a definition and a usage, so {@link #usages()}
 * is the full list of places to highlight or rename.
 */
public final class DefinitionsUsages {
    private final String symbolName;
    private final List<Bounds> definitions = new ArrayList<>();
    private final List<Bounds> usages = new ArrayList<>();

    DefinitionsUsages(String symbolName) {
        this.symbolName = requireNonNull(symbolName, "symbolName");
    }

    public String symbolName() {
        return symbolName;
    }

    public List<Bounds> definitions() {
        return Collections.unmodifiableList(definitions);
    }

    public List<Bounds> usages() {
        return Collections.unmodifiableList(usages);
    }

    void addDefinition(Bounds bounds) {
        definitions.add(bounds);
        usages.add(bounds);
    }

    /** Adds a usage unless it repeats the most recent one. */
    void addUsage(Bounds bounds) {
        if (usages.isEmpty() || !usages.get(usages.size() - 1).equals(bounds)) {
            usages.add(bounds);
        }
    }

    /** Adds a definition that is already recorded as a usage, unless it repeats the most recent one. */
    void addRedefinition(Bounds bounds) {
        if (definitions.isEmpty() || !definitions.get(definitions.size() - 1).equals(bounds)) {
            definitions.add(bounds);
        }
    }

    void mergeFrom(DefinitionsUsages other) {
        for (var bounds : other.definitions) {
            if (!definitions.contains(bounds)) {
                definitions.add(bounds);
            }
        }
        for (var bounds : other.usages) {
            if (!usages.contains(bounds)) {
                usages.add(bounds);
            }
        }
    }

    @Override
    public String toString() {
        return "DefinitionsUsages[" + symbolName + ", definitions=" + definitions + ", usages=" + usages + "]";
    }
}
