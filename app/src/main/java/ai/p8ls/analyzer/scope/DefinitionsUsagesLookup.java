package ai.p8ls.analyzer.scope;

import ai.p8ls.analyzer.Bounds;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.jetbrains.annotations.Nullable;

/** Finds the binding of the identifier occurrence at a position. Occurrences are indexed by their start line. */
public final class DefinitionsUsagesLookup {
    private record Occurrence(Bounds bounds, DefinitionsUsages definitionsUsages) {}

    private final Map<Integer, List<Occurrence>> lines = new HashMap<>();

    void add(Bounds bounds, DefinitionsUsages definitionsUsages) {
        var line = lines.computeIfAbsent(bounds.start().line(), k -> new ArrayList<>());
        for (var occurrence : line) {
            var existing = occurrence.definitionsUsages();
            if (existing.symbolName().equals(definitionsUsages.symbolName()) && occurrence.bounds().equals(bounds)) {
                if (existing != definitionsUsages) {
                    existing.mergeFrom(definitionsUsages);
                }
                return;
            }
        }
        line.add(new Occurrence(bounds, definitionsUsages));
    }

    /** The binding whose occurrence covers the position, preferring the narrowest occurrence; null if none. */
    public @Nullable DefinitionsUsages lookup(int line, int column) {
        var occurrences = lines.get(line);
        if (occurrences == null) {
            return null;
        }
        Occurrence found = null;
        for (var occurrence : occurrences) {
            var bounds = occurrence.bounds();
            boolean matches = column >= bounds.start().column() && column <= bounds.end().column();
            if (matches && (found == null || found.bounds().length() > bounds.length())) {
                found = occurrence;
            }
        }
        return found == null ? null : found.definitionsUsages();
    }
}
