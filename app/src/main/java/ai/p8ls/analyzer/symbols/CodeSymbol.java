package ai.p8ls.analyzer.symbols;

import static java.util.Objects.requireNonNull;

import ai.p8ls.analyzer.Bounds;
import java.util.List;
import org.jetbrains.annotations.Nullable;

/**
 * One entry of a file outline.
 *
 * @param name variable or function name; members use dotted paths such as {@code player.update}
 * @param detail parameter signature like {@code (x,y)} for functions, otherwise null
 * @param bounds the whole declaring statement
 * @param selectionBounds just the name, which is what go-to-definition selects
 * @param children symbols declared inside this one (parameters, locals, table keys)
 */
public record CodeSymbol(
        String name,
        @Nullable String detail,
        CodeSymbolKind kind,
        Bounds bounds,
        Bounds selectionBounds,
        List<CodeSymbol> children) {

    public CodeSymbol {
        requireNonNull(name, "name");
        if (name.isEmpty()) {
            throw new IllegalArgumentException("symbol name must not be empty");
        }
        requireNonNull(kind, "kind");
        requireNonNull(bounds, "bounds");
        requireNonNull(selectionBounds, "selectionBounds");
        children = List.copyOf(children);
    }
}
