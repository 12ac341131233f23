package ai.p8ls.analyzer;

import org.jetbrains.annotations.Nullable;

/**
 * A location in a source file.
 *
 * @param line 1-based line number
 * @param column 0-based column, counted in UTF-16 code units from the start of the line
 * @param index 0-based offset into the whole text, in UTF-16 code units
 * @param file the file the text came from, or null for anonymous input
 */
public record SourcePosition(int line, int column, int index, @Nullable ResolvedFile file) {

    public boolean isBefore(SourcePosition other) {
        return index < other.index;
    }

    @Override
    public String toString() {
        return line + ":" + column;
    }
}
