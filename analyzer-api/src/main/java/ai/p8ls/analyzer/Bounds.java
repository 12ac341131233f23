package ai.p8ls.analyzer;

import static java.util.Objects.requireNonNull;

import org.jetbrains.annotations.Nullable;

/**
 * Start and end positions delimiting a syntax element. {@code end} points just past the last character.
 */
public record Bounds(SourcePosition start, SourcePosition end) {

    public Bounds {
        requireNonNull(start, "start");
        requireNonNull(end, "end");
    }

    /** Bounds spanning from the start of {@code first} to the end of {@code last}. */
    public static Bounds span(Bounds first, Bounds last) {
        return new Bounds(first.start(), last.end());
    }

    public @Nullable ResolvedFile file() {
        return start.file();
    }

    public boolean isSingleLine() {
        return start.line() == end.line();
    }

    /**
     * True when the position falls inside these bounds. Columns are inclusive on both ends, so the position right
     * after an identifier still counts as touching it.
     */
    public boolean contains(int line, int column) {
        if (line < start.line() || line > end.line()) {
            return false;
        }
        if (line == start.line() && column < start.column()) {
            return false;
        }
        return line != end.line() || column <= end.column();
    }

    /** Whether {@code other} lies entirely inside these bounds. */
    public boolean encloses(Bounds other) {
        return start.index() <= other.start().index() && other.end().index() <= end.index();
    }

    /** Width in UTF-16 code units; used to pick the narrowest of overlapping bounds. */
    public int length() {
        return end.index() - start.index();
    }

    /**
     * Three-way placement of {@code element} relative to {@code reference}.
     */
    public static Placement compare(Bounds element, Bounds reference) {
        if (element.end().index() <= reference.start().index()) {
            return Placement.BEFORE;
        }
        if (element.start().index() >= reference.end().index()) {
            return Placement.AFTER;
        }
        return Placement.CONTAINS;
    }

    public enum Placement {
        BEFORE,
        CONTAINS,
        AFTER
    }

    @Override
    public String toString() {
        return "[" + start + "-" + end + "]";
    }
}
