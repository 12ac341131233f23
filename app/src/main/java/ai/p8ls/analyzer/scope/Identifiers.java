package ai.p8ls.analyzer.scope;

import com.google.common.base.Splitter;
import java.util.List;
import org.jetbrains.annotations.Nullable;

/** Text-level identifier lookups for positions that may not parse, such as a line being typed. */
public final class Identifiers {
    private static final Splitter LINE_SPLITTER = Splitter.on('\n');

    private Identifiers() {}

    /**
     * The identifier touching the position, with any member path in front of it: on {@code b} in {@code a.b.c}
     * this is {@code a.b}. Returns null when the position is not on an identifier.
     *
     * @param line 1-based
     * @param column 0-based; the position just after the last character still counts
     */
    public static @Nullable String identifierAtPosition(String text, int line, int column) {
        List<String> lines = LINE_SPLITTER.splitToList(text);
        if (line < 1 || line > lines.size()) {
            return null;
        }
        var content = lines.get(line - 1);
        if (column < 0 || column > content.length()) {
            return null;
        }

        int end = column;
        while (end < content.length() && isIdentifierChar(content.charAt(end))) {
            end++;
        }
        int start = column;
        while (start > 0 && isIdentifierChar(content.charAt(start - 1))) {
            start--;
        }
        if (start == end || Character.isDigit(content.charAt(start))) {
            return null;
        }

        // extend left over a.b.
        while (start > 1 && (content.charAt(start - 1) == '.' || content.charAt(start - 1) == ':')) {
            int segmentStart = start - 1;
            while (segmentStart > 0 && isIdentifierChar(content.charAt(segmentStart - 1))) {
                segmentStart--;
            }
            if (segmentStart == start - 1) {
                break;
            }
            start = segmentStart;
        }
        return content.substring(start, end).replace(':', '.');
    }

    private static boolean isIdentifierChar(char c) {
        // glyphs and kana are identifier characters in PICO-8
        return c >= 0x80 || c == '_' || Character.isLetterOrDigit(c);
    }
}
