package ai.p8ls.cli;

import ai.p8ls.analyzer.format.FormatResult;
import com.google.common.base.Joiner;
import com.google.common.base.Splitter;

/** Applies a {@link FormatResult} to the text it was computed from. */
final class FormatEdits {
    private static final Splitter LINES = Splitter.on('\n');
    private static final Joiner NEWLINE = Joiner.on('\n');

    private FormatEdits() {}

    static String apply(String original, FormatResult result) {
        var range = result.range();
        if (range.startLine() == 0 && range.extendsToEnd()) {
            return result.formattedText();
        }
        var lines = LINES.splitToList(original);
        int start = Math.min(range.startLine(), lines.size());
        int end = range.extendsToEnd() ? lines.size() : Math.min(range.endLine(), lines.size());
        var before = NEWLINE.join(lines.subList(0, start));
        var after = NEWLINE.join(lines.subList(end, lines.size()));
        return (before.isEmpty() ? "" : before + "\n") + result.formattedText() + after;
    }
}
