package ai.p8ls.analyzer.format;

/**
 * Rendering preferences.
 *
 * @param indentWidth spaces per indent level when {@code useSpaces} is set
 * @param useSpaces indent with spaces instead of tabs
 * @param forceOneStatementPerLine put every statement on its own line, even where the source joined several
 */
public record FormatterOptions(int indentWidth, boolean useSpaces, boolean forceOneStatementPerLine) {
    public static final FormatterOptions DEFAULT = new FormatterOptions(2, true, false);

    public FormatterOptions {
        if (indentWidth < 0) {
            throw new IllegalArgumentException("indentWidth must not be negative: " + indentWidth);
        }
    }

    String indentUnit() {
        return useSpaces ? " ".repeat(indentWidth) : "\t";
    }
}
