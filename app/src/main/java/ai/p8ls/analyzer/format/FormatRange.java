package ai.p8ls.analyzer.format;

/**
 * The part of a document replaced by formatted text. Lines are 0-based, as editors count them; an end line of
 * {@link #END_OF_DOCUMENT} stands for "through the end of the text".
 */
public record FormatRange(int startLine, int startCharacter, int endLine, int endCharacter) {
    public static final int END_OF_DOCUMENT = Integer.MAX_VALUE;

    public static FormatRange wholeDocument() {
        return new FormatRange(0, 0, END_OF_DOCUMENT, 0);
    }

    public boolean extendsToEnd() {
        return endLine == END_OF_DOCUMENT;
    }
}
