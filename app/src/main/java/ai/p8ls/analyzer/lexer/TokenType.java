package ai.p8ls.analyzer.lexer;

public enum TokenType {
    EOF("<eof>"),
    STRING_LITERAL("string"),
    KEYWORD("keyword"),
    IDENTIFIER("identifier"),
    NUMERIC_LITERAL("number"),
    PUNCTUATOR("symbol"),
    BOOLEAN_LITERAL("boolean"),
    NIL_LITERAL("symbol"),
    VARARG_LITERAL("symbol"),
    /** Only produced while the lexer is in newline-significant mode. */
    NEWLINE("newline"),
    /** Rest of a line, used for {@code #include} arguments. */
    RAW("raw"),
    /** An unrecognized character or malformed literal; the value is the error message. */
    ERROR("error");

    private final String description;

    TokenType(String description) {
        this.description = description;
    }

    /** Noun used in "unexpected ..." messages. */
    public String description() {
        return description;
    }
}
