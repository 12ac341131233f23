package ai.p8ls.analyzer.lexer;

import ai.p8ls.analyzer.Bounds;
import org.jetbrains.annotations.Nullable;

/**
 * A single lexed token.
 *
 * @param type token category
 * @param value keyword/identifier/punctuator text, decoded string contents, a {@link Double} for numbers, a
 *     {@link Boolean} for booleans, null for nil, or the error message for {@link TokenType#ERROR}
 * @param raw source text the token was scanned from
 * @param bounds location of the token
 */
public record Token(TokenType type, @Nullable Object value, String raw, Bounds bounds) {

    /** True if this is a keyword or punctuator with the given text. */
    public boolean is(String text) {
        return (type == TokenType.KEYWORD || type == TokenType.PUNCTUATOR || type == TokenType.VARARG_LITERAL)
                && text.equals(value);
    }

    public boolean isEof() {
        return type == TokenType.EOF;
    }

    /** Short text used in "near '...'" fragments of messages. */
    public String displayText() {
        return switch (type) {
            case EOF -> "<eof>";
            case NEWLINE -> "<newline>";
            case STRING_LITERAL, NUMERIC_LITERAL, ERROR -> raw;
            case NIL_LITERAL -> "nil";
            default -> String.valueOf(value);
        };
    }

    public String stringValue() {
        return value == null ? "" : value.toString();
    }
}
