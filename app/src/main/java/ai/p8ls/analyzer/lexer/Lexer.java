package ai.p8ls.analyzer.lexer;

import static java.util.Objects.requireNonNull;

import ai.p8ls.analyzer.Bounds;
import ai.p8ls.analyzer.ResolvedFile;
import ai.p8ls.analyzer.SourcePosition;
import ai.p8ls.analyzer.ast.Comment;
import ai.p8ls.analyzer.diagnostics.ErrorMessages;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;
import org.jetbrains.annotations.Nullable;

/**
 * Tokenizer for the PICO-8 dialect of Lua.
 *
 * <p>Tokens are produced one at a time through {@link #next()}; the lexer keeps exactly one token of lookahead.
 * Comments are collected on the side and exposed through {@link #comments()}. Malformed input never throws: the
 * offending text becomes an {@link TokenType#ERROR} token whose value is the diagnostic message.
 *
 * <p>For cartridge files (text starting with {@code pico-8 cartridge}) only the {@code __lua__} section is
 * tokenized; the first section marker line after it ends the stream.
 */
public final class Lexer {
    private static final Set<String> KEYWORDS = Set.of(
            "and", "break", "do", "else", "elseif", "end", "for", "function", "goto", "if", "in", "local", "not",
            "or", "repeat", "return", "then", "until", "while");

    private static final Pattern END_OF_CODE_SECTION =
            Pattern.compile("^__(gfx|gff|label|map|sfx|music|meta:[A-Za-z0-9_]+)__$");

    private static final String CARTRIDGE_HEADER = "pico-8 cartridge";

    private final String input;
    private final int length;
    private final @Nullable ResolvedFile file;
    private final List<Comment> comments = new ArrayList<>();

    private int index;
    private int line = 1;
    private int lineStart;

    private int tokenStart;
    private int tokenStartLine;
    private int tokenStartLineIdx;

    private boolean cartridge;
    private boolean reachedEnd;
    private boolean newlineSignificant;
    private @Nullable Token pendingError;

    private @Nullable Token token;
    private @Nullable Token lookahead;
    private @Nullable Token previousToken;
    // state captured right before the lookahead was scanned, so consumeRestOfLine can rewind
    private @Nullable Checkpoint lookaheadCheckpoint;

    private record Checkpoint(int index, int line, int lineStart, int commentCount, boolean reachedEnd) {}

    public Lexer(String input, @Nullable ResolvedFile file) {
        this.input = requireNonNull(input, "input");
        this.length = input.length();
        this.file = file;
        skipHeader();
    }

    public static boolean isBeginningOfCodeSection(String line) {
        return line.equals("__lua__");
    }

    public static boolean isEndOfCodeSection(String line) {
        return END_OF_CODE_SECTION.matcher(line).matches();
    }

    /** Current token. Valid after the first call to {@link #next()}. */
    public Token token() {
        return requireNonNull(token, "next() has not been called");
    }

    public Token lookahead() {
        return requireNonNull(lookahead, "next() has not been called");
    }

    public @Nullable Token previousToken() {
        return previousToken;
    }

    public String input() {
        return input;
    }

    public @Nullable ResolvedFile file() {
        return file;
    }

    public boolean isCartridge() {
        return cartridge;
    }

    public List<Comment> comments() {
        return Collections.unmodifiableList(comments);
    }

    /**
     * While enabled, a line break between the current token and the lookahead is reported as a
     * {@link TokenType#NEWLINE} token. Used by the one-line {@code if} and the {@code ?} print shorthand.
     */
    public void setNewlineSignificant(boolean newlineSignificant) {
        this.newlineSignificant = newlineSignificant;
    }

    public boolean isNewlineSignificant() {
        return newlineSignificant;
    }

    /** Advances to the next token. */
    public void next() {
        previousToken = token;
        if (lookahead == null) {
            lookahead = lexWithCheckpoint();
        }

        var current = token;
        if (newlineSignificant
                && current != null
                && current.type() != TokenType.NEWLINE
                && current.bounds().end().line() != lookahead.bounds().start().line()) {
            var at = lookahead.bounds().start();
            token = new Token(TokenType.NEWLINE, "\n", "", new Bounds(at, at));
            return;
        }

        token = lookahead;
        lookahead = lexWithCheckpoint();
    }

    /** Consumes the current token if it is the given keyword or punctuator. */
    public boolean consume(String value) {
        if (token().is(value)) {
            next();
            return true;
        }
        return false;
    }

    /**
     * Replaces the current token with a {@link TokenType#RAW} token holding the source text from the start of the
     * current token to the end of its line, then resumes normal scanning on the next line.
     */
    public void consumeRestOfLine() {
        var current = token();
        var checkpoint = requireNonNull(lookaheadCheckpoint, "lookaheadCheckpoint");
        previousToken = current;

        // rewind to where the lookahead started and drop anything it collected
        while (comments.size() > checkpoint.commentCount()) {
            comments.remove(comments.size() - 1);
        }
        reachedEnd = checkpoint.reachedEnd();
        pendingError = null;
        var start = current.bounds().start();
        index = start.index();
        line = start.line();
        lineStart = start.index() - start.column();

        markTokenStart();
        while (index < length && !isLineTerminator(input.charAt(index))) {
            index++;
        }
        var raw = input.substring(tokenStart, index);
        token = makeToken(TokenType.RAW, raw);
        lookahead = lexWithCheckpoint();
    }

    private Token lexWithCheckpoint() {
        lookaheadCheckpoint = new Checkpoint(index, line, lineStart, comments.size(), reachedEnd);
        return lex();
    }

    private void skipHeader() {
        if (!input.startsWith(CARTRIDGE_HEADER)) {
            return;
        }
        cartridge = true;
        while (index < length && !isBeginningOfCodeSection(currentLine().trim())) {
            skipLine();
        }
        skipLine();
    }

    private String currentLine() {
        int i = lineStart;
        while (i < length && !isLineTerminator(input.charAt(i))) {
            i++;
        }
        return input.substring(lineStart, i);
    }

    private void skipLine() {
        while (index < length) {
            if (isLineTerminator(input.charAt(index))) {
                consumeEOL();
                return;
            }
            index++;
        }
    }

    private Token lex() {
        if (reachedEnd) {
            markTokenStart();
            return makeToken(TokenType.EOF, "<eof>");
        }

        skipWhiteSpace();
        while (startsComment()) {
            comments.add(scanComment(input.charAt(index) == '-'));
            skipWhiteSpace();
        }
        if (pendingError != null) {
            var error = pendingError;
            pendingError = null;
            return error;
        }

        markTokenStart();
        if (index >= length) {
            return makeToken(TokenType.EOF, "<eof>");
        }

        if (cartridge && index == lineStart && isEndOfCodeSection(currentLine().trim())) {
            reachedEnd = true;
            return makeToken(TokenType.EOF, "<eof>");
        }

        int cp = input.codePointAt(index);
        if (isIdentifierStart(cp)) {
            return scanIdentifierOrKeyword();
        }

        char ch = input.charAt(index);
        char next = charAt(index + 1);
        switch (ch) {
            case '\'':
            case '"':
                return scanStringLiteral();
            case '0': case '1': case '2': case '3': case '4':
            case '5': case '6': case '7': case '8': case '9':
                return scanNumericLiteral();
            case '.':
                if (isDecDigit(next)) {
                    return scanNumericLiteral();
                }
                if (next == '.') {
                    char third = charAt(index + 2);
                    if (third == '=') {
                        return scanPunctuator("..=");
                    }
                    if (third == '.') {
                        index += 3;
                        return makeToken(TokenType.VARARG_LITERAL, "...");
                    }
                    return scanPunctuator("..");
                }
                return scanPunctuator(".");
            case '=':
                return scanPunctuator(next == '=' ? "==" : "=");
            case '>':
                if (next == '>') {
                    char third = charAt(index + 2);
                    if (third == '=') {
                        return scanPunctuator(">>=");
                    }
                    if (third == '>') {
                        return scanPunctuator(charAt(index + 3) == '=' ? ">>>=" : ">>>");
                    }
                    if (third == '<') {
                        return scanPunctuator(charAt(index + 3) == '=' ? ">><=" : ">><");
                    }
                    return scanPunctuator(">>");
                }
                return scanPunctuator(next == '=' ? ">=" : ">");
            case '<':
                if (next == '<') {
                    char third = charAt(index + 2);
                    if (third == '=') {
                        return scanPunctuator("<<=");
                    }
                    if (third == '>') {
                        return scanPunctuator(charAt(index + 3) == '=' ? "<<>=" : "<<>");
                    }
                    return scanPunctuator("<<");
                }
                return scanPunctuator(next == '=' ? "<=" : "<");
            case '~':
                return scanPunctuator(next == '=' ? "~=" : "~");
            case ':':
                return scanPunctuator(next == ':' ? "::" : ":");
            case '[':
                if (next == '[' || next == '=') {
                    var longString = scanLongStringLiteral();
                    if (longString != null) {
                        return longString;
                    }
                }
                return scanPunctuator("[");
            case '^':
                if (next == '=') {
                    return scanPunctuator("^=");
                }
                if (next == '^') {
                    return scanPunctuator(charAt(index + 2) == '=' ? "^^=" : "^^");
                }
                return scanPunctuator("^");
            case '!':
                if (next == '=') {
                    return scanPunctuator("!=");
                }
                break;
            case '%':
            case '&':
            case '*':
            case '+':
            case '-':
            case '/':
            case '\\':
            case '|':
                return scanPunctuator(next == '=' ? ch + "=" : String.valueOf(ch));
            case '#':
            case '$':
            case '(':
            case ')':
            case ',':
            case ';':
            case '?':
            case '@':
            case ']':
            case '{':
            case '}':
                return scanPunctuator(String.valueOf(ch));
            default:
                break;
        }

        var unexpected = new String(Character.toChars(cp));
        index += Character.charCount(cp);
        return errorToken(ErrorMessages.UNEXPECTED_CHARACTER.formatted(unexpected));
    }

    private boolean startsComment() {
        if (index + 1 >= length) {
            return false;
        }
        char c = input.charAt(index);
        return (c == '-' || c == '/') && input.charAt(index + 1) == c;
    }

    private void markTokenStart() {
        tokenStart = index;
        tokenStartLine = line;
        tokenStartLineIdx = lineStart;
    }

    private Bounds currentBounds() {
        return new Bounds(
                new SourcePosition(tokenStartLine, tokenStart - tokenStartLineIdx, tokenStart, file),
                new SourcePosition(line, index - lineStart, index, file));
    }

    private Token makeToken(TokenType type, @Nullable Object value) {
        return new Token(type, value, input.substring(tokenStart, index), currentBounds());
    }

    private Token errorToken(String message) {
        return makeToken(TokenType.ERROR, message);
    }

    private char charAt(int i) {
        return i < length ? input.charAt(i) : '\0';
    }

    private boolean consumeEOL() {
        if (index >= length) {
            return false;
        }
        char c = input.charAt(index);
        if (!isLineTerminator(c)) {
            return false;
        }
        char peek = charAt(index + 1);
        // \r\n and \n\r count as a single line break
        index += ((c == '\n' && peek == '\r') || (c == '\r' && peek == '\n')) ? 2 : 1;
        line++;
        lineStart = index;
        return true;
    }

    private void skipWhiteSpace() {
        while (index < length) {
            char c = input.charAt(index);
            if (isWhiteSpace(c)) {
                index++;
            } else if (!consumeEOL()) {
                break;
            }
        }
    }

    private Token scanIdentifierOrKeyword() {
        while (index < length) {
            int cp = input.codePointAt(index);
            if (!isIdentifierPart(cp)) {
                break;
            }
            index += Character.charCount(cp);
        }
        var value = input.substring(tokenStart, index);

        if (KEYWORDS.contains(value)) {
            return makeToken(TokenType.KEYWORD, value);
        }
        if (value.equals("true") || value.equals("false")) {
            return makeToken(TokenType.BOOLEAN_LITERAL, value.equals("true"));
        }
        if (value.equals("nil")) {
            return makeToken(TokenType.NIL_LITERAL, null);
        }
        return makeToken(TokenType.IDENTIFIER, value);
    }

    private Token scanPunctuator(String value) {
        index += value.length();
        return makeToken(TokenType.PUNCTUATOR, value);
    }

    private Token scanStringLiteral() {
        char delimiter = input.charAt(index++);
        var sb = new StringBuilder();
        String error = null;

        while (true) {
            if (index >= length) {
                error = ErrorMessages.UNFINISHED_STRING.formatted(input.substring(tokenStart, index));
                break;
            }
            char c = input.charAt(index);
            if (c == delimiter) {
                index++;
                break;
            }
            if (isLineTerminator(c)) {
                // the line break is left for the next scan so line counting stays correct
                error = ErrorMessages.UNFINISHED_STRING.formatted(input.substring(tokenStart, index));
                break;
            }
            if (c == '\\') {
                index++;
                var escapeError = readEscapeSequence(sb);
                if (escapeError != null && error == null) {
                    error = escapeError;
                }
                continue;
            }
            sb.append(c);
            index++;
        }

        if (error != null) {
            return errorToken(error);
        }
        return makeToken(TokenType.STRING_LITERAL, sb.toString());
    }

    /** Decodes one escape sequence after a backslash. Returns an error message, or null on success. */
    private @Nullable String readEscapeSequence(StringBuilder sb) {
        if (index >= length) {
            return null;
        }
        int sequenceStart = index;
        char c = input.charAt(index);
        switch (c) {
            case 'n':
                index++;
                sb.append('\n');
                return null;
            case 'r':
                index++;
                sb.append('\r');
                return null;
            case 't':
                index++;
                sb.append('\t');
                return null;
            case '\r':
            case '\n':
                consumeEOL();
                sb.append('\n');
                return null;
            case 'z':
                index++;
                skipWhiteSpace();
                return null;
            case 'x':
                if (isHexDigit(charAt(index + 1)) && isHexDigit(charAt(index + 2))) {
                    sb.append((char) Integer.parseInt(input.substring(index + 1, index + 3), 16));
                    index += 3;
                    return null;
                }
                index++;
                return ErrorMessages.HEXADECIMAL_DIGIT_EXPECTED.formatted(
                        "\\" + input.substring(sequenceStart, Math.min(length, sequenceStart + 3)));
            case '\\':
            case '"':
            case '\'':
                // P8SCII control codes, kept verbatim
            case '*':
            case '#':
            case '-':
            case '|':
            case '+':
            case '^':
            case 'a':
            case 'b':
            case 'v':
            case 'f':
                index++;
                sb.append(c);
                return null;
            default:
                break;
        }

        if (isDecDigit(c)) {
            int value = 0;
            int digits = 0;
            while (digits < 3 && isDecDigit(charAt(index))) {
                value = value * 10 + (input.charAt(index) - '0');
                index++;
                digits++;
            }
            sb.append((char) value);
            return null;
        }

        index++;
        return ErrorMessages.INVALID_ESCAPE.formatted("\\" + c);
    }

    private @Nullable Token scanLongStringLiteral() {
        var longString = readLongBracket();
        if (longString == null) {
            return null;
        }
        if (!longString.closed()) {
            return errorToken(ErrorMessages.UNFINISHED_LONG_STRING.formatted(longString.firstLine(), "<eof>"));
        }
        return makeToken(TokenType.STRING_LITERAL, longString.content());
    }

    private record LongBracket(String content, boolean closed, int firstLine) {}

    /**
     * Reads {@code [[...]]} or {@code [==[...]==]} starting at the opening bracket. Returns null, without consuming
     * anything, if the text at the current index is not a long bracket opener.
     */
    private @Nullable LongBracket readLongBracket() {
        int level = 0;
        while (charAt(index + 1 + level) == '=') {
            level++;
        }
        if (charAt(index + 1 + level) != '[') {
            return null;
        }
        int firstLine = line;
        index += level + 2;
        // a line break right after the opener is not part of the content
        consumeEOL();

        int contentStart = index;
        while (index < length) {
            char c = input.charAt(index);
            if (isLineTerminator(c)) {
                consumeEOL();
                continue;
            }
            if (c == ']' && closesLongBracket(level)) {
                var content = input.substring(contentStart, index);
                index += level + 2;
                return new LongBracket(content, true, firstLine);
            }
            index++;
        }
        return new LongBracket(input.substring(contentStart), false, firstLine);
    }

    private boolean closesLongBracket(int level) {
        for (int i = 1; i <= level; i++) {
            if (charAt(index + i) != '=') {
                return false;
            }
        }
        return charAt(index + level + 1) == ']';
    }

    private Token scanNumericLiteral() {
        char first = input.charAt(index);
        char second = charAt(index + 1);
        Double value;
        if (first == '0' && (second == 'x' || second == 'X')) {
            value = readRadixLiteral(16, true);
        } else if (first == '0' && (second == 'b' || second == 'B')) {
            value = readRadixLiteral(2, false);
        } else {
            value = readDecLiteral();
        }
        if (value == null) {
            return errorToken(ErrorMessages.MALFORMED_NUMBER.formatted(input.substring(tokenStart, index)));
        }
        return makeToken(TokenType.NUMERIC_LITERAL, value);
    }

    /** Hex and binary literals: digits, optional fraction, and (hex only) an optional binary exponent. */
    private @Nullable Double readRadixLiteral(int radix, boolean allowExponent) {
        index += 2;
        double value = 0;
        int digits = 0;
        while (index < length && Character.digit(input.charAt(index), radix) >= 0) {
            value = value * radix + Character.digit(input.charAt(index), radix);
            index++;
            digits++;
        }
        if (charAt(index) == '.') {
            index++;
            double scale = 1.0 / radix;
            while (index < length && Character.digit(input.charAt(index), radix) >= 0) {
                value += Character.digit(input.charAt(index), radix) * scale;
                scale /= radix;
                index++;
                digits++;
            }
        }
        if (digits == 0) {
            return null;
        }
        if (allowExponent && (charAt(index) == 'p' || charAt(index) == 'P')) {
            index++;
            int sign = 1;
            if (charAt(index) == '+' || charAt(index) == '-') {
                sign = input.charAt(index) == '-' ? -1 : 1;
                index++;
            }
            if (!isDecDigit(charAt(index))) {
                return null;
            }
            int exponent = 0;
            while (isDecDigit(charAt(index))) {
                exponent = exponent * 10 + (input.charAt(index) - '0');
                index++;
            }
            value *= Math.pow(2, sign * exponent);
        }
        return value;
    }

    private @Nullable Double readDecLiteral() {
        while (isDecDigit(charAt(index))) {
            index++;
        }
        if (charAt(index) == '.') {
            index++;
            while (isDecDigit(charAt(index))) {
                index++;
            }
        }
        if (charAt(index) == 'e' || charAt(index) == 'E') {
            index++;
            if (charAt(index) == '+' || charAt(index) == '-') {
                index++;
            }
            if (!isDecDigit(charAt(index))) {
                return null;
            }
            while (isDecDigit(charAt(index))) {
                index++;
            }
        }
        try {
            return Double.parseDouble(input.substring(tokenStart, index));
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private Comment scanComment(boolean canBeLong) {
        markTokenStart();
        index += 2;

        if (canBeLong && charAt(index) == '[') {
            var longComment = readLongBracket();
            if (longComment != null) {
                var comment = new Comment(longComment.content(), input.substring(tokenStart, index), true, currentBounds());
                if (!longComment.closed()) {
                    pendingError = errorToken(
                            ErrorMessages.UNFINISHED_LONG_COMMENT.formatted(longComment.firstLine(), "<eof>"));
                }
                return comment;
            }
        }

        int contentStart = index;
        while (index < length && !isLineTerminator(input.charAt(index))) {
            index++;
        }
        return new Comment(input.substring(contentStart, index), input.substring(tokenStart, index), false, currentBounds());
    }

    static boolean isWhiteSpace(char c) {
        return c == ' ' || c == '\t' || c == 0xB || c == 0xC;
    }

    static boolean isLineTerminator(char c) {
        return c == '\n' || c == '\r';
    }

    static boolean isDecDigit(char c) {
        return c >= '0' && c <= '9';
    }

    static boolean isHexDigit(char c) {
        return Character.digit(c, 16) >= 0 && c < 128;
    }

    static boolean isIdentifierStart(int cp) {
        return (cp >= 'a' && cp <= 'z') || (cp >= 'A' && cp <= 'Z') || cp == '_' || Glyphs.isGlyph(cp);
    }

    static boolean isIdentifierPart(int cp) {
        return isIdentifierStart(cp) || (cp >= '0' && cp <= '9');
    }
}
