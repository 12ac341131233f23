package ai.p8ls.analyzer.diagnostics;

/**
 * Message templates for diagnostics. The wording follows the reference Lua interpreter so messages look familiar.
 */
public final class ErrorMessages {
    public static final String UNEXPECTED = "unexpected %s '%s' near '%s'";
    public static final String UNEXPECTED_EOF = "unexpected symbol near '<eof>'";
    public static final String UNEXPECTED_CHARACTER = "unexpected character '%s'";
    public static final String EXPECTED = "'%s' expected near '%s'";
    public static final String EXPECTED_TOKEN = "%s expected near '%s'";
    public static final String UNFINISHED_STRING = "unfinished string near '%s'";
    public static final String MALFORMED_NUMBER = "malformed number near '%s'";
    public static final String INVALID_ESCAPE = "invalid escape sequence '%s'";
    public static final String HEXADECIMAL_DIGIT_EXPECTED = "hexadecimal digit expected near '%s'";
    public static final String UNFINISHED_LONG_STRING = "unfinished long string (starting at line %d) near '%s'";
    public static final String UNFINISHED_LONG_COMMENT = "unfinished long comment (starting at line %d) near '%s'";
    public static final String NO_LOOP_TO_BREAK = "no loop to break near '%s'";
    public static final String LABEL_ALREADY_DEFINED = "label '%s' already defined on line %d";
    public static final String LABEL_NOT_VISIBLE = "no visible label '%s' for <goto>";
    public static final String GOTO_JUMPS_INTO_LOCAL = "<goto %s> jumps into the scope of local '%s'";
    public static final String CANNOT_USE_VARARG = "cannot use '...' outside a vararg function near '%s'";
    public static final String TOO_MANY_SYNTAX_LEVELS = "chunk has too many syntax levels";
    public static final String UNDEFINED_GLOBAL = "undefined variable: %s";
    public static final String DEPRECATED_BUILTIN = "deprecated function: %s (%s)";
    public static final String INCLUDE_NOT_FOUND = "Can't #include %s: file does not exist";
    public static final String INCLUDE_UNREADABLE = "Can't #include %s: %s";
    public static final String CIRCULAR_INCLUDE = "Circular #include of %s";

    private ErrorMessages() {}
}
