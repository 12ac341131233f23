package ai.p8ls.analyzer.parser;

import ai.p8ls.analyzer.lexer.Token;
import ai.p8ls.analyzer.lexer.TokenType;
import java.util.Map;
import java.util.Set;

/**
 * Operator tables shared by the parser and the formatter.
 *
 * <p>Binary precedence, loosest to tightest: {@code or}, {@code and}, comparisons, {@code |}, {@code ^^},
 * {@code &}, shifts and rotates, {@code ..}, {@code + -}, {@code * / \ %}, unary operators, {@code ^}.
 */
public final class Operators {
    /** Binding power of unary operators; only {@code ^} binds tighter. */
    public static final int UNARY_PRECEDENCE = 10;

    /** Sentinel precedence for positions that require a primary expression, such as a call base. */
    public static final int MAX_PRECEDENCE = 99;

    private static final Map<String, Integer> BINARY_PRECEDENCE = Map.ofEntries(
            Map.entry("or", 1),
            Map.entry("and", 2),
            Map.entry("<", 3),
            Map.entry(">", 3),
            Map.entry("<=", 3),
            Map.entry(">=", 3),
            Map.entry("==", 3),
            Map.entry("~=", 3),
            Map.entry("!=", 3),
            Map.entry("|", 4),
            Map.entry("^^", 5),
            Map.entry("&", 6),
            Map.entry("<<", 7),
            Map.entry(">>", 7),
            Map.entry(">>>", 7),
            Map.entry("<<>", 7),
            Map.entry(">><", 7),
            Map.entry("..", 8),
            Map.entry("+", 9),
            Map.entry("-", 9),
            Map.entry("*", 10),
            Map.entry("/", 10),
            Map.entry("\\", 10),
            Map.entry("%", 10),
            Map.entry("^", 12));

    private static final Set<String> RIGHT_ASSOCIATIVE = Set.of("^", "..");

    // regrouping a chain of these does not change the result
    private static final Set<String> ASSOCIATIVE = Set.of("+", "*", "&", "|", "..", "and", "or");

    private static final Set<String> UNARY = Set.of("#", "-", "~", "@", "%", "$");

    private static final Set<String> ASSIGNMENT = Set.of(
            "=", "+=", "-=", "*=", "/=", "\\=", "%=", "^=", "..=", "|=", "&=", "^^=", "<<=", ">>=", ">>>=", "<<>=",
            ">><=");

    private Operators() {}

    /** Precedence of a binary operator, or 0 if the text is not one. */
    public static int binaryPrecedence(String operator) {
        return BINARY_PRECEDENCE.getOrDefault(operator, 0);
    }

    public static boolean isRightAssociative(String operator) {
        return RIGHT_ASSOCIATIVE.contains(operator);
    }

    public static boolean isAssociative(String operator) {
        return ASSOCIATIVE.contains(operator);
    }

    public static boolean isLogical(String operator) {
        return operator.equals("and") || operator.equals("or");
    }

    /** True for {@code # - ~ @ % $} and {@code not}; PICO-8 reads {@code @ % $} as peek operators. */
    public static boolean isUnary(Token token) {
        if (token.type() == TokenType.PUNCTUATOR) {
            return UNARY.contains(token.stringValue());
        }
        return token.type() == TokenType.KEYWORD && token.is("not");
    }

    /** {@code =} and the compound assignment operators. */
    public static boolean isAssignmentOperator(Token token) {
        return token.type() == TokenType.PUNCTUATOR && ASSIGNMENT.contains(token.stringValue());
    }

    /** Tokens that close a block: {@code else elseif end until} and end of input. */
    public static boolean isBlockFollow(Token token) {
        if (token.type() == TokenType.EOF) {
            return true;
        }
        return token.type() == TokenType.KEYWORD
                && (token.is("else") || token.is("elseif") || token.is("end") || token.is("until"));
    }
}
