package ai.p8ls.analyzer.format;

import static java.util.Objects.requireNonNull;

import ai.p8ls.analyzer.ast.AssignmentStatement;
import ai.p8ls.analyzer.ast.BinaryExpression;
import ai.p8ls.analyzer.ast.Block;
import ai.p8ls.analyzer.ast.BooleanLiteral;
import ai.p8ls.analyzer.ast.BreakStatement;
import ai.p8ls.analyzer.ast.CallExpression;
import ai.p8ls.analyzer.ast.CallStatement;
import ai.p8ls.analyzer.ast.Comment;
import ai.p8ls.analyzer.ast.DoStatement;
import ai.p8ls.analyzer.ast.Expression;
import ai.p8ls.analyzer.ast.ForGenericStatement;
import ai.p8ls.analyzer.ast.ForNumericStatement;
import ai.p8ls.analyzer.ast.FunctionDeclaration;
import ai.p8ls.analyzer.ast.GotoStatement;
import ai.p8ls.analyzer.ast.Identifier;
import ai.p8ls.analyzer.ast.IfClause;
import ai.p8ls.analyzer.ast.IfStatement;
import ai.p8ls.analyzer.ast.IncludeStatement;
import ai.p8ls.analyzer.ast.IndexExpression;
import ai.p8ls.analyzer.ast.LabelStatement;
import ai.p8ls.analyzer.ast.LocalStatement;
import ai.p8ls.analyzer.ast.LogicalExpression;
import ai.p8ls.analyzer.ast.MemberExpression;
import ai.p8ls.analyzer.ast.NilLiteral;
import ai.p8ls.analyzer.ast.Node;
import ai.p8ls.analyzer.ast.NumericLiteral;
import ai.p8ls.analyzer.ast.RepeatStatement;
import ai.p8ls.analyzer.ast.ReturnStatement;
import ai.p8ls.analyzer.ast.Statement;
import ai.p8ls.analyzer.ast.StringCallExpression;
import ai.p8ls.analyzer.ast.StringLiteral;
import ai.p8ls.analyzer.ast.TableCallExpression;
import ai.p8ls.analyzer.ast.TableConstructorExpression;
import ai.p8ls.analyzer.ast.TableKey;
import ai.p8ls.analyzer.ast.TableKeyString;
import ai.p8ls.analyzer.ast.TableValue;
import ai.p8ls.analyzer.ast.UnaryExpression;
import ai.p8ls.analyzer.ast.VarargLiteral;
import ai.p8ls.analyzer.ast.WhileStatement;
import ai.p8ls.analyzer.format.FormatLayout.BlankLine;
import ai.p8ls.analyzer.format.FormatLayout.CommentEntry;
import ai.p8ls.analyzer.format.FormatLayout.Entry;
import ai.p8ls.analyzer.format.FormatLayout.NodeEntry;
import ai.p8ls.analyzer.lexer.Lexer;
import ai.p8ls.analyzer.parser.Chunk;
import ai.p8ls.analyzer.parser.Operators;
import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Renders a parsed chunk as canonical source text, keeping its comments and collapsing runs of blank lines to one.
 *
 * <p>Parentheses are emitted where precedence and associativity require them. Source parentheses are kept only
 * around calls and {@code ...}, where they truncate a value list; everywhere else they are dropped or re-derived.
 * Statements the source put on one line stay on one line unless {@link FormatterOptions#forceOneStatementPerLine()}
 * is set.
 *
 * <p>A formatter never runs on a chunk with parse errors: {@link #format} returns empty and the caller must leave
 * the document untouched.
 */
public final class Formatter {
    private static final Logger logger = LogManager.getLogger(Formatter.class);

    private static final Splitter LINES = Splitter.on('\n');
    private static final CharMatcher WHITESPACE = CharMatcher.whitespace();
    private static final char VERBATIM_MARK = '\uFFFF';
    private static final Pattern VERBATIM = Pattern.compile(VERBATIM_MARK + "(\\d+)" + VERBATIM_MARK);

    private final FormatterOptions options;
    private final String indentUnit;

    public Formatter(FormatterOptions options) {
        this.options = requireNonNull(options, "options");
        this.indentUnit = options.indentUnit();
    }

    public Formatter() {
        this(FormatterOptions.DEFAULT);
    }

    /**
     * Formats the code of {@code chunk}.
     *
     * @param originalText the text the chunk was parsed from, used to locate the code section of a cartridge
     * @param plainSourceFile true for a {@code .lua} file, false for a {@code .p8} cartridge
     * @return the replacement text and the range it replaces, or empty when the chunk has parse errors or a
     *     cartridge has no code section
     */
    public Optional<FormatResult> format(Chunk chunk, String originalText, boolean plainSourceFile) {
        requireNonNull(chunk, "chunk");
        requireNonNull(originalText, "originalText");

        if (chunk.hasErrors()) {
            logger.debug("Not formatting {}: {} parse error(s)", fileName(chunk), chunk.errors().size());
            return Optional.empty();
        }

        FormatRange range;
        if (plainSourceFile) {
            range = FormatRange.wholeDocument();
        } else {
            range = codeSectionRange(originalText);
            if (range == null) {
                logger.debug("Not formatting {}: no __lua__ section", fileName(chunk));
                return Optional.empty();
            }
        }

        var renderer = new Renderer(CommentWeaver.weave(chunk));
        var rendered = renderer.block(chunk.block(), "", true, true, 0);
        var formatted = renderer.restoreVerbatim(LINES.splitToStream(rendered)
                .map(WHITESPACE::trimTrailingFrom)
                .collect(Collectors.joining("\n")));

        if (!plainSourceFile) {
            formatted += "\n";
            if (!range.extendsToEnd()) {
                // keep a blank line before the next section marker
                formatted += "\n";
            }
        }
        logger.debug("Formatted {} into {} characters", fileName(chunk), formatted.length());
        return Optional.of(new FormatResult(formatted, range));
    }

    /** Lines after {@code __lua__} up to the next section marker, or null when the cartridge has no code. */
    static @Nullable FormatRange codeSectionRange(String originalText) {
        var lines = LINES.splitToList(originalText);
        int start = -1;
        for (int i = 0; i < lines.size(); i++) {
            var line = lines.get(i).trim();
            if (start < 0) {
                if (Lexer.isBeginningOfCodeSection(line)) {
                    start = i + 1;
                }
            } else if (Lexer.isEndOfCodeSection(line)) {
                return new FormatRange(start, 0, i, 0);
            }
        }
        return start < 0 ? null : new FormatRange(start, 0, FormatRange.END_OF_DOCUMENT, 0);
    }

    private static String fileName(Chunk chunk) {
        var file = chunk.file();
        return file == null ? "<text>" : file.path();
    }

    private static boolean isInline(Comment comment) {
        return comment.isLong() && comment.raw().indexOf('\n') < 0;
    }

    private static boolean isPrintShorthand(CallExpression call) {
        return call.base() instanceof Identifier id && id.name().equals("?");
    }

    /** Expressions that may be called or indexed without parentheses. */
    private static boolean isPrefixExpression(Expression expression) {
        return expression instanceof Identifier
                || expression instanceof MemberExpression
                || expression instanceof IndexExpression
                || expression instanceof CallExpression
                || expression instanceof TableCallExpression
                || expression instanceof StringCallExpression;
    }

    /** Parentheses that change meaning: they cut a call or {@code ...} down to its first value. */
    private static boolean keepsOwnParentheses(Expression expression) {
        return expression.parenthesized()
                && (expression instanceof CallExpression
                        || expression instanceof TableCallExpression
                        || expression instanceof StringCallExpression
                        || expression instanceof VarargLiteral);
    }

    private static @Nullable String operatorOf(Expression expression) {
        if (expression instanceof BinaryExpression binary) {
            return binary.operator();
        }
        if (expression instanceof LogicalExpression logical) {
            return logical.operator();
        }
        return null;
    }

    /**
     * Whether {@code child}, an operand of {@code parentOperator}, must be wrapped to parse back the same way.
     * Equal precedence needs parentheses on the side the operator does not associate towards, unless both are the
     * same associative operator, where regrouping is harmless.
     */
    static boolean needsParentheses(Expression child, String parentOperator, boolean rightSide) {
        if (keepsOwnParentheses(child)) {
            return false;
        }
        if (child instanceof UnaryExpression) {
            // -a ^ b reads as -(a ^ b)
            return !rightSide && Operators.binaryPrecedence(parentOperator) > Operators.UNARY_PRECEDENCE;
        }
        var childOperator = operatorOf(child);
        if (childOperator == null) {
            return false;
        }
        int childPrecedence = Operators.binaryPrecedence(childOperator);
        int parentPrecedence = Operators.binaryPrecedence(parentOperator);
        if (childPrecedence != parentPrecedence) {
            return childPrecedence < parentPrecedence;
        }
        if (childOperator.equals(parentOperator) && Operators.isAssociative(parentOperator)) {
            return false;
        }
        return Operators.isRightAssociative(parentOperator) != rightSide;
    }

    /** Rendering state for one call of {@link #format}. Indentation depth is passed explicitly. */
    private final class Renderer {
        private final FormatLayout layout;
        private final List<String> verbatim = new ArrayList<>();

        Renderer(FormatLayout layout) {
            this.layout = layout;
        }

        /**
         * Source text that must come out byte for byte, such as a long string or long comment spanning lines.
         * Everything from the first line break on is parked behind a marker so trailing whitespace trimming of the
         * rendered lines cannot reach it; {@link #restoreVerbatim} puts it back.
         */
        private String verbatim(String raw) {
            int lineBreak = raw.indexOf('\n');
            if (lineBreak < 0) {
                return raw;
            }
            verbatim.add(raw.substring(lineBreak));
            return raw.substring(0, lineBreak) + VERBATIM_MARK + (verbatim.size() - 1) + VERBATIM_MARK;
        }

        String restoreVerbatim(String text) {
            if (verbatim.isEmpty()) {
                return text;
            }
            return VERBATIM.matcher(text)
                    .replaceAll(m -> Matcher.quoteReplacement(verbatim.get(Integer.parseInt(m.group(1)))));
        }

        private String newline(int depth) {
            return "\n" + indentUnit.repeat(depth);
        }

        String block(Block block, String begin, boolean skipEnd, boolean topLevel, int depth) {
            var sb = new StringBuilder(begin);
            appendStatements(sb, layout.entries(block), topLevel, topLevel ? depth : depth + 1);
            if (!skipEnd) {
                sb.append(newline(depth)).append("end");
            }
            return sb.toString();
        }

        private void appendStatements(StringBuilder sb, List<Entry> entries, boolean topLevel, int depth) {
            Entry previous = null;
            for (var entry : FormatLayout.withBlankLines(entries)) {
                if (previous != null || !topLevel) {
                    boolean sameLine = previous != null
                            && !options.forceOneStatementPerLine()
                            && previous.endLine() == entry.startLine();
                    sb.append(sameLine ? " " : newline(depth));
                }
                sb.append(statementEntry(entry, depth).stripTrailing());
                previous = entry;
            }
        }

        private String statementEntry(Entry entry, int depth) {
            if (entry instanceof NodeEntry node) {
                return statement((Statement) node.node(), depth);
            }
            if (entry instanceof CommentEntry comment) {
                return verbatim(comment.comment().raw());
            }
            // BlankLine: the separator before the next entry supplies the line break
            return "";
        }

        private String statementComments(Node node, int depth) {
            var sb = new StringBuilder();
            for (var comment : layout.leadingComments(node)) {
                sb.append(verbatim(comment.raw()));
                sb.append(isInline(comment) ? " " : newline(depth));
            }
            return sb.toString();
        }

        private String statement(Statement statement, int depth) {
            return statementComments(statement, depth) + statementText(statement, depth);
        }

        private String statementText(Statement statement, int depth) {
            if (statement instanceof AssignmentStatement assignment) {
                return list(assignment.targets(), depth) + " " + assignment.operator() + " "
                        + list(assignment.values(), depth);
            }
            if (statement instanceof LocalStatement local) {
                var text = "local " + list(local.variables(), depth);
                if (local.values().isEmpty()) {
                    return text;
                }
                var operator = local.operator() == null ? "=" : local.operator();
                return text + " " + operator + " " + list(local.values(), depth);
            }
            if (statement instanceof CallStatement call) {
                return expression(call.expression(), depth);
            }
            if (statement instanceof FunctionDeclaration function) {
                return function(function, depth);
            }
            if (statement instanceof IfStatement ifStatement) {
                return ifStatement(ifStatement, depth);
            }
            if (statement instanceof ReturnStatement returnStatement) {
                return returnStatement.arguments().isEmpty()
                        ? "return"
                        : "return " + list(returnStatement.arguments(), depth);
            }
            if (statement instanceof DoStatement doStatement) {
                return block(doStatement.body(), "do", false, false, depth);
            }
            if (statement instanceof WhileStatement loop) {
                return "while " + expression(loop.condition(), depth) + " " + block(loop.body(), "do", false, false, depth);
            }
            if (statement instanceof RepeatStatement loop) {
                return block(loop.body(), "repeat", true, false, depth)
                        + newline(depth)
                        + "until "
                        + expression(loop.condition(), depth);
            }
            if (statement instanceof ForNumericStatement loop) {
                var sb = new StringBuilder("for ")
                        .append(loop.variable().name())
                        .append(" = ")
                        .append(expression(loop.start(), depth))
                        .append(", ")
                        .append(expression(loop.end(), depth));
                if (loop.step() != null) {
                    sb.append(", ").append(expression(loop.step(), depth));
                }
                return sb.append(' ').append(block(loop.body(), "do", false, false, depth)).toString();
            }
            if (statement instanceof ForGenericStatement loop) {
                return "for " + list(loop.variables(), depth) + " in " + list(loop.iterators(), depth) + " "
                        + block(loop.body(), "do", false, false, depth);
            }
            if (statement instanceof GotoStatement jump) {
                return "goto " + jump.label().name();
            }
            if (statement instanceof LabelStatement label) {
                return "::" + label.label().name() + "::";
            }
            if (statement instanceof BreakStatement) {
                return "break";
            }
            if (statement instanceof IncludeStatement include) {
                return "#include " + include.filename();
            }
            throw new IllegalStateException("Unexpected statement " + statement.getClass().getSimpleName());
        }

        private String list(List<? extends Expression> expressions, int depth) {
            return expressions.stream().map(e -> expression(e, depth)).collect(Collectors.joining(", "));
        }

        // ---------------------------------------------------------------- if

        private String ifStatement(IfStatement node, int depth) {
            var clauses = node.clauses();
            if (node.oneLine()) {
                var first = clauses.get(0);
                var sb = new StringBuilder("if (")
                        .append(expression(requireNonNull(first.condition()), depth))
                        .append(") ")
                        .append(inlineBody(first.body(), depth));
                if (clauses.size() > 1) {
                    sb.append(" else ").append(inlineBody(clauses.get(1).body(), depth));
                }
                return sb.toString();
            }

            if (isSingleLine(node)) {
                var sb = new StringBuilder();
                for (var clause : clauses) {
                    if (clause.kind() == IfClause.Kind.IF) {
                        sb.append("if ").append(expression(requireNonNull(clause.condition()), depth)).append(" then ");
                    } else {
                        sb.append(" else ");
                    }
                    sb.append(inlineBody(clause.body(), depth));
                }
                return sb.append(" end").toString();
            }

            var sb = new StringBuilder();
            for (var clause : clauses) {
                sb.append(statementComments(clause, depth));
                var begin = clause.kind() == IfClause.Kind.ELSE
                        ? "else"
                        : clause.kind().keyword() + " " + expression(requireNonNull(clause.condition()), depth)
                                + " then";
                sb.append(block(clause.body(), begin, true, false, depth)).append(newline(depth));
            }
            return sb.append("end").toString();
        }

        private String inlineBody(Block body, int depth) {
            return layout.entries(body).stream()
                    .map(entry -> statementEntry(entry, depth))
                    .collect(Collectors.joining(" "));
        }

        /** {@code if a then b() end} or {@code if a then b() else c() end}, all on the line of the {@code if}. */
        private boolean isSingleLine(IfStatement node) {
            var clauses = node.clauses();
            boolean shape = clauses.size() == 1 || (clauses.size() == 2 && clauses.get(1).kind() == IfClause.Kind.ELSE);
            if (!shape) {
                return false;
            }
            int line = node.bounds().start().line();
            for (var clause : clauses) {
                if (!clause.bounds().isSingleLine()
                        || clause.bounds().start().line() != line
                        || !layout.leadingComments(clause).isEmpty()) {
                    return false;
                }
                var entries = layout.entries(clause.body());
                if (entries.size() != 1 || !(entries.get(0) instanceof NodeEntry entry)) {
                    return false;
                }
                var statement = (Statement) entry.node();
                if (!statement.bounds().isSingleLine()
                        || statement.bounds().start().line() != line
                        || !layout.leadingComments(statement).isEmpty()
                        || !staysOnOneLine(statement)) {
                    return false;
                }
            }
            return true;
        }

        private boolean staysOnOneLine(Statement statement) {
            if (statement instanceof IfStatement nested) {
                return nested.oneLine() || isSingleLine(nested);
            }
            return !(statement instanceof DoStatement
                    || statement instanceof WhileStatement
                    || statement instanceof RepeatStatement
                    || statement instanceof ForNumericStatement
                    || statement instanceof ForGenericStatement);
        }

        // ---------------------------------------------------------------- functions

        private String function(FunctionDeclaration node, int depth) {
            boolean multiline = options.forceOneStatementPerLine() || !node.bounds().isSingleLine();

            var sb = new StringBuilder();
            if (node.isLocal()) {
                sb.append("local ");
            }
            sb.append("function");
            if (node.identifier() != null) {
                sb.append(' ').append(expression(node.identifier(), depth));
            }
            sb.append('(').append(list(node.parameters(), depth)).append(')');

            var entries = layout.entries(node.body());
            if (multiline) {
                appendStatements(sb, entries, false, depth + 1);
                sb.append(newline(depth)).append("end");
            } else {
                for (var entry : entries) {
                    sb.append(' ').append(statementEntry(entry, depth + 1));
                }
                sb.append(" end");
            }
            return sb.toString();
        }

        // ---------------------------------------------------------------- expressions

        private String expression(Expression expression, int depth) {
            var comments = layout.leadingComments(expression);
            if (comments.isEmpty()) {
                return expressionText(expression, depth);
            }
            var sb = new StringBuilder();
            for (var comment : comments) {
                if (isInline(comment)) {
                    sb.append(comment.raw()).append(' ');
                } else {
                    sb.append(newline(depth + 1)).append(verbatim(comment.raw())).append(newline(depth + 1));
                }
            }
            return sb.append(expressionText(expression, depth)).toString();
        }

        private String expressionText(Expression expression, int depth) {
            if (expression instanceof Identifier id) {
                return id.name();
            }
            if (expression instanceof StringLiteral string) {
                return verbatim(string.raw());
            }
            if (expression instanceof NumericLiteral number) {
                return number.raw();
            }
            if (expression instanceof BooleanLiteral bool) {
                return bool.value() ? "true" : "false";
            }
            if (expression instanceof NilLiteral) {
                return "nil";
            }
            if (expression instanceof VarargLiteral vararg) {
                return truncated(vararg, "...");
            }
            if (expression instanceof FunctionDeclaration function) {
                return function(function, depth);
            }
            if (expression instanceof TableConstructorExpression table) {
                return table(table, depth);
            }
            if (expression instanceof BinaryExpression binary) {
                return binary(binary.operator(), binary.left(), binary.right(), depth);
            }
            if (expression instanceof LogicalExpression logical) {
                return binary(logical.operator(), logical.left(), logical.right(), depth);
            }
            if (expression instanceof UnaryExpression unary) {
                return unary(unary, depth);
            }
            if (expression instanceof MemberExpression member) {
                return base(member.base(), depth) + member.indexer() + member.identifier().name();
            }
            if (expression instanceof IndexExpression index) {
                return base(index.base(), depth) + bracketed(expression(index.index(), depth));
            }
            if (expression instanceof CallExpression call) {
                return truncated(call, call(call, depth));
            }
            if (expression instanceof StringCallExpression call) {
                return truncated(call, base(call.base(), depth) + " " + verbatim(call.argument().raw()));
            }
            if (expression instanceof TableCallExpression call) {
                return truncated(call, base(call.base(), depth) + " " + table(call.argument(), depth));
            }
            throw new IllegalStateException("Unexpected expression " + expression.getClass().getSimpleName());
        }

        /** {@code [key]}, spaced out when the key itself starts with a bracket: "[[" would open a long string. */
        private String bracketed(String keyText) {
            return keyText.startsWith("[") ? "[ " + keyText + " ]" : "[" + keyText + "]";
        }

        private String truncated(Expression expression, String text) {
            return expression.parenthesized() ? "(" + text + ")" : text;
        }

        /** Callee or indexed value; anything but a name, field or call needs parentheses there. */
        private String base(Expression base, int depth) {
            var text = expression(base, depth);
            if (isPrefixExpression(base) || keepsOwnParentheses(base)) {
                return text;
            }
            return "(" + text + ")";
        }

        private String binary(String operator, Expression left, Expression right, int depth) {
            var sb = new StringBuilder(operand(left, operator, false, depth)).append(' ').append(operator);
            var rightText = operand(right, operator, true, depth);
            if (rightText.startsWith("\n")) {
                // a comment before the operand already broke the line
                return sb.append(rightText).toString();
            }
            if (left.bounds().end().line() != right.bounds().start().line()) {
                sb.append(newline(depth + 2));
            } else {
                sb.append(' ');
            }
            return sb.append(rightText).toString();
        }

        private String operand(Expression operand, String parentOperator, boolean rightSide, int depth) {
            if (needsParentheses(operand, parentOperator, rightSide)) {
                return "(" + expression(operand, depth + 1) + ")";
            }
            return expression(operand, depth);
        }

        private String unary(UnaryExpression node, int depth) {
            var argument = node.argument();
            var text = expression(argument, depth);
            if (operatorOf(argument) != null && !keepsOwnParentheses(argument)
                    && Operators.binaryPrecedence(requireNonNull(operatorOf(argument))) <= Operators.UNARY_PRECEDENCE) {
                text = "(" + text + ")";
            }
            var operator = node.operator();
            if (operator.equals("not")) {
                return "not " + text;
            }
            if (operator.equals("-") && text.startsWith("-")) {
                // "--" would start a comment
                return "- " + text;
            }
            return operator + text;
        }

        // ---------------------------------------------------------------- lists

        private String call(CallExpression call, int depth) {
            if (isPrintShorthand(call)) {
                // newline-terminated statement: always one line, no parentheses
                return "?" + list(call.arguments(), depth);
            }
            var entries = layout.entries(call);
            int baseLine = call.base().bounds().start().line();
            boolean multiline = hasComment(entries)
                    || (call.arguments().size() > 1
                            && call.arguments().stream().anyMatch(a -> a.bounds().end().line() != baseLine));
            return base(call.base(), depth) + delimited(entries, multiline, false, "(", ")", depth);
        }

        private String table(TableConstructorExpression table, int depth) {
            var entries = layout.entries(table);
            if (entries.isEmpty()) {
                return "{}";
            }
            int line = table.bounds().start().line();
            boolean multiline = hasComment(entries)
                    || table.fields().stream().anyMatch(f -> f.bounds().end().line() != line);
            return delimited(entries, multiline, true, "{", "}", depth);
        }

        private boolean hasComment(List<Entry> entries) {
            return entries.stream().anyMatch(e -> e instanceof CommentEntry);
        }

        /**
         * Comma separated call arguments or table fields, possibly interleaved with comments. A multi-line list keeps
         * entries that shared a line together and keeps at most one blank line between entries.
         */
        private String delimited(
                List<Entry> entries, boolean multiline, boolean padded, String open, String close, int depth) {
            var sb = new StringBuilder(open);
            int inner = multiline ? depth + 1 : depth;
            if (!multiline && padded) {
                sb.append(' ');
            }

            int lastNode = -1;
            for (int i = 0; i < entries.size(); i++) {
                if (entries.get(i) instanceof NodeEntry) {
                    lastNode = i;
                }
            }

            Entry previous = null;
            for (int i = 0; i < entries.size(); i++) {
                var entry = entries.get(i);
                if (multiline) {
                    if (previous == null || entry.startLine() == previous.endLine() + 1) {
                        sb.append(newline(inner));
                    } else if (entry.startLine() > previous.endLine() + 1) {
                        sb.append(newline(inner)).append(newline(inner));
                    } else {
                        sb.append(' ');
                    }
                }
                previous = entry;

                if (entry instanceof CommentEntry comment) {
                    sb.append(verbatim(comment.comment().raw()));
                } else if (entry instanceof NodeEntry node) {
                    sb.append(listItem(node.node(), inner));
                    if (i < lastNode) {
                        sb.append(multiline ? "," : ", ");
                    }
                } else if (entry instanceof BlankLine) {
                    throw new IllegalStateException("blank lines are only tracked in statement lists");
                }
            }

            if (multiline) {
                sb.append(newline(depth));
            } else if (padded) {
                sb.append(' ');
            }
            return sb.append(close).toString();
        }

        private String listItem(Node node, int depth) {
            if (node instanceof TableKey key) {
                return bracketed(expression(key.key(), depth)) + " = " + expression(key.value(), depth);
            }
            if (node instanceof TableKeyString key) {
                return key.key().name() + " = " + expression(key.value(), depth);
            }
            if (node instanceof TableValue value) {
                return expression(value.value(), depth);
            }
            return expression((Expression) node, depth);
        }
    }
}
