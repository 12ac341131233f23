package ai.p8ls.analyzer.parser;

import static java.util.Objects.requireNonNull;

import ai.p8ls.analyzer.Bounds;
import ai.p8ls.analyzer.FileResolver;
import ai.p8ls.analyzer.ResolvedFile;
import ai.p8ls.analyzer.SourcePosition;
import ai.p8ls.analyzer.ast.AssignmentStatement;
import ai.p8ls.analyzer.ast.BinaryExpression;
import ai.p8ls.analyzer.ast.Block;
import ai.p8ls.analyzer.ast.BooleanLiteral;
import ai.p8ls.analyzer.ast.BreakStatement;
import ai.p8ls.analyzer.ast.CallExpression;
import ai.p8ls.analyzer.ast.CallStatement;
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
import ai.p8ls.analyzer.ast.NumericLiteral;
import ai.p8ls.analyzer.ast.RepeatStatement;
import ai.p8ls.analyzer.ast.ReturnStatement;
import ai.p8ls.analyzer.ast.Statement;
import ai.p8ls.analyzer.ast.StringCallExpression;
import ai.p8ls.analyzer.ast.StringLiteral;
import ai.p8ls.analyzer.ast.TableCallExpression;
import ai.p8ls.analyzer.ast.TableConstructorExpression;
import ai.p8ls.analyzer.ast.TableField;
import ai.p8ls.analyzer.ast.TableKey;
import ai.p8ls.analyzer.ast.TableKeyString;
import ai.p8ls.analyzer.ast.TableValue;
import ai.p8ls.analyzer.ast.UnaryExpression;
import ai.p8ls.analyzer.ast.VarargLiteral;
import ai.p8ls.analyzer.ast.WhileStatement;
import ai.p8ls.analyzer.diagnostics.ErrorMessages;
import ai.p8ls.analyzer.diagnostics.ParseError;
import ai.p8ls.analyzer.diagnostics.Warning;
import ai.p8ls.analyzer.lexer.Lexer;
import ai.p8ls.analyzer.lexer.Token;
import ai.p8ls.analyzer.lexer.TokenType;
import ai.p8ls.analyzer.symbols.SymbolFinder;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Predicate;
import java.util.function.Supplier;
import java.util.regex.Pattern;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Error-tolerant recursive-descent parser for PICO-8 Lua.
 *
 * <p>Parsing never throws for malformed input. A statement that cannot be parsed is recorded as a
 * {@link ParseError}; the parser then skips to the end of the line (or the end of the enclosing block) and carries
 * on, so the returned tree holds everything that could be understood.
 *
 * <p>{@code #include} directives are recorded with their resolved target but the included text is not parsed
 * here; combining files is the job of the project layer.
 */
public final class Parser {
    private static final Logger logger = LogManager.getLogger(Parser.class);

    private static final Pattern INCLUDE = Pattern.compile("^#include\\s+(.*)$");
    private static final int MAX_DEPTH = 200;

    private final Lexer lexer;
    private final @Nullable ResolvedFile file;
    private final @Nullable FileResolver fileResolver;
    private final Set<ParseError> errors = new LinkedHashSet<>();
    private final List<Warning> warnings = new ArrayList<>();
    private final List<Include> includes = new ArrayList<>();
    private int depth;

    private Parser(String text, @Nullable ResolvedFile file, @Nullable FileResolver fileResolver) {
        this.lexer = new Lexer(text, file);
        this.file = file;
        this.fileResolver = fileResolver;
    }

    public static Chunk parse(String text) {
        return parse(text, null, null, false);
    }

    public static Chunk parse(String text, @Nullable ResolvedFile file) {
        return parse(text, file, null, false);
    }

    /**
     * Parses {@code text}.
     *
     * @param file origin of the text; include directives are resolved relative to it
     * @param fileResolver used to check that include targets exist; when null no include warnings are produced
     * @param suppressBuiltinGlobals carried on the chunk for scope resolution, which then does not predefine the
     *     PICO-8 API
     */
    public static Chunk parse(
            String text,
            @Nullable ResolvedFile file,
            @Nullable FileResolver fileResolver,
            boolean suppressBuiltinGlobals) {
        requireNonNull(text, "text");
        var parser = new Parser(text, file, fileResolver);
        var block = parser.parseChunk();
        var symbols = SymbolFinder.findSymbols(block);
        logger.debug(
                "Parsed {}: {} statements, {} errors",
                file == null ? "<anonymous>" : file.path(),
                block.statements().size(),
                parser.errors.size());
        return new Chunk(
                block,
                new ArrayList<>(parser.errors),
                parser.warnings,
                parser.lexer.comments(),
                parser.includes,
                symbols,
                file,
                parser.lexer.isCartridge(),
                suppressBuiltinGlobals);
    }

    // -- token helpers

    private Token token() {
        return lexer.token();
    }

    private void next() {
        lexer.next();
    }

    private boolean consume(String value) {
        if (token().is(value)) {
            next();
            return true;
        }
        return false;
    }

    private void expect(String value) {
        if (!consume(value)) {
            throw failureAt(token(), ErrorMessages.EXPECTED.formatted(value, token().displayText()));
        }
    }

    private SourcePosition start() {
        return token().bounds().start();
    }

    private Bounds finish(SourcePosition start) {
        var last = requireNonNull(lexer.previousToken(), "previousToken");
        return new Bounds(start, last.bounds().end());
    }

    /** Failure for {@code found}; an error token reports its own lexer message instead. */
    private ParseFailure failureAt(Token found, String message) {
        if (found.type() == TokenType.ERROR) {
            return new ParseFailure(found.stringValue(), found.bounds());
        }
        return new ParseFailure(message, found.bounds());
    }

    private ParseFailure unexpected(Token found) {
        var near = lexer.lookahead().displayText();
        return switch (found.type()) {
            case EOF -> failureAt(found, ErrorMessages.UNEXPECTED_EOF);
            case NIL_LITERAL -> failureAt(found, ErrorMessages.UNEXPECTED.formatted("symbol", "nil", near));
            default -> failureAt(
                    found, ErrorMessages.UNEXPECTED.formatted(found.type().description(), found.displayText(), near));
        };
    }

    private ParseFailure expected(String what) {
        return failureAt(token(), ErrorMessages.EXPECTED_TOKEN.formatted(what, token().displayText()));
    }

    private void enterLevel() {
        if (++depth > MAX_DEPTH) {
            depth--;
            throw new ParseFailure(ErrorMessages.TOO_MANY_SYNTAX_LEVELS, token().bounds());
        }
    }

    /** Advances until {@code stop} matches or input ends. Error tokens passed over are recorded. */
    private void skipUntil(Predicate<Token> stop) {
        while (!stop.test(token()) && !token().isEof()) {
            if (token().type() == TokenType.ERROR) {
                errors.add(new ParseError(token().stringValue(), token().bounds()));
            }
            next();
        }
    }

    /**
     * Runs {@code body} with line breaks reported as tokens, for the PICO-8 forms that end at the end of the line.
     * On success the terminating line break is consumed unless an enclosing form is also line-terminated.
     */
    private <T> T withSignificantNewline(Supplier<T> body) {
        boolean outer = lexer.isNewlineSignificant();
        lexer.setNewlineSignificant(true);
        T result;
        try {
            result = body.get();
        } finally {
            lexer.setNewlineSignificant(outer);
        }
        if (!outer && token().type() == TokenType.NEWLINE) {
            next();
        }
        return result;
    }

    // -- blocks and statements

    private Block parseChunk() {
        next();
        var flow = new FlowContext(errors::add);
        flow.setAllowVararg(true);
        flow.pushScope(false);
        var block = parseBlock(flow, true);
        flow.popScope();
        return block;
    }

    private Block parseBlock(FlowContext flow, boolean topLevel) {
        enterLevel();
        try {
            Predicate<Token> ending = topLevel ? Token::isEof : Operators::isBlockFollow;
            var statements = new ArrayList<Statement>();
            while (!ending.test(token())) {
                int flowDepth = flow.depth();
                try {
                    var statement = parseStatement(flow);
                    consume(";");
                    if (statement != null) {
                        statements.add(statement);
                    }
                } catch (ParseFailure e) {
                    errors.add(e.error());
                    flow.unwindTo(flowDepth);
                    if (!synchronize(ending)) {
                        break;
                    }
                }
            }
            return new Block(statements);
        } finally {
            depth--;
        }
    }

    /**
     * Skips to the next line break or the end of the block. Returns true if parsing can continue on the next line.
     */
    private boolean synchronize(Predicate<Token> ending) {
        boolean outer = lexer.isNewlineSignificant();
        lexer.setNewlineSignificant(true);
        try {
            skipUntil(t -> t.type() == TokenType.NEWLINE || ending.test(t));
        } finally {
            lexer.setNewlineSignificant(outer);
        }
        if (token().type() == TokenType.NEWLINE) {
            next();
            return true;
        }
        return false;
    }

    private @Nullable Statement parseStatement(FlowContext flow) {
        var start = start();

        if (consume("::")) {
            return parseLabelStatement(flow, start);
        }
        if (consume(";")) {
            return null;
        }

        flow.raiseDeferredErrors();

        var current = token();
        if (current.type() == TokenType.KEYWORD) {
            switch (current.stringValue()) {
                case "local":
                    next();
                    return parseLocalStatement(flow, start);
                case "if":
                    next();
                    return parseIfStatement(flow, start);
                case "return":
                    next();
                    return parseReturnStatement(flow, start);
                case "function":
                    next();
                    var name = parseFunctionName();
                    return parseFunctionDeclaration(name, false, start);
                case "while":
                    next();
                    return parseWhileStatement(flow, start);
                case "for":
                    next();
                    return parseForStatement(flow, start);
                case "repeat":
                    next();
                    return parseRepeatStatement(flow, start);
                case "break":
                    next();
                    if (!flow.isInLoop()) {
                        flow.report(current, ErrorMessages.NO_LOOP_TO_BREAK.formatted(token().displayText()));
                    }
                    return new BreakStatement(finish(start));
                case "do":
                    next();
                    return parseDoStatement(flow, start);
                case "goto":
                    next();
                    return parseGotoStatement(flow, current, start);
                default:
                    break;
            }
        }

        if (current.type() == TokenType.PUNCTUATOR) {
            if (current.is("?")) {
                next();
                return parseSpecialPrint(flow, current, start);
            }
            if (current.is("#")) {
                lexer.consumeRestOfLine();
                return parseIncludeStatement(start);
            }
        }

        return parseAssignmentOrCallStatement(flow);
    }

    private LabelStatement parseLabelStatement(FlowContext flow, SourcePosition start) {
        var nameToken = token();
        var label = parseIdentifier();
        expect("::");
        flow.addLabel(label.name(), nameToken);
        return new LabelStatement(label, finish(start));
    }

    private GotoStatement parseGotoStatement(FlowContext flow, Token gotoToken, SourcePosition start) {
        var label = parseIdentifier();
        flow.addGoto(label.name(), gotoToken);
        return new GotoStatement(label, finish(start));
    }

    private DoStatement parseDoStatement(FlowContext flow, SourcePosition start) {
        flow.pushScope(false);
        var body = parseBlock(flow, false);
        flow.popScope();
        expect("end");
        return new DoStatement(body, finish(start));
    }

    private WhileStatement parseWhileStatement(FlowContext flow, SourcePosition start) {
        var condition = parseExpectedExpression(flow);
        expect("do");
        flow.pushScope(true);
        var body = parseBlock(flow, false);
        flow.popScope();
        expect("end");
        return new WhileStatement(condition, body, finish(start));
    }

    private RepeatStatement parseRepeatStatement(FlowContext flow, SourcePosition start) {
        flow.pushScope(true);
        var body = parseBlock(flow, false);
        expect("until");
        flow.raiseDeferredErrors();
        var condition = parseExpectedExpression(flow);
        flow.popScope();
        return new RepeatStatement(body, condition, finish(start));
    }

    private ReturnStatement parseReturnStatement(FlowContext flow, SourcePosition start) {
        var expressions = new ArrayList<Expression>();
        if (!token().is("end")) {
            var expression = parseExpression(flow);
            if (expression != null) {
                expressions.add(expression);
                while (consume(",")) {
                    expressions.add(parseExpectedExpression(flow));
                }
            }
            consume(";");
        }
        return new ReturnStatement(expressions, finish(start));
    }

    private IfStatement parseIfStatement(FlowContext flow, SourcePosition start) {
        var clauses = new ArrayList<IfClause>();
        boolean canBeOneLiner = token().is("(");

        var condition = parseExpectedExpression(flow);
        if (!consume("then")) {
            if (!canBeOneLiner) {
                throw failureAt(token(), ErrorMessages.EXPECTED.formatted("then", token().displayText()));
            }
            return parseOneLineIf(flow, start, condition);
        }

        flow.pushScope(false);
        var body = parseBlock(flow, false);
        flow.popScope();
        clauses.add(new IfClause(IfClause.Kind.IF, condition, body, finish(start)));

        while (token().is("elseif")) {
            var clauseStart = start();
            next();
            var elseifCondition = parseExpectedExpression(flow);
            expect("then");
            flow.pushScope(false);
            var elseifBody = parseBlock(flow, false);
            flow.popScope();
            clauses.add(new IfClause(IfClause.Kind.ELSEIF, elseifCondition, elseifBody, finish(clauseStart)));
        }

        if (token().is("else")) {
            var clauseStart = start();
            next();
            flow.pushScope(false);
            var elseBody = parseBlock(flow, false);
            flow.popScope();
            clauses.add(new IfClause(IfClause.Kind.ELSE, null, elseBody, finish(clauseStart)));
        }

        expect("end");
        return new IfStatement(clauses, false, finish(start));
    }

    /** {@code if (cond) statement [else statement]}, terminated by the end of the line. */
    private IfStatement parseOneLineIf(FlowContext flow, SourcePosition start, Expression condition) {
        return withSignificantNewline(() -> {
            var clauses = new ArrayList<IfClause>();
            var body = parseSingleStatementBlock(flow);
            clauses.add(new IfClause(IfClause.Kind.IF, condition, body, finish(start)));
            if (token().is("else")) {
                var elseStart = start();
                next();
                var elseBody = parseSingleStatementBlock(flow);
                clauses.add(new IfClause(IfClause.Kind.ELSE, null, elseBody, finish(elseStart)));
            }
            return new IfStatement(clauses, true, finish(start));
        });
    }

    private Block parseSingleStatementBlock(FlowContext flow) {
        flow.pushScope(false);
        var statement = parseStatement(flow);
        if (statement == null) {
            throw expected("statement");
        }
        flow.popScope();
        return new Block(List.of(statement));
    }

    private Statement parseForStatement(FlowContext flow, SourcePosition start) {
        var variable = parseIdentifier();

        if (consume("=")) {
            var from = parseExpectedExpression(flow);
            expect(",");
            var to = parseExpectedExpression(flow);
            var step = consume(",") ? parseExpectedExpression(flow) : null;
            expect("do");
            flow.pushScope(true);
            var body = parseBlock(flow, false);
            flow.popScope();
            expect("end");
            return new ForNumericStatement(variable, from, to, step, body, finish(start));
        }

        var variables = new ArrayList<Identifier>();
        variables.add(variable);
        while (consume(",")) {
            variables.add(parseIdentifier());
        }
        expect("in");
        var iterators = new ArrayList<Expression>();
        do {
            iterators.add(parseExpectedExpression(flow));
        } while (consume(","));
        expect("do");
        flow.pushScope(true);
        var body = parseBlock(flow, false);
        flow.popScope();
        expect("end");
        return new ForGenericStatement(variables, iterators, body, finish(start));
    }

    private Statement parseLocalStatement(FlowContext flow, SourcePosition start) {
        if (token().type() == TokenType.IDENTIFIER) {
            var variables = new ArrayList<Identifier>();
            do {
                var name = parseIdentifier();
                variables.add(name);
                flow.addLocal(name.name());
            } while (consume(","));

            String operator = null;
            var values = new ArrayList<Expression>();
            if (Operators.isAssignmentOperator(token())) {
                operator = token().stringValue();
                next();
                do {
                    values.add(parseExpectedExpression(flow));
                } while (consume(","));
            }
            return new LocalStatement(variables, operator, values, finish(start));
        }

        if (consume("function")) {
            var name = parseIdentifier();
            flow.addLocal(name.name());
            return parseFunctionDeclaration(name, true, start);
        }

        throw expected("<name>");
    }

    private Statement parseAssignmentOrCallStatement(FlowContext flow) {
        var statementStart = start();
        var targets = new ArrayList<Expression>();
        // TRUE: assignable, FALSE: not assignable, null: ends in a call
        Boolean lvalue;

        while (true) {
            var partStart = start();
            Expression base;
            if (token().type() == TokenType.IDENTIFIER) {
                base = parseIdentifier();
                lvalue = Boolean.TRUE;
            } else if (consume("(")) {
                base = parseExpectedExpression(flow).withParentheses();
                expect(")");
                lvalue = Boolean.FALSE;
            } else {
                throw unexpected(token());
            }

            while (true) {
                var current = token();
                if (current.type() == TokenType.STRING_LITERAL
                        || current.is(":")
                        || current.is("(")
                        || current.is("{")) {
                    lvalue = null;
                } else if (current.is(".") || current.is("[")) {
                    lvalue = Boolean.TRUE;
                } else {
                    break;
                }
                base = requireNonNull(parsePrefixExpressionPart(base, partStart, flow), "suffix");
            }

            targets.add(base);
            if (!token().is(",")) {
                break;
            }
            if (lvalue != Boolean.TRUE) {
                throw unexpected(token());
            }
            next();
        }

        if (targets.size() == 1 && lvalue == null) {
            return new CallStatement(targets.get(0), finish(statementStart));
        }
        if (lvalue != Boolean.TRUE) {
            throw unexpected(token());
        }
        if (!Operators.isAssignmentOperator(token())) {
            throw expected("assignment operator");
        }
        var operator = token().stringValue();
        next();

        var values = new ArrayList<Expression>();
        do {
            values.add(parseExpectedExpression(flow));
        } while (consume(","));

        return new AssignmentStatement(targets, operator, values, finish(statementStart));
    }

    /** {@code ? expr, ...}: shorthand for {@code print}, ending at the end of the line. */
    private CallStatement parseSpecialPrint(FlowContext flow, Token questionMark, SourcePosition start) {
        return withSignificantNewline(() -> {
            var arguments = new ArrayList<Expression>();
            do {
                arguments.add(parseExpectedExpression(flow));
            } while (consume(","));
            var base = new Identifier("?", questionMark.bounds(), false);
            var bounds = finish(start);
            return new CallStatement(new CallExpression(base, arguments, bounds, false), bounds);
        });
    }

    private IncludeStatement parseIncludeStatement(SourcePosition start) {
        var line = token();
        var matcher = INCLUDE.matcher(line.stringValue().stripTrailing());
        if (!matcher.matches() || matcher.group(1).isBlank()) {
            throw expected("#include <filename>");
        }
        var filename = matcher.group(1).strip();
        next();
        var statement = new IncludeStatement(filename, finish(start));
        recordInclude(statement);
        return statement;
    }

    private void recordInclude(IncludeStatement statement) {
        if (file == null) {
            return;
        }
        var target = ResolvedFile.resolveInclude(file, statement.filename());
        includes.add(new Include(statement, target));
        if (target.equals(file)) {
            warnings.add(new Warning(ErrorMessages.CIRCULAR_INCLUDE.formatted(statement.filename()), statement.bounds()));
            return;
        }
        if (fileResolver != null
                && (!fileResolver.exists(target.path()) || !fileResolver.isRegularFile(target.path()))) {
            logger.debug("Include target {} of {} not found", target.path(), file.path());
            warnings.add(new Warning(ErrorMessages.INCLUDE_NOT_FOUND.formatted(statement.filename()), statement.bounds()));
        }
    }

    // -- functions and tables

    private Identifier parseIdentifier() {
        var current = token();
        if (current.type() != TokenType.IDENTIFIER) {
            throw expected("<name>");
        }
        next();
        return new Identifier(current.stringValue(), current.bounds(), false);
    }

    /** {@code Name {'.' Name} [':' Name]} */
    private Expression parseFunctionName() {
        var start = start();
        Expression base = parseIdentifier();
        while (consume(".")) {
            var name = parseIdentifier();
            base = new MemberExpression(base, ".", name, finish(start), false);
        }
        if (consume(":")) {
            var name = parseIdentifier();
            base = new MemberExpression(base, ":", name, finish(start), false);
        }
        return base;
    }

    private FunctionDeclaration parseFunctionDeclaration(
            @Nullable Expression name, boolean isLocal, SourcePosition start) {
        var flow = new FlowContext(errors::add);
        flow.pushScope(false);

        var parameters = new ArrayList<Expression>();
        expect("(");
        if (!consume(")")) {
            do {
                var current = token();
                if (current.type() == TokenType.IDENTIFIER) {
                    parameters.add(parseIdentifier());
                } else if (current.type() == TokenType.VARARG_LITERAL) {
                    flow.setAllowVararg(true);
                    next();
                    parameters.add(new VarargLiteral(current.bounds(), false));
                    break;
                } else {
                    errors.add(new ParseError(
                            ErrorMessages.EXPECTED_TOKEN.formatted("<name> or '...'", current.displayText()),
                            current.bounds()));
                    skipUntil(t -> t.is(")") || t.is(","));
                }
            } while (consume(","));

            if (!consume(")")) {
                errors.add(new ParseError(
                        ErrorMessages.EXPECTED.formatted(")", token().displayText()), token().bounds()));
                skipUntil(t -> t.is(")"));
                consume(")");
            }
        }

        var body = parseBlock(flow, false);
        flow.popScope();
        expect("end");
        return new FunctionDeclaration(name, parameters, isLocal, body, finish(start), false);
    }

    /** The opening brace has been consumed; {@code start} is its position. */
    private TableConstructorExpression parseTableConstructor(FlowContext flow, SourcePosition start) {
        var fields = new ArrayList<TableField>();
        while (true) {
            var fieldStart = start();
            if (consume("[")) {
                var key = parseExpectedExpression(flow);
                expect("]");
                expect("=");
                var value = parseExpectedExpression(flow);
                fields.add(new TableKey(key, value, finish(fieldStart)));
            } else if (token().type() == TokenType.IDENTIFIER && lexer.lookahead().is("=")) {
                var key = parseIdentifier();
                next();
                var value = parseExpectedExpression(flow);
                fields.add(new TableKeyString(key, value, finish(fieldStart)));
            } else {
                var value = parseExpression(flow);
                if (value == null) {
                    break;
                }
                fields.add(new TableValue(value, finish(fieldStart)));
            }
            if (token().is(",") || token().is(";")) {
                next();
                continue;
            }
            break;
        }
        expect("}");
        return new TableConstructorExpression(fields, finish(start), false);
    }

    // -- expressions

    private @Nullable Expression parseExpression(FlowContext flow) {
        return parseSubExpression(0, flow);
    }

    private Expression parseExpectedExpression(FlowContext flow) {
        var expression = parseExpression(flow);
        if (expression == null) {
            throw expected("<expression>");
        }
        return expression;
    }

    /**
     * Precedence climbing: parses an operand and then every binary operator that binds tighter than
     * {@code minPrecedence}. Right associative operators recurse with one less precedence so the same operator
     * nests to the right.
     */
    private @Nullable Expression parseSubExpression(int minPrecedence, FlowContext flow) {
        enterLevel();
        try {
            var start = start();
            Expression expression = null;

            if (Operators.isUnary(token())) {
                var operator = token().stringValue();
                next();
                var argument = parseSubExpression(Operators.UNARY_PRECEDENCE, flow);
                if (argument == null) {
                    throw expected("<expression>");
                }
                expression = new UnaryExpression(operator, argument, finish(start), false);
            }

            if (expression == null) {
                expression = parsePrimaryExpression(flow);
                if (expression == null) {
                    expression = parsePrefixExpression(flow);
                }
            }
            if (expression == null) {
                return null;
            }

            while (true) {
                var current = token();
                int precedence = current.type() == TokenType.PUNCTUATOR || current.type() == TokenType.KEYWORD
                        ? Operators.binaryPrecedence(current.stringValue())
                        : 0;
                if (precedence == 0 || precedence <= minPrecedence) {
                    break;
                }
                var operator = current.stringValue();
                if (Operators.isRightAssociative(operator)) {
                    precedence--;
                }
                next();
                var right = parseSubExpression(precedence, flow);
                if (right == null) {
                    throw expected("<expression>");
                }
                var bounds = finish(start);
                expression = Operators.isLogical(operator)
                        ? new LogicalExpression(operator, expression, right, bounds, false)
                        : new BinaryExpression(operator, expression, right, bounds, false);
            }
            return expression;
        } finally {
            depth--;
        }
    }

    private @Nullable Expression parsePrefixExpression(FlowContext flow) {
        var start = start();
        Expression base;
        if (token().type() == TokenType.IDENTIFIER) {
            base = parseIdentifier();
        } else if (consume("(")) {
            base = parseExpectedExpression(flow).withParentheses();
            expect(")");
        } else {
            return null;
        }

        while (true) {
            var extended = parsePrefixExpressionPart(base, start, flow);
            if (extended == null) {
                return base;
            }
            base = extended;
        }
    }

    /** One suffix: {@code [exp]}, {@code .name}, {@code :name args} or call arguments. */
    private @Nullable Expression parsePrefixExpressionPart(Expression base, SourcePosition start, FlowContext flow) {
        var current = token();
        if (current.type() == TokenType.STRING_LITERAL) {
            return parseCallExpression(base, start, flow);
        }
        if (current.type() != TokenType.PUNCTUATOR) {
            return null;
        }
        switch (current.stringValue()) {
            case "[": {
                next();
                var index = parseExpectedExpression(flow);
                expect("]");
                return new IndexExpression(base, index, finish(start), false);
            }
            case ".": {
                next();
                var identifier = parseIdentifier();
                return new MemberExpression(base, ".", identifier, finish(start), false);
            }
            case ":": {
                next();
                var identifier = parseIdentifier();
                var method = new MemberExpression(base, ":", identifier, finish(start), false);
                return parseCallExpression(method, start, flow);
            }
            case "(":
            case "{":
                return parseCallExpression(base, start, flow);
            default:
                return null;
        }
    }

    private Expression parseCallExpression(Expression base, SourcePosition start, FlowContext flow) {
        var current = token();
        if (current.is("(")) {
            next();
            var arguments = new ArrayList<Expression>();
            var first = parseExpression(flow);
            if (first != null) {
                arguments.add(first);
                while (consume(",")) {
                    arguments.add(parseExpectedExpression(flow));
                }
            }
            expect(")");
            return new CallExpression(base, arguments, finish(start), false);
        }
        if (current.is("{")) {
            var tableStart = start();
            next();
            var table = parseTableConstructor(flow, tableStart);
            return new TableCallExpression(base, table, finish(start), false);
        }
        if (current.type() == TokenType.STRING_LITERAL) {
            next();
            var argument = new StringLiteral(current.stringValue(), current.raw(), current.bounds(), false);
            return new StringCallExpression(base, argument, finish(start), false);
        }
        throw expected("function arguments");
    }

    private @Nullable Expression parsePrimaryExpression(FlowContext flow) {
        var current = token();
        var start = start();
        switch (current.type()) {
            case VARARG_LITERAL:
                if (!flow.allowVararg()) {
                    flow.report(current, ErrorMessages.CANNOT_USE_VARARG.formatted(current.displayText()));
                }
                next();
                return new VarargLiteral(current.bounds(), false);
            case STRING_LITERAL:
                next();
                return new StringLiteral(current.stringValue(), current.raw(), current.bounds(), false);
            case NUMERIC_LITERAL:
                next();
                return new NumericLiteral(
                        ((Number) requireNonNull(current.value(), "value")).doubleValue(),
                        current.raw(),
                        current.bounds(),
                        false);
            case BOOLEAN_LITERAL:
                next();
                return new BooleanLiteral(Boolean.TRUE.equals(current.value()), current.bounds(), false);
            case NIL_LITERAL:
                next();
                return new NilLiteral(current.bounds(), false);
            case KEYWORD:
                if (current.is("function")) {
                    next();
                    return parseFunctionDeclaration(null, false, start);
                }
                return null;
            case PUNCTUATOR:
                if (current.is("{")) {
                    next();
                    return parseTableConstructor(flow, start);
                }
                return null;
            default:
                return null;
        }
    }
}
