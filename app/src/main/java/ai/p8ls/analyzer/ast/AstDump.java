package ai.p8ls.analyzer.ast;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Renders a tree as a location-free s-expression, e.g. {@code (local (a) (+ 1 2))}.
 *
 * <p>Two trees with equal dumps are the same program modulo formatting: positions and comments are left out,
 * chains of one associative operator are flattened ({@code a + (b + c)} and {@code (a + b) + c} both dump as
 * {@code (+ a b c)}), and only the parentheses that change meaning (around calls and {@code ...}, which truncate
 * to one value) are recorded.
 */
public final class AstDump implements NodeVisitor<String> {
    private static final Set<String> ASSOCIATIVE = Set.of("+", "*", "&", "|", "..", "and", "or");

    private static final AstDump INSTANCE = new AstDump();

    private AstDump() {}

    public static String dump(Block block) {
        return INSTANCE.block(block);
    }

    public static String dump(Node node) {
        return node.accept(INSTANCE);
    }

    private String block(Block block) {
        return "(block" + joined(block.statements()) + ")";
    }

    private String joined(List<? extends Node> nodes) {
        return nodes.stream().map(n -> " " + n.accept(this)).collect(Collectors.joining());
    }

    private String list(List<? extends Node> nodes) {
        return "(" + joined(nodes).trim() + ")";
    }

    private static String truncating(Expression expression, String text) {
        return expression.parenthesized() ? "(paren " + text + ")" : text;
    }

    private String operation(String operator, Expression left, Expression right) {
        if (!ASSOCIATIVE.contains(operator)) {
            return "(" + operator + " " + left.accept(this) + " " + right.accept(this) + ")";
        }
        var operands = new ArrayList<Expression>();
        flatten(operator, left, operands);
        flatten(operator, right, operands);
        return "(" + operator + joined(operands) + ")";
    }

    private static void flatten(String operator, Expression expression, List<Expression> out) {
        if (expression instanceof BinaryExpression binary && binary.operator().equals(operator)) {
            flatten(operator, binary.left(), out);
            flatten(operator, binary.right(), out);
        } else if (expression instanceof LogicalExpression logical && logical.operator().equals(operator)) {
            flatten(operator, logical.left(), out);
            flatten(operator, logical.right(), out);
        } else {
            out.add(expression);
        }
    }

    @Override
    public String visitAssignmentStatement(AssignmentStatement node) {
        return "(assign " + node.operator() + " " + list(node.targets()) + " " + list(node.values()) + ")";
    }

    @Override
    public String visitLocalStatement(LocalStatement node) {
        return "(local " + list(node.variables()) + " " + list(node.values()) + ")";
    }

    @Override
    public String visitIfStatement(IfStatement node) {
        return "(if" + joined(node.clauses()) + ")";
    }

    @Override
    public String visitIfClause(IfClause node) {
        var condition = node.condition() == null ? "" : " " + node.condition().accept(this);
        return "(" + node.kind().keyword() + condition + " " + block(node.body()) + ")";
    }

    @Override
    public String visitWhileStatement(WhileStatement node) {
        return "(while " + node.condition().accept(this) + " " + block(node.body()) + ")";
    }

    @Override
    public String visitRepeatStatement(RepeatStatement node) {
        return "(repeat " + block(node.body()) + " " + node.condition().accept(this) + ")";
    }

    @Override
    public String visitForNumericStatement(ForNumericStatement node) {
        var step = node.step() == null ? "" : " " + node.step().accept(this);
        return "(fornum " + node.variable().accept(this) + " " + node.start().accept(this) + " "
                + node.end().accept(this) + step + " " + block(node.body()) + ")";
    }

    @Override
    public String visitForGenericStatement(ForGenericStatement node) {
        return "(forin " + list(node.variables()) + " " + list(node.iterators()) + " " + block(node.body()) + ")";
    }

    @Override
    public String visitFunctionDeclaration(FunctionDeclaration node) {
        var name = node.identifier() == null ? "" : " " + node.identifier().accept(this);
        var kind = node.isLocal() ? "local-function" : "function";
        return "(" + kind + name + " " + list(node.parameters()) + " " + block(node.body()) + ")";
    }

    @Override
    public String visitReturnStatement(ReturnStatement node) {
        return "(return" + joined(node.arguments()) + ")";
    }

    @Override
    public String visitBreakStatement(BreakStatement node) {
        return "(break)";
    }

    @Override
    public String visitGotoStatement(GotoStatement node) {
        return "(goto " + node.label().name() + ")";
    }

    @Override
    public String visitLabelStatement(LabelStatement node) {
        return "(label " + node.label().name() + ")";
    }

    @Override
    public String visitCallStatement(CallStatement node) {
        return "(call-stmt " + node.expression().accept(this) + ")";
    }

    @Override
    public String visitDoStatement(DoStatement node) {
        return "(do " + block(node.body()) + ")";
    }

    @Override
    public String visitIncludeStatement(IncludeStatement node) {
        return "(include " + node.filename() + ")";
    }

    @Override
    public String visitIdentifier(Identifier node) {
        return node.name();
    }

    @Override
    public String visitStringLiteral(StringLiteral node) {
        return node.raw();
    }

    @Override
    public String visitNumericLiteral(NumericLiteral node) {
        return node.raw();
    }

    @Override
    public String visitBooleanLiteral(BooleanLiteral node) {
        return String.valueOf(node.value());
    }

    @Override
    public String visitNilLiteral(NilLiteral node) {
        return "nil";
    }

    @Override
    public String visitVarargLiteral(VarargLiteral node) {
        return truncating(node, "...");
    }

    @Override
    public String visitTableConstructorExpression(TableConstructorExpression node) {
        return "(table" + joined(node.fields()) + ")";
    }

    @Override
    public String visitTableKey(TableKey node) {
        return "([] " + node.key().accept(this) + " " + node.value().accept(this) + ")";
    }

    @Override
    public String visitTableKeyString(TableKeyString node) {
        return "(= " + node.key().name() + " " + node.value().accept(this) + ")";
    }

    @Override
    public String visitTableValue(TableValue node) {
        return node.value().accept(this);
    }

    @Override
    public String visitBinaryExpression(BinaryExpression node) {
        return operation(node.operator(), node.left(), node.right());
    }

    @Override
    public String visitLogicalExpression(LogicalExpression node) {
        return operation(node.operator(), node.left(), node.right());
    }

    @Override
    public String visitUnaryExpression(UnaryExpression node) {
        return "(" + node.operator() + " " + node.argument().accept(this) + ")";
    }

    @Override
    public String visitMemberExpression(MemberExpression node) {
        return "(" + node.indexer() + " " + node.base().accept(this) + " " + node.identifier().name() + ")";
    }

    @Override
    public String visitIndexExpression(IndexExpression node) {
        return "(index " + node.base().accept(this) + " " + node.index().accept(this) + ")";
    }

    @Override
    public String visitCallExpression(CallExpression node) {
        return truncating(node, "(call " + node.base().accept(this) + joined(node.arguments()) + ")");
    }

    @Override
    public String visitTableCallExpression(TableCallExpression node) {
        return truncating(node, "(call " + node.base().accept(this) + " " + node.argument().accept(this) + ")");
    }

    @Override
    public String visitStringCallExpression(StringCallExpression node) {
        return truncating(node, "(call " + node.base().accept(this) + " " + node.argument().accept(this) + ")");
    }
}
