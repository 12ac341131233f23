package ai.p8ls.analyzer.ast;

import ai.p8ls.analyzer.Bounds;

/** {@code and} / {@code or}. */
public record LogicalExpression(
        String operator, Expression left, Expression right, Bounds bounds, boolean parenthesized)
        implements Expression {

    @Override
    public LogicalExpression withParentheses() {
        return new LogicalExpression(operator, left, right, bounds, true);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitLogicalExpression(this);
    }
}
