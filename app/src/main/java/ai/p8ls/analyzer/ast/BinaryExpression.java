package ai.p8ls.analyzer.ast;

import ai.p8ls.analyzer.Bounds;

/** Arithmetic, bitwise, concatenation and comparison operators. */
public record BinaryExpression(
        String operator, Expression left, Expression right, Bounds bounds, boolean parenthesized)
        implements Expression {

    @Override
    public BinaryExpression withParentheses() {
        return new BinaryExpression(operator, left, right, bounds, true);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitBinaryExpression(this);
    }
}
