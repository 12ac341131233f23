package ai.p8ls.analyzer.ast;

import ai.p8ls.analyzer.Bounds;

/** {@code not}, {@code -}, {@code #}, {@code ~} and the PICO-8 peek operators {@code @ % $}. */
public record UnaryExpression(
        String operator, Expression argument, Bounds bounds, boolean parenthesized)
        implements Expression {

    @Override
    public UnaryExpression withParentheses() {
        return new UnaryExpression(operator, argument, bounds, true);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitUnaryExpression(this);
    }
}
