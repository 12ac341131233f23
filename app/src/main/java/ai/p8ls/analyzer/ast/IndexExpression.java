package ai.p8ls.analyzer.ast;

import ai.p8ls.analyzer.Bounds;

/** {@code base[index]} */
public record IndexExpression(
        Expression base, Expression index, Bounds bounds, boolean parenthesized)
        implements Expression {

    @Override
    public IndexExpression withParentheses() {
        return new IndexExpression(base, index, bounds, true);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitIndexExpression(this);
    }
}
