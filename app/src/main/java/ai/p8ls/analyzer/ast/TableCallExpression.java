package ai.p8ls.analyzer.ast;

import ai.p8ls.analyzer.Bounds;

/** {@code f{...}} */
public record TableCallExpression(
        Expression base, TableConstructorExpression argument, Bounds bounds, boolean parenthesized)
        implements Expression {

    @Override
    public TableCallExpression withParentheses() {
        return new TableCallExpression(base, argument, bounds, true);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitTableCallExpression(this);
    }
}
