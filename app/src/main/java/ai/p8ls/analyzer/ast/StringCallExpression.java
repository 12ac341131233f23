package ai.p8ls.analyzer.ast;

import ai.p8ls.analyzer.Bounds;

/** {@code f"text"} */
public record StringCallExpression(
        Expression base, StringLiteral argument, Bounds bounds, boolean parenthesized)
        implements Expression {

    @Override
    public StringCallExpression withParentheses() {
        return new StringCallExpression(base, argument, bounds, true);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitStringCallExpression(this);
    }
}
