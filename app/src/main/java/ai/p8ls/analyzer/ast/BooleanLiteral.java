package ai.p8ls.analyzer.ast;

import ai.p8ls.analyzer.Bounds;

public record BooleanLiteral(boolean value, Bounds bounds, boolean parenthesized) implements Expression {

    @Override
    public BooleanLiteral withParentheses() {
        return new BooleanLiteral(value, bounds, true);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitBooleanLiteral(this);
    }
}
