package ai.p8ls.analyzer.ast;

import ai.p8ls.analyzer.Bounds;

public record Identifier(String name, Bounds bounds, boolean parenthesized) implements Expression {

    @Override
    public Identifier withParentheses() {
        return new Identifier(name, bounds, true);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitIdentifier(this);
    }
}
