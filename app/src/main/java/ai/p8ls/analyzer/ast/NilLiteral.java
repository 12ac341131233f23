package ai.p8ls.analyzer.ast;

import ai.p8ls.analyzer.Bounds;

public record NilLiteral(Bounds bounds, boolean parenthesized) implements Expression {

    @Override
    public NilLiteral withParentheses() {
        return new NilLiteral(bounds, true);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitNilLiteral(this);
    }
}
