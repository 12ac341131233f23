package ai.p8ls.analyzer.ast;

import ai.p8ls.analyzer.Bounds;

public record VarargLiteral(Bounds bounds, boolean parenthesized) implements Expression {

    @Override
    public VarargLiteral withParentheses() {
        return new VarargLiteral(bounds, true);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitVarargLiteral(this);
    }
}
