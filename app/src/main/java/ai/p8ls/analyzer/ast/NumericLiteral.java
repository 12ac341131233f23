package ai.p8ls.analyzer.ast;

import ai.p8ls.analyzer.Bounds;

/** A number in decimal, hex or binary form; rendering always uses {@code raw}. */
public record NumericLiteral(double value, String raw, Bounds bounds, boolean parenthesized) implements Expression {

    @Override
    public NumericLiteral withParentheses() {
        return new NumericLiteral(value, raw, bounds, true);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitNumericLiteral(this);
    }
}
