package ai.p8ls.analyzer.ast;

import ai.p8ls.analyzer.Bounds;

/** A quoted or long-bracket string. {@code raw} is the exact source text, {@code value} the decoded contents. */
public record StringLiteral(String value, String raw, Bounds bounds, boolean parenthesized) implements Expression {

    @Override
    public StringLiteral withParentheses() {
        return new StringLiteral(value, raw, bounds, true);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitStringLiteral(this);
    }
}
