package ai.p8ls.analyzer.ast;

import static java.util.Objects.requireNonNull;

import ai.p8ls.analyzer.Bounds;

/**
 * A call used as a statement. The expression is a {@link CallExpression}, {@link TableCallExpression} or
 * {@link StringCallExpression}; the {@code ?} print shorthand is a call whose base is the identifier {@code ?}.
 */
public record CallStatement(Expression expression, Bounds bounds) implements Statement {

    public CallStatement {
        requireNonNull(expression, "expression");
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitCallStatement(this);
    }
}
