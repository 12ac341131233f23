package ai.p8ls.analyzer.ast;

import ai.p8ls.analyzer.Bounds;

/** {@code [key] = value} */
public record TableKey(Expression key, Expression value, Bounds bounds) implements TableField {

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitTableKey(this);
    }
}
