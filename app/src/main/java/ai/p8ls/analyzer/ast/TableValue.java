package ai.p8ls.analyzer.ast;

import ai.p8ls.analyzer.Bounds;

/** A positional table entry. */
public record TableValue(Expression value, Bounds bounds) implements TableField {

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitTableValue(this);
    }
}
