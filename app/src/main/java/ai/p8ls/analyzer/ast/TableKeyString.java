package ai.p8ls.analyzer.ast;

import ai.p8ls.analyzer.Bounds;

/** {@code name = value} */
public record TableKeyString(Identifier key, Expression value, Bounds bounds) implements TableField {

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitTableKeyString(this);
    }
}
