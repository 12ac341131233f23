package ai.p8ls.analyzer.ast;

import ai.p8ls.analyzer.Bounds;

/** {@code ::name::} */
public record LabelStatement(Identifier label, Bounds bounds) implements Statement {

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitLabelStatement(this);
    }
}
