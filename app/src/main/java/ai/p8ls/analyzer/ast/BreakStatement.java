package ai.p8ls.analyzer.ast;

import ai.p8ls.analyzer.Bounds;

public record BreakStatement(Bounds bounds) implements Statement {

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitBreakStatement(this);
    }
}
