package ai.p8ls.analyzer.ast;

import ai.p8ls.analyzer.Bounds;

public record WhileStatement(Expression condition, Block body, Bounds bounds) implements Statement {

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitWhileStatement(this);
    }
}
