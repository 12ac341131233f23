package ai.p8ls.analyzer.ast;

import ai.p8ls.analyzer.Bounds;

/** {@code repeat ... until cond}; the condition can see locals declared in the body. */
public record RepeatStatement(Block body, Expression condition, Bounds bounds) implements Statement {

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitRepeatStatement(this);
    }
}
