package ai.p8ls.analyzer.ast;

import ai.p8ls.analyzer.Bounds;
import org.jetbrains.annotations.Nullable;

public record ForNumericStatement(
        Identifier variable, Expression start, Expression end, @Nullable Expression step, Block body, Bounds bounds)
        implements Statement {

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitForNumericStatement(this);
    }
}
