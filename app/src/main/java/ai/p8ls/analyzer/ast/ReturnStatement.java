package ai.p8ls.analyzer.ast;

import ai.p8ls.analyzer.Bounds;
import java.util.List;

public record ReturnStatement(List<Expression> arguments, Bounds bounds) implements Statement {

    public ReturnStatement {
        arguments = List.copyOf(arguments);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitReturnStatement(this);
    }
}
