package ai.p8ls.analyzer.ast;

import ai.p8ls.analyzer.Bounds;
import java.util.List;

public record ForGenericStatement(List<Identifier> variables, List<Expression> iterators, Block body, Bounds bounds)
        implements Statement {

    public ForGenericStatement {
        variables = List.copyOf(variables);
        iterators = List.copyOf(iterators);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitForGenericStatement(this);
    }
}
