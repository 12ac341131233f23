package ai.p8ls.analyzer.ast;

import ai.p8ls.analyzer.Bounds;
import java.util.List;

/**
 * {@code a, b.c, d[e] = 1, 2, 3} or a compound form such as {@code x += 1}.
 *
 * @param operator {@code =} or a compound operator like {@code +=}
 */
public record AssignmentStatement(List<Expression> targets, String operator, List<Expression> values, Bounds bounds)
        implements Statement {

    public AssignmentStatement {
        targets = List.copyOf(targets);
        values = List.copyOf(values);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitAssignmentStatement(this);
    }
}
