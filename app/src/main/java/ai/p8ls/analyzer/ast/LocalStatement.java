package ai.p8ls.analyzer.ast;

import ai.p8ls.analyzer.Bounds;
import java.util.List;
import org.jetbrains.annotations.Nullable;

/**
 * {@code local a, b = 1, 2}. The operator is null for a bare declaration such as {@code local a}.
 */
public record LocalStatement(
        List<Identifier> variables, @Nullable String operator, List<Expression> values, Bounds bounds)
        implements Statement {

    public LocalStatement {
        variables = List.copyOf(variables);
        values = List.copyOf(values);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitLocalStatement(this);
    }
}
