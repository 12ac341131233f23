package ai.p8ls.analyzer.ast;

import ai.p8ls.analyzer.Bounds;
import java.util.List;

/**
 * An if statement with its clauses in source order.
 *
 * @param oneLine true for the PICO-8 shorthand {@code if (cond) stmt} that has no {@code then}/{@code end}
 */
public record IfStatement(List<IfClause> clauses, boolean oneLine, Bounds bounds) implements Statement {

    public IfStatement {
        clauses = List.copyOf(clauses);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitIfStatement(this);
    }
}
