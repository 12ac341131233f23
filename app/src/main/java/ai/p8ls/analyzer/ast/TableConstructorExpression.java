package ai.p8ls.analyzer.ast;

import ai.p8ls.analyzer.Bounds;
import java.util.List;

public record TableConstructorExpression(
        List<TableField> fields, Bounds bounds, boolean parenthesized)
        implements Expression {

    public TableConstructorExpression {
        fields = List.copyOf(fields);
    }

    @Override
    public TableConstructorExpression withParentheses() {
        return new TableConstructorExpression(fields, bounds, true);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitTableConstructorExpression(this);
    }
}
