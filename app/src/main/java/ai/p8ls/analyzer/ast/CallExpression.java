package ai.p8ls.analyzer.ast;

import ai.p8ls.analyzer.Bounds;
import java.util.List;

public record CallExpression(
        Expression base, List<Expression> arguments, Bounds bounds, boolean parenthesized)
        implements Expression {

    public CallExpression {
        arguments = List.copyOf(arguments);
    }

    @Override
    public CallExpression withParentheses() {
        return new CallExpression(base, arguments, bounds, true);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitCallExpression(this);
    }
}
