package ai.p8ls.analyzer.ast;

import ai.p8ls.analyzer.Bounds;
import java.util.List;
import org.jetbrains.annotations.Nullable;

/**
 * A function definition. As a statement it carries a name ({@code function a.b:c()} or {@code local function f()});
 * as an expression ({@code function(x) ... end}) the identifier is null.
 *
 * @param identifier an {@link Identifier} or {@link MemberExpression}, or null for anonymous functions
 * @param parameters {@link Identifier}s, optionally followed by a trailing {@link VarargLiteral}
 */
public record FunctionDeclaration(
        @Nullable Expression identifier,
        List<Expression> parameters,
        boolean isLocal,
        Block body,
        Bounds bounds,
        boolean parenthesized)
        implements Statement, Expression {

    public FunctionDeclaration {
        parameters = List.copyOf(parameters);
    }

    public boolean isVararg() {
        return !parameters.isEmpty() && parameters.get(parameters.size() - 1) instanceof VarargLiteral;
    }

    /** True for methods declared with {@code :}, which get an implicit {@code self} parameter. */
    public boolean isMethod() {
        return identifier instanceof MemberExpression member && member.indexer().equals(":");
    }

    /** Display name: {@code f}, {@code a.b} or {@code a:m} as written, or {@code <anonymous function>}. */
    public String displayName() {
        return identifier == null ? "<anonymous function>" : nameOf(identifier);
    }

    private static String nameOf(Expression expression) {
        if (expression instanceof Identifier id) {
            return id.name();
        }
        if (expression instanceof MemberExpression member) {
            return nameOf(member.base()) + member.indexer() + member.identifier().name();
        }
        return "?";
    }

    @Override
    public FunctionDeclaration withParentheses() {
        return new FunctionDeclaration(identifier, parameters, isLocal, body, bounds, true);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitFunctionDeclaration(this);
    }
}
