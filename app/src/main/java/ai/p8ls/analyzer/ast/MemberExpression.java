package ai.p8ls.analyzer.ast;

import ai.p8ls.analyzer.Bounds;
import org.jetbrains.annotations.Nullable;

/**
 * {@code base.name} or {@code base:name}.
 *
 * @param indexer {@code .} or {@code :}
 */
public record MemberExpression(
        Expression base, String indexer, Identifier identifier, Bounds bounds, boolean parenthesized)
        implements Expression {

    /**
     * Dotted path such as {@code a.b.c}, using {@code .} for every level. Null when the innermost base is not a
     * plain identifier ({@code f().x}).
     */
    public @Nullable String dottedName() {
        if (base instanceof Identifier id) {
            return id.name() + "." + identifier.name();
        }
        if (base instanceof MemberExpression member) {
            var baseName = member.dottedName();
            return baseName == null ? null : baseName + "." + identifier.name();
        }
        return null;
    }

    /** Identifier at the root of a chain of member accesses, or null when the chain starts elsewhere. */
    public @Nullable Identifier rootIdentifier() {
        Expression current = base;
        while (current instanceof MemberExpression member) {
            current = member.base();
        }
        return current instanceof Identifier id ? id : null;
    }

    @Override
    public MemberExpression withParentheses() {
        return new MemberExpression(base, indexer, identifier, bounds, true);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitMemberExpression(this);
    }
}
