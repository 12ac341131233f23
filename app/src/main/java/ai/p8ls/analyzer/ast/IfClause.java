package ai.p8ls.analyzer.ast;

import ai.p8ls.analyzer.Bounds;
import org.jetbrains.annotations.Nullable;

/**
 * One branch of an {@link IfStatement}. The condition is null only for {@link Kind#ELSE}.
 */
public record IfClause(Kind kind, @Nullable Expression condition, Block body, Bounds bounds) implements Node {

    public enum Kind {
        IF("if"),
        ELSEIF("elseif"),
        ELSE("else");

        private final String keyword;

        Kind(String keyword) {
            this.keyword = keyword;
        }

        public String keyword() {
            return keyword;
        }
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitIfClause(this);
    }
}
