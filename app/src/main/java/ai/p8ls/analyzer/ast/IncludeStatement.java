package ai.p8ls.analyzer.ast;

import ai.p8ls.analyzer.Bounds;

/** {@code #include path/to/file.lua}; the filename is kept exactly as written. */
public record IncludeStatement(String filename, Bounds bounds) implements Statement {

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitIncludeStatement(this);
    }
}
