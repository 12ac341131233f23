package ai.p8ls.analyzer.ast;

import java.util.List;

/**
 * An ordered statement list. Blocks are compared by identity when tools need to attach data to a specific body.
 */
public record Block(List<Statement> statements) {

    public Block {
        statements = List.copyOf(statements);
    }

    public boolean isEmpty() {
        return statements.isEmpty();
    }
}
