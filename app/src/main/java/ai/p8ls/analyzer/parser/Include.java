package ai.p8ls.analyzer.parser;

import static java.util.Objects.requireNonNull;

import ai.p8ls.analyzer.ResolvedFile;
import ai.p8ls.analyzer.ast.IncludeStatement;

/**
 * An {@code #include} directive and the file it names, resolved against the including file's directory.
 */
public record Include(IncludeStatement statement, ResolvedFile file) {

    public Include {
        requireNonNull(statement, "statement");
        requireNonNull(file, "file");
    }
}
