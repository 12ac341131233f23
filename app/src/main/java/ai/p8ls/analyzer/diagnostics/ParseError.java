package ai.p8ls.analyzer.diagnostics;

import static java.util.Objects.requireNonNull;

import ai.p8ls.analyzer.Bounds;

/** A grammar violation, including lexer-level failures such as an unfinished string. */
public record ParseError(String message, Bounds bounds) implements CodeProblem {

    public ParseError {
        requireNonNull(message, "message");
        requireNonNull(bounds, "bounds");
    }

    @Override
    public Severity severity() {
        return Severity.ERROR;
    }
}
