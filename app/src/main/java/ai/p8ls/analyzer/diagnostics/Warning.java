package ai.p8ls.analyzer.diagnostics;

import static java.util.Objects.requireNonNull;

import ai.p8ls.analyzer.Bounds;

/** A semantic advisory: unresolved global, deprecated builtin, missing include target. */
public record Warning(String message, Bounds bounds) implements CodeProblem {

    public Warning {
        requireNonNull(message, "message");
        requireNonNull(bounds, "bounds");
    }

    @Override
    public Severity severity() {
        return Severity.WARNING;
    }
}
