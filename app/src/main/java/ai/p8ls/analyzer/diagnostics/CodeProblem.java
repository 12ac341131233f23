package ai.p8ls.analyzer.diagnostics;

import ai.p8ls.analyzer.Bounds;

/**
 * A diagnostic attached to a span of source text. {@link ParseError}s are hard failures that make a tree unsafe to
 * reformat; {@link Warning}s are advisories.
 */
public sealed interface CodeProblem permits ParseError, Warning {

    String message();

    Bounds bounds();

    Severity severity();

    enum Severity {
        ERROR,
        WARNING
    }
}
