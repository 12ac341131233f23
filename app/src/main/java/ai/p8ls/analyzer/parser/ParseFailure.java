package ai.p8ls.analyzer.parser;

import ai.p8ls.analyzer.Bounds;
import ai.p8ls.analyzer.diagnostics.ParseError;

/**
 * Unwinds the parser from a grammar violation to the nearest statement boundary, where it is recorded and parsing
 * resumes. Never escapes {@link Parser}.
 */
final class ParseFailure extends RuntimeException {
    private static final long serialVersionUID = 1L;

    private final transient ParseError error;

    ParseFailure(String message, Bounds bounds) {
        super(message, null, false, false);
        this.error = new ParseError(message, bounds);
    }

    ParseError error() {
        return error;
    }
}
