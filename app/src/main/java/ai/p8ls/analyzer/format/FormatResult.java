package ai.p8ls.analyzer.format;

/** Canonical text for {@link #range()} of the original document. */
public record FormatResult(String formattedText, FormatRange range) {}
