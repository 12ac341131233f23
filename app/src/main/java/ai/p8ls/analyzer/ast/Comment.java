package ai.p8ls.analyzer.ast;

import ai.p8ls.analyzer.Bounds;

/**
 * A comment captured by the lexer. Comments are not part of the tree; the formatter weaves them back in by position.
 *
 * @param value text after the comment marker (or inside the long brackets)
 * @param raw exact source text including markers
 * @param isLong true for {@code --[[ ... ]]} comments
 */
public record Comment(String value, String raw, boolean isLong, Bounds bounds) {}
