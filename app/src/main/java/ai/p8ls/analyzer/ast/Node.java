package ai.p8ls.analyzer.ast;

import ai.p8ls.analyzer.Bounds;

/**
 * Root of the syntax tree node hierarchy. The set of node kinds is closed; every analysis dispatches through
 * {@link NodeVisitor}, so adding a kind forces every visitor to handle it.
 */
public sealed interface Node permits Statement, Expression, IfClause, TableField {

    /** Source span of the node; always set for parser-produced nodes. */
    Bounds bounds();

    <R> R accept(NodeVisitor<R> visitor);
}
