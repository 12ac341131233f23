package ai.p8ls.analyzer.ast;

/**
 * An expression node. {@link #parenthesized()} records whether the source wrapped the expression in parentheses.
 */
public sealed interface Expression extends Node
        permits Identifier,
                StringLiteral,
                NumericLiteral,
                BooleanLiteral,
                NilLiteral,
                VarargLiteral,
                FunctionDeclaration,
                TableConstructorExpression,
                BinaryExpression,
                LogicalExpression,
                UnaryExpression,
                MemberExpression,
                IndexExpression,
                CallExpression,
                TableCallExpression,
                StringCallExpression {

    boolean parenthesized();

    /** Copy of this expression with the parenthesized flag set. */
    Expression withParentheses();
}
