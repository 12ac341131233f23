package ai.p8ls.analyzer.ast;

/**
 * One method per node kind. Implementations are exhaustive by construction: a new node kind adds a method here and
 * breaks every visitor until it is handled.
 */
public interface NodeVisitor<R> {

    R visitAssignmentStatement(AssignmentStatement node);

    R visitLocalStatement(LocalStatement node);

    R visitIfStatement(IfStatement node);

    R visitIfClause(IfClause node);

    R visitWhileStatement(WhileStatement node);

    R visitRepeatStatement(RepeatStatement node);

    R visitForNumericStatement(ForNumericStatement node);

    R visitForGenericStatement(ForGenericStatement node);

    R visitFunctionDeclaration(FunctionDeclaration node);

    R visitReturnStatement(ReturnStatement node);

    R visitBreakStatement(BreakStatement node);

    R visitGotoStatement(GotoStatement node);

    R visitLabelStatement(LabelStatement node);

    R visitCallStatement(CallStatement node);

    R visitDoStatement(DoStatement node);

    R visitIncludeStatement(IncludeStatement node);

    R visitIdentifier(Identifier node);

    R visitStringLiteral(StringLiteral node);

    R visitNumericLiteral(NumericLiteral node);

    R visitBooleanLiteral(BooleanLiteral node);

    R visitNilLiteral(NilLiteral node);

    R visitVarargLiteral(VarargLiteral node);

    R visitTableConstructorExpression(TableConstructorExpression node);

    R visitTableKey(TableKey node);

    R visitTableKeyString(TableKeyString node);

    R visitTableValue(TableValue node);

    R visitBinaryExpression(BinaryExpression node);

    R visitLogicalExpression(LogicalExpression node);

    R visitUnaryExpression(UnaryExpression node);

    R visitMemberExpression(MemberExpression node);

    R visitIndexExpression(IndexExpression node);

    R visitCallExpression(CallExpression node);

    R visitTableCallExpression(TableCallExpression node);

    R visitStringCallExpression(StringCallExpression node);
}
