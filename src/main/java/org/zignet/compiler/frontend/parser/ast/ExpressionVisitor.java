package org.zignet.compiler.frontend.parser.ast;

/**
 * A visitor over the closed set of {@link Expression} nodes.
 *
 * @param <R> The return type of the visit methods.
 */
public interface ExpressionVisitor<R> {
    R visitBinary(BinaryExpression node);
    R visitUnary(UnaryExpression node);
    R visitCall(CallExpression node);
    R visitMemberAccess(MemberAccessExpression node);
    R visitIndex(IndexExpression node);
    R visitIdentifier(Identifier node);
    R visitNumber(NumberLiteral node);
    R visitString(StringLiteral node);
    R visitBoolean(BooleanLiteral node);
    R visitStructLiteral(StructLiteral node);
    R visitArrayLiteral(ArrayLiteral node);
    R visitAssignment(AssignmentExpression node);
}
