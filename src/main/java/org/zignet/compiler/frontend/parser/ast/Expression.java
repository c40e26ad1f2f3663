package org.zignet.compiler.frontend.parser.ast;

/**
 * An expression.
 */
public sealed interface Expression extends AstNode
        permits BinaryExpression, UnaryExpression, CallExpression, MemberAccessExpression, IndexExpression,
                Identifier, NumberLiteral, StringLiteral, BooleanLiteral, StructLiteral, ArrayLiteral,
                AssignmentExpression {

    <R> R accept(ExpressionVisitor<R> visitor);
}
