package org.zignet.compiler.frontend.parser.ast;

import java.util.List;

/**
 * A binary operation such as {@code a + b} or {@code x and y}.
 * The node takes the position of its left operand.
 *
 * @param operator The canonical operator spelling ({@code "+"}, {@code "=="}, {@code "and"}, ...).
 * @param left The left operand.
 * @param right The right operand.
 * @param line The line of the left operand.
 * @param column The column of the left operand.
 */
public record BinaryExpression(String operator, Expression left, Expression right, int line, int column) implements Expression {

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitBinary(this);
    }

    @Override
    public List<AstNode> getChildren() {
        return AstNode.children(left, right);
    }
}
