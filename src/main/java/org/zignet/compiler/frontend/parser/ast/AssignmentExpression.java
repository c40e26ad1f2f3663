package org.zignet.compiler.frontend.parser.ast;

import java.util.List;

/**
 * An assignment, {@code target = value} or {@code target += value}. Assignment is
 * right-associative, so {@code a = b = 1} nests on the right. The node takes the position
 * of its target.
 *
 * @param operator {@code "="} or {@code "+="}.
 * @param left The assignment target.
 * @param right The assigned value.
 * @param line The line of the target.
 * @param column The column of the target.
 */
public record AssignmentExpression(String operator, Expression left, Expression right, int line, int column) implements Expression {

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitAssignment(this);
    }

    @Override
    public List<AstNode> getChildren() {
        return AstNode.children(left, right);
    }
}
