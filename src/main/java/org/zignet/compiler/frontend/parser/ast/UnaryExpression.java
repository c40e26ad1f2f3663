package org.zignet.compiler.frontend.parser.ast;

import java.util.List;

/**
 * A prefix operation, {@code -x} or {@code !x}. The node takes the position of the operator.
 */
public record UnaryExpression(String operator, Expression operand, int line, int column) implements Expression {

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitUnary(this);
    }

    @Override
    public List<AstNode> getChildren() {
        return AstNode.children(operand);
    }
}
