package org.zignet.compiler.frontend.parser.ast;

import java.util.List;

/**
 * A call, {@code callee(arg, ...)}.
 */
public record CallExpression(Expression callee, List<Expression> arguments, int line, int column) implements Expression {

    public CallExpression {
        arguments = List.copyOf(arguments);
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitCall(this);
    }

    @Override
    public List<AstNode> getChildren() {
        return AstNode.children(callee, arguments);
    }
}
