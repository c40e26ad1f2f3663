package org.zignet.compiler.frontend.parser.ast;

import java.util.List;

/**
 * An index access, {@code object[index]}.
 */
public record IndexExpression(Expression object, Expression index, int line, int column) implements Expression {

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitIndex(this);
    }

    @Override
    public List<AstNode> getChildren() {
        return AstNode.children(object, index);
    }
}
