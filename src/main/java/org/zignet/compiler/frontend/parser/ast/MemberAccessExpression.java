package org.zignet.compiler.frontend.parser.ast;

import java.util.List;

/**
 * A member access, {@code object.property}.
 */
public record MemberAccessExpression(Expression object, String property, int line, int column) implements Expression {

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitMemberAccess(this);
    }

    @Override
    public List<AstNode> getChildren() {
        return AstNode.children(object);
    }
}
