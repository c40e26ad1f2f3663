package org.zignet.compiler.frontend.parser.ast;

import java.util.List;

/**
 * An expression evaluated for its effect, terminated by {@code ;}.
 * Its position is the position of the expression.
 */
public record ExpressionStatement(Expression expression, int line, int column) implements Statement {

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitExpression(this);
    }

    @Override
    public List<AstNode> getChildren() {
        return AstNode.children(expression);
    }
}
