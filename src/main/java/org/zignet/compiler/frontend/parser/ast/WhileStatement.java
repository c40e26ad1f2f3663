package org.zignet.compiler.frontend.parser.ast;

import java.util.List;

/**
 * A {@code while} loop.
 *
 * @param condition The loop condition.
 * @param body The loop body.
 * @param line The line of the keyword.
 * @param column The column of the keyword.
 */
public record WhileStatement(Expression condition, Statement body, int line, int column) implements Statement {

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitWhile(this);
    }

    @Override
    public List<AstNode> getChildren() {
        return AstNode.children(condition, body);
    }
}
