package org.zignet.compiler.frontend.parser.ast;

import java.util.List;

/**
 * A {@code return} statement.
 *
 * @param value The returned value, or {@code null} for a bare {@code return;}.
 * @param line The line of the keyword.
 * @param column The column of the keyword.
 */
public record ReturnStatement(Expression value, int line, int column) implements Statement {

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitReturn(this);
    }

    @Override
    public List<AstNode> getChildren() {
        return AstNode.children(value);
    }
}
