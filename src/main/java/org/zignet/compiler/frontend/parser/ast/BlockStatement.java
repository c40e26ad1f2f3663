package org.zignet.compiler.frontend.parser.ast;

import java.util.List;

/**
 * A brace-delimited statement list. Every block opens a new scope.
 *
 * @param statements The statements in source order.
 * @param line The line of the opening brace.
 * @param column The column of the opening brace.
 */
public record BlockStatement(List<Statement> statements, int line, int column) implements Statement {

    public BlockStatement {
        statements = List.copyOf(statements);
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitBlock(this);
    }

    @Override
    public List<AstNode> getChildren() {
        return AstNode.children(statements);
    }
}
