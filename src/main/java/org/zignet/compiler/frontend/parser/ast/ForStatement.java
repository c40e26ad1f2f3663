package org.zignet.compiler.frontend.parser.ast;

import java.util.List;

/**
 * A three-clause {@code for} loop. Not produced by the parser.
 *
 * @param initializer A {@link VariableDeclaration} or {@link ExpressionStatement}, or {@code null}.
 * @param condition The loop condition, or {@code null}.
 * @param increment The increment expression, or {@code null}.
 * @param body The loop body.
 * @param line The line of the keyword.
 * @param column The column of the keyword.
 */
public record ForStatement(
        Statement initializer,
        Expression condition,
        Expression increment,
        Statement body,
        int line,
        int column
) implements Statement {

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitFor(this);
    }

    @Override
    public List<AstNode> getChildren() {
        return AstNode.children(initializer, condition, increment, body);
    }
}
