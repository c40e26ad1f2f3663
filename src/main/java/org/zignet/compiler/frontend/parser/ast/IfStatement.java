package org.zignet.compiler.frontend.parser.ast;

import java.util.List;

/**
 * An {@code if} statement. An {@code else if} chain is an {@code IfStatement} whose
 * alternate is another {@code IfStatement}.
 *
 * @param condition The condition.
 * @param consequent The statement executed when the condition holds.
 * @param alternate The {@code else} branch, or {@code null}.
 * @param line The line of the keyword.
 * @param column The column of the keyword.
 */
public record IfStatement(
        Expression condition,
        Statement consequent,
        Statement alternate,
        int line,
        int column
) implements Statement {

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitIf(this);
    }

    @Override
    public List<AstNode> getChildren() {
        return AstNode.children(condition, consequent, alternate);
    }
}
