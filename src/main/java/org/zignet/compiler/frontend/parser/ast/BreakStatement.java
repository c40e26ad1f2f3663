package org.zignet.compiler.frontend.parser.ast;

/**
 * A {@code break} statement.
 */
public record BreakStatement(int line, int column) implements Statement {

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitBreak(this);
    }
}
