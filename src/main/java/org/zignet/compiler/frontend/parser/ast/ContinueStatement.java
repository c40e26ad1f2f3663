package org.zignet.compiler.frontend.parser.ast;

/**
 * A {@code continue} statement.
 */
public record ContinueStatement(int line, int column) implements Statement {

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitContinue(this);
    }
}
