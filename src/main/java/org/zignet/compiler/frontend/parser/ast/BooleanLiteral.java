package org.zignet.compiler.frontend.parser.ast;

/**
 * {@code true} or {@code false}.
 */
public record BooleanLiteral(boolean value, int line, int column) implements Expression {

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitBoolean(this);
    }
}
