package org.zignet.compiler.frontend.parser.ast;

/**
 * A reference to a named declaration.
 *
 * @param name The referenced name.
 * @param line The line of the identifier.
 * @param column The column of the identifier.
 */
public record Identifier(String name, int line, int column) implements Expression {

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitIdentifier(this);
    }
}
