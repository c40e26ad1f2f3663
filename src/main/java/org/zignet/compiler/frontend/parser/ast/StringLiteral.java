package org.zignet.compiler.frontend.parser.ast;

/**
 * A string literal.
 *
 * @param value The unescaped content, without quotes.
 * @param line The line of the opening quote.
 * @param column The column of the opening quote.
 */
public record StringLiteral(String value, int line, int column) implements Expression {

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitString(this);
    }
}
