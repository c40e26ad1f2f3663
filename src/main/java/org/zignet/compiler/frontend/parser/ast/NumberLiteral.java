package org.zignet.compiler.frontend.parser.ast;

import java.math.BigDecimal;

/**
 * A numeric literal. The value is kept exactly as written.
 *
 * @param value The numeric value.
 * @param line The line of the literal.
 * @param column The column of the literal.
 */
public record NumberLiteral(BigDecimal value, int line, int column) implements Expression {

    /**
     * Checks whether the literal has a non-zero fractional part.
     * @return {@code true} for literals like {@code 1.5}, {@code false} for {@code 1} or {@code 1.0}.
     */
    public boolean isFractional() {
        return value.stripTrailingZeros().scale() > 0;
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitNumber(this);
    }
}
