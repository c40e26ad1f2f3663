package org.zignet.compiler.frontend.lexer;

/**
 * Represents a single token extracted from the source code by the {@link Lexer}.
 *
 * @param type The type of the token (e.g., keyword, identifier, number).
 * @param text The exact text of the token from the source code.
 * @param value The processed value of the token: a {@link java.math.BigDecimal} for numbers,
 *              the unescaped content for strings, {@code null} otherwise.
 * @param line The line number where the token was found.
 * @param column The column number where the token begins.
 */
public record Token(
        TokenType type,
        String text,
        Object value,
        int line,
        int column
) {

    /**
     * Describes the token for error messages.
     * @return {@code "end of input"} for the end marker, otherwise the quoted token text.
     */
    public String describe() {
        return type == TokenType.END_OF_FILE ? "end of input" : "'" + text + "'";
    }

    @Override
    public String toString() {
        return String.format("Token(%s, \"%s\", %d:%d)", type, text, line, column);
    }
}
