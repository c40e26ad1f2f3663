package org.zignet.compiler.frontend.lexer;

/**
 * Defines the different types of tokens that the {@link Lexer} can recognize.
 */
public enum TokenType {
    // Keywords.
    FN, CONST, VAR, STRUCT, UNION, ENUM,
    IF, ELSE, WHILE, FOR, BREAK, CONTINUE, RETURN,
    COMPTIME, INLINE,
    /** The logical conjunction {@code and} (also spelled {@code &&}). */
    AND,
    /** The logical disjunction {@code or} (also spelled {@code ||}). */
    OR,

    // Primitive type keywords.
    I32, I64, U32, F32, F64, BOOL, VOID,

    // Literals.
    /** An identifier, such as a variable or function name. */
    IDENTIFIER,
    /** A numeric literal. */
    NUMBER,
    /** A string literal. */
    STRING,
    /** The boolean literal {@code true}. */
    TRUE,
    /** The boolean literal {@code false}. */
    FALSE,

    // Operators.
    PLUS, MINUS, STAR, SLASH, PERCENT,
    EQUAL_EQUAL, BANG_EQUAL, LESS, GREATER, LESS_EQUAL, GREATER_EQUAL,
    EQUAL, PLUS_EQUAL, BANG,

    // Punctuation.
    LEFT_PAREN, RIGHT_PAREN, LEFT_BRACE, RIGHT_BRACE, LEFT_BRACKET, RIGHT_BRACKET,
    COLON, SEMICOLON, COMMA, DOT,

    /** Represents the end of the source text. */
    END_OF_FILE;

    /**
     * Checks whether this token type names one of the primitive types.
     * @return {@code true} for {@code i32}, {@code i64}, {@code u32}, {@code f32}, {@code f64}, {@code bool} and {@code void}.
     */
    public boolean isPrimitiveType() {
        return switch (this) {
            case I32, I64, U32, F32, F64, BOOL, VOID -> true;
            default -> false;
        };
    }
}
