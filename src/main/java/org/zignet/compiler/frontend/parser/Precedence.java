package org.zignet.compiler.frontend.parser;

import org.zignet.compiler.frontend.lexer.TokenType;

import java.util.EnumMap;
import java.util.Map;

/**
 * The expression tiers of the grammar, from the loosest to the tightest binding.
 * <p>
 * The {@link Parser} has one method per tier and asks this table which operators a tier
 * folds. The code generator uses the same order to decide where parentheses are required.
 */
public enum Precedence {
    ASSIGNMENT(TokenType.EQUAL, TokenType.PLUS_EQUAL),
    LOGICAL_OR(TokenType.OR),
    LOGICAL_AND(TokenType.AND),
    EQUALITY(TokenType.EQUAL_EQUAL, TokenType.BANG_EQUAL),
    RELATIONAL(TokenType.LESS, TokenType.GREATER, TokenType.LESS_EQUAL, TokenType.GREATER_EQUAL),
    ADDITIVE(TokenType.PLUS, TokenType.MINUS),
    MULTIPLICATIVE(TokenType.STAR, TokenType.SLASH, TokenType.PERCENT),
    UNARY(TokenType.MINUS, TokenType.BANG),
    POSTFIX(TokenType.LEFT_PAREN, TokenType.DOT, TokenType.LEFT_BRACKET),
    PRIMARY;

    private static final Map<TokenType, String> SPELLINGS = new EnumMap<>(TokenType.class);

    static {
        SPELLINGS.put(TokenType.EQUAL, "=");
        SPELLINGS.put(TokenType.PLUS_EQUAL, "+=");
        SPELLINGS.put(TokenType.OR, "or");
        SPELLINGS.put(TokenType.AND, "and");
        SPELLINGS.put(TokenType.EQUAL_EQUAL, "==");
        SPELLINGS.put(TokenType.BANG_EQUAL, "!=");
        SPELLINGS.put(TokenType.LESS, "<");
        SPELLINGS.put(TokenType.GREATER, ">");
        SPELLINGS.put(TokenType.LESS_EQUAL, "<=");
        SPELLINGS.put(TokenType.GREATER_EQUAL, ">=");
        SPELLINGS.put(TokenType.PLUS, "+");
        SPELLINGS.put(TokenType.MINUS, "-");
        SPELLINGS.put(TokenType.STAR, "*");
        SPELLINGS.put(TokenType.SLASH, "/");
        SPELLINGS.put(TokenType.PERCENT, "%");
        SPELLINGS.put(TokenType.BANG, "!");
    }

    private final TokenType[] operators;

    Precedence(TokenType... operators) {
        this.operators = operators;
    }

    /**
     * @return The token types this tier folds into a node.
     */
    public TokenType[] operators() {
        return operators.clone();
    }

    /**
     * Checks whether this tier binds strictly tighter than another tier.
     * @param other The tier to compare with.
     * @return {@code true} if this tier is evaluated before {@code other}.
     */
    public boolean bindsTighterThan(Precedence other) {
        return ordinal() > other.ordinal();
    }

    /**
     * Returns the canonical spelling stored in the tree for an operator token.
     * {@code &&} and {@code ||} are normalized to {@code and} and {@code or}.
     *
     * @param type An operator token type.
     * @return The canonical operator text.
     */
    public static String spelling(TokenType type) {
        String spelling = SPELLINGS.get(type);
        if (spelling == null) {
            throw new IllegalArgumentException("Not an operator: " + type);
        }
        return spelling;
    }

    /**
     * Finds the tier of a binary or assignment operator by its canonical spelling.
     *
     * @param operator The operator as stored in the tree.
     * @return The tier that produces this operator.
     */
    public static Precedence ofBinaryOperator(String operator) {
        for (Precedence precedence : values()) {
            if (precedence == UNARY || precedence == POSTFIX) {
                continue;
            }
            for (TokenType type : precedence.operators) {
                if (SPELLINGS.get(type).equals(operator)) {
                    return precedence;
                }
            }
        }
        throw new IllegalArgumentException("Unknown binary operator: " + operator);
    }
}
