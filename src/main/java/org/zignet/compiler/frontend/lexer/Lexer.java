package org.zignet.compiler.frontend.lexer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * The Lexer (also known as Tokenizer or Scanner) is responsible for converting
 * a sequence of characters (source code) into a sequence of tokens.
 * <p>
 * Scanning is a single left-to-right pass with one character of lookahead. Whitespace and
 * {@code //} comments are dropped. The first character that cannot start a token aborts the
 * scan with a {@link LexicalException}. An instance is meant for a single call of
 * {@link #scanTokens()} and is not thread-safe.
 */
public class Lexer {

    private static final Logger LOGGER = LoggerFactory.getLogger(Lexer.class);

    private static final Map<String, TokenType> KEYWORDS = Map.ofEntries(
            Map.entry("fn", TokenType.FN),
            Map.entry("const", TokenType.CONST),
            Map.entry("var", TokenType.VAR),
            Map.entry("struct", TokenType.STRUCT),
            Map.entry("union", TokenType.UNION),
            Map.entry("enum", TokenType.ENUM),
            Map.entry("if", TokenType.IF),
            Map.entry("else", TokenType.ELSE),
            Map.entry("while", TokenType.WHILE),
            Map.entry("for", TokenType.FOR),
            Map.entry("break", TokenType.BREAK),
            Map.entry("continue", TokenType.CONTINUE),
            Map.entry("return", TokenType.RETURN),
            Map.entry("comptime", TokenType.COMPTIME),
            Map.entry("inline", TokenType.INLINE),
            Map.entry("and", TokenType.AND),
            Map.entry("or", TokenType.OR),
            Map.entry("true", TokenType.TRUE),
            Map.entry("false", TokenType.FALSE),
            Map.entry("i32", TokenType.I32),
            Map.entry("i64", TokenType.I64),
            Map.entry("u32", TokenType.U32),
            Map.entry("f32", TokenType.F32),
            Map.entry("f64", TokenType.F64),
            Map.entry("bool", TokenType.BOOL),
            Map.entry("void", TokenType.VOID)
    );

    private final String source;
    private final List<Token> tokens = new ArrayList<>();
    private int start = 0;
    private int current = 0;
    private int line = 1;
    private int column = 1;
    private int startLine = 1;
    private int startColumn = 1;

    /**
     * Creates a new Lexer.
     * @param source The source code as a single string.
     */
    public Lexer(String source) {
        this.source = source;
    }

    /**
     * Performs the tokenization of the entire source code.
     * @return A list of the recognized tokens, always terminated by exactly one
     *         {@link TokenType#END_OF_FILE} token.
     * @throws LexicalException at the first character that cannot be tokenized.
     */
    public List<Token> scanTokens() throws LexicalException {
        while (!isAtEnd()) {
            start = current;
            startLine = line;
            startColumn = column;
            scanToken();
        }
        tokens.add(new Token(TokenType.END_OF_FILE, "", null, line, column));
        LOGGER.trace("Scanned {} tokens from {} characters", tokens.size(), source.length());
        return tokens;
    }

    private void scanToken() throws LexicalException {
        char c = advance();
        switch (c) {
            case '(': addToken(TokenType.LEFT_PAREN); break;
            case ')': addToken(TokenType.RIGHT_PAREN); break;
            case '{': addToken(TokenType.LEFT_BRACE); break;
            case '}': addToken(TokenType.RIGHT_BRACE); break;
            case '[': addToken(TokenType.LEFT_BRACKET); break;
            case ']': addToken(TokenType.RIGHT_BRACKET); break;
            case ':': addToken(TokenType.COLON); break;
            case ';': addToken(TokenType.SEMICOLON); break;
            case ',': addToken(TokenType.COMMA); break;
            case '.': addToken(TokenType.DOT); break;
            case '-': addToken(TokenType.MINUS); break;
            case '*': addToken(TokenType.STAR); break;
            case '%': addToken(TokenType.PERCENT); break;
            case '+': addToken(match('=') ? TokenType.PLUS_EQUAL : TokenType.PLUS); break;
            case '=': addToken(match('=') ? TokenType.EQUAL_EQUAL : TokenType.EQUAL); break;
            case '!': addToken(match('=') ? TokenType.BANG_EQUAL : TokenType.BANG); break;
            case '<': addToken(match('=') ? TokenType.LESS_EQUAL : TokenType.LESS); break;
            case '>': addToken(match('=') ? TokenType.GREATER_EQUAL : TokenType.GREATER); break;
            case '&':
                if (!match('&')) throw unexpected(c);
                addToken(TokenType.AND);
                break;
            case '|':
                if (!match('|')) throw unexpected(c);
                addToken(TokenType.OR);
                break;
            case '/':
                if (match('/')) {
                    // A comment goes until the end of the line.
                    while (peek() != '\n' && !isAtEnd()) advance();
                } else {
                    addToken(TokenType.SLASH);
                }
                break;
            case '"', '\'':
                string(c);
                break;
            // Ignore whitespace
            case ' ', '\r', '\t', '\n', '\f':
                break;
            default:
                if (isWhitespace(c)) {
                    break;
                }
                if (isDigit(c)) {
                    number();
                } else if (isAlpha(c)) {
                    identifier();
                } else {
                    throw unexpected(c);
                }
                break;
        }
    }

    private void identifier() {
        while (isAlphaNumeric(peek())) advance();
        String text = source.substring(start, current);
        addToken(KEYWORDS.getOrDefault(text, TokenType.IDENTIFIER));
    }

    private void number() {
        while (isDigit(peek())) advance();
        if (peek() == '.' && isDigit(peekNext())) {
            advance(); // consume the '.'
            while (isDigit(peek())) advance();
        }
        addToken(TokenType.NUMBER, new BigDecimal(source.substring(start, current)));
    }

    private void string(char quote) throws LexicalException {
        StringBuilder value = new StringBuilder();
        while (peek() != quote && !isAtEnd()) {
            char c = advance();
            if (c == '\\' && !isAtEnd()) {
                value.append(unescape(advance()));
            } else {
                value.append(c);
            }
        }

        if (isAtEnd()) {
            throw new LexicalException("Unterminated string", startLine, startColumn);
        }

        // The closing quote
        advance();
        addToken(TokenType.STRING, value.toString());
    }

    private static char unescape(char c) {
        return switch (c) {
            case 'n' -> '\n';
            case 't' -> '\t';
            case 'r' -> '\r';
            default -> c;
        };
    }

    /**
     * Unicode whitespace including the no-break space, plus a byte order mark.
     */
    private static boolean isWhitespace(char c) {
        return Character.isWhitespace(c) || c == '\u00A0' || c == '\uFEFF';
    }

    private LexicalException unexpected(char c) {
        return new LexicalException("Unexpected character '" + c + "'", startLine, startColumn);
    }

    private char advance() {
        char c = source.charAt(current++);
        if (c == '\n') {
            line++;
            column = 1;
        } else {
            column++;
        }
        return c;
    }

    private boolean match(char expected) {
        if (isAtEnd() || source.charAt(current) != expected) return false;
        advance();
        return true;
    }

    private void addToken(TokenType type) {
        addToken(type, null);
    }

    private void addToken(TokenType type, Object literal) {
        String text = source.substring(start, current);
        tokens.add(new Token(type, text, literal, startLine, startColumn));
    }

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private char peek() {
        if (isAtEnd()) return '\0';
        return source.charAt(current);
    }

    private char peekNext() {
        if (current + 1 >= source.length()) return '\0';
        return source.charAt(current + 1);
    }

    private boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z') ||
                (c >= 'A' && c <= 'Z') ||
                c == '_';
    }

    private boolean isAlphaNumeric(char c) {
        return isAlpha(c) || isDigit(c);
    }
}
