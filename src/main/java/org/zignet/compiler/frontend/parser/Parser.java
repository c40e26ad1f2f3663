package org.zignet.compiler.frontend.parser;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.zignet.compiler.frontend.lexer.Token;
import org.zignet.compiler.frontend.lexer.TokenType;
import org.zignet.compiler.frontend.parser.ast.*;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * The parser for the language. It consumes a list of tokens from the
 * {@link org.zignet.compiler.frontend.lexer.Lexer} and produces an Abstract Syntax Tree (AST).
 * <p>
 * Recursive descent with one token of lookahead and no backtracking. Expressions are parsed
 * with one method per {@link Precedence} tier. The parser is fail-fast: the first unmet
 * expectation throws a {@link SyntaxException} and the whole unit is abandoned.
 * An instance is meant for a single call of {@link #parse()} and is not thread-safe.
 */
public class Parser {

    private static final Logger LOGGER = LoggerFactory.getLogger(Parser.class);

    private final List<Token> tokens;
    private int current = 0;

    /**
     * Constructs a new Parser.
     * @param tokens The list of tokens to parse, terminated by an end-of-file token.
     */
    public Parser(List<Token> tokens) {
        if (tokens.isEmpty() || tokens.get(tokens.size() - 1).type() != TokenType.END_OF_FILE) {
            throw new IllegalArgumentException("Token list must end with an END_OF_FILE token.");
        }
        this.tokens = tokens;
    }

    /**
     * Parses the entire token stream.
     * @return The program; empty input yields a program without declarations.
     * @throws SyntaxException at the first token that does not fit the grammar.
     */
    public Program parse() throws SyntaxException {
        List<Declaration> declarations = new ArrayList<>();
        while (!isAtEnd()) {
            declarations.add(declaration());
        }
        LOGGER.debug("Parsed {} top-level declarations from {} tokens", declarations.size(), tokens.size());
        return new Program(declarations);
    }

    // ---- declarations ----

    private Declaration declaration() throws SyntaxException {
        boolean isInline = match(TokenType.INLINE);
        boolean isComptime = match(TokenType.COMPTIME);

        if (check(TokenType.FN)) {
            return functionDeclaration(isInline, isComptime);
        }
        if (check(TokenType.CONST) || check(TokenType.VAR)) {
            // Containers cannot carry modifiers.
            return isInline || isComptime ? modifiedVariable(isInline, isComptime) : topLevelBinding();
        }
        throw error("Expected declaration");
    }

    private FunctionDeclaration functionDeclaration(boolean isInline, boolean isComptime) throws SyntaxException {
        Token fn = consume(TokenType.FN, "Expected 'fn'");
        Token name = consume(TokenType.IDENTIFIER, "Expected function name");

        consume(TokenType.LEFT_PAREN, "Expected '(' after function name");
        List<Parameter> parameters = parameters();
        consume(TokenType.RIGHT_PAREN, "Expected ')' after parameters");

        boolean errorUnion = match(TokenType.BANG);
        TypeAnnotation returnType = typeAnnotation();
        BlockStatement body = block();

        return new FunctionDeclaration(name.text(), parameters, returnType, body,
                isInline, isComptime, errorUnion, fn.line(), fn.column());
    }

    private List<Parameter> parameters() throws SyntaxException {
        List<Parameter> parameters = new ArrayList<>();
        if (check(TokenType.RIGHT_PAREN)) {
            return parameters;
        }
        do {
            boolean isComptime = match(TokenType.COMPTIME);
            Token name = consume(TokenType.IDENTIFIER, "Expected parameter name");
            consume(TokenType.COLON, "Expected ':' after parameter name");
            parameters.add(new Parameter(name.text(), typeAnnotation(), isComptime, name.line(), name.column()));
        } while (match(TokenType.COMMA));
        return parameters;
    }

    /**
     * The head shared by variable and container declarations: {@code const|var name [: type]}.
     */
    private record BindingHead(boolean isConst, Token name, TypeAnnotation type) {}

    private BindingHead bindingHead() throws SyntaxException {
        boolean isConst = match(TokenType.CONST);
        if (!isConst) {
            consume(TokenType.VAR, "Expected 'const' or 'var'");
        }
        Token name = consume(TokenType.IDENTIFIER, "Expected variable name");
        TypeAnnotation type = match(TokenType.COLON) ? typeAnnotation() : null;
        return new BindingHead(isConst, name, type);
    }

    private Declaration topLevelBinding() throws SyntaxException {
        BindingHead head = bindingHead();
        if (!match(TokenType.EQUAL)) {
            return finishVariable(head, null);
        }
        if (head.isConst() && head.type() == null
                && (check(TokenType.STRUCT) || check(TokenType.UNION) || check(TokenType.ENUM))) {
            return containerDeclaration(head.name());
        }
        return finishVariable(head, expression());
    }

    private VariableDeclaration variableDeclaration() throws SyntaxException {
        BindingHead head = bindingHead();
        Expression initializer = match(TokenType.EQUAL) ? expression() : null;
        return finishVariable(head, initializer);
    }

    private VariableDeclaration modifiedVariable(boolean isInline, boolean isComptime) throws SyntaxException {
        VariableDeclaration plain = variableDeclaration();
        return new VariableDeclaration(isInline, isComptime, plain.isConst(), plain.name(), plain.typeAnnotation(),
                plain.initializer(), plain.line(), plain.column());
    }

    private VariableDeclaration finishVariable(BindingHead head, Expression initializer) throws SyntaxException {
        consume(TokenType.SEMICOLON, "Expected ';' after variable declaration");
        Token name = head.name();
        return new VariableDeclaration(head.isConst(), name.text(), head.type(), initializer, name.line(), name.column());
    }

    private Declaration containerDeclaration(Token name) throws SyntaxException {
        Token keyword = advance();
        consume(TokenType.LEFT_BRACE, "Expected '{' after '" + keyword.text() + "'");
        Declaration container = switch (keyword.type()) {
            case ENUM -> new EnumDeclaration(name.text(), enumMembers(), name.line(), name.column());
            case UNION -> new UnionDeclaration(name.text(), containerFields(), name.line(), name.column());
            default -> new StructDeclaration(name.text(), containerFields(), name.line(), name.column());
        };
        consume(TokenType.RIGHT_BRACE, "Expected '}' after " + keyword.text() + " members");
        consume(TokenType.SEMICOLON, "Expected ';' after " + keyword.text() + " declaration");
        return container;
    }

    private List<ContainerField> containerFields() throws SyntaxException {
        List<ContainerField> fields = new ArrayList<>();
        while (!check(TokenType.RIGHT_BRACE) && !isAtEnd()) {
            Token name = consume(TokenType.IDENTIFIER, "Expected field name");
            consume(TokenType.COLON, "Expected ':' after field name");
            fields.add(new ContainerField(name.text(), typeAnnotation(), name.line(), name.column()));
            if (!match(TokenType.COMMA)) break;
        }
        return fields;
    }

    private List<EnumMember> enumMembers() throws SyntaxException {
        List<EnumMember> members = new ArrayList<>();
        while (!check(TokenType.RIGHT_BRACE) && !isAtEnd()) {
            Token name = consume(TokenType.IDENTIFIER, "Expected enum member name");
            Expression value = match(TokenType.EQUAL) ? expression() : null;
            members.add(new EnumMember(name.text(), value, name.line(), name.column()));
            if (!match(TokenType.COMMA)) break;
        }
        return members;
    }

    private TypeAnnotation typeAnnotation() throws SyntaxException {
        Token token = peek();
        if (token.type().isPrimitiveType()) {
            advance();
            return new PrimitiveType(token.text(), token.line(), token.column());
        }
        if (match(TokenType.IDENTIFIER)) {
            return new NamedType(token.text(), token.line(), token.column());
        }
        throw error("Expected type annotation");
    }

    // ---- statements ----

    private BlockStatement block() throws SyntaxException {
        Token brace = consume(TokenType.LEFT_BRACE, "Expected '{'");
        List<Statement> statements = new ArrayList<>();
        while (!check(TokenType.RIGHT_BRACE) && !isAtEnd()) {
            statements.add(statement());
        }
        consume(TokenType.RIGHT_BRACE, "Expected '}'");
        return new BlockStatement(statements, brace.line(), brace.column());
    }

    private Statement statement() throws SyntaxException {
        if (check(TokenType.RETURN)) return returnStatement();
        if (check(TokenType.IF)) return ifStatement();
        if (check(TokenType.WHILE)) return whileStatement();
        if (check(TokenType.FOR)) return forStatement();
        if (match(TokenType.BREAK)) {
            Token keyword = previous();
            consume(TokenType.SEMICOLON, "Expected ';' after 'break'");
            return new BreakStatement(keyword.line(), keyword.column());
        }
        if (match(TokenType.CONTINUE)) {
            Token keyword = previous();
            consume(TokenType.SEMICOLON, "Expected ';' after 'continue'");
            return new ContinueStatement(keyword.line(), keyword.column());
        }
        if (match(TokenType.COMPTIME)) {
            Token keyword = previous();
            return new ComptimeStatement(block(), keyword.line(), keyword.column());
        }
        if (check(TokenType.CONST) || check(TokenType.VAR)) return variableDeclaration();
        if (check(TokenType.LEFT_BRACE)) return block();
        return expressionStatement();
    }

    private ReturnStatement returnStatement() throws SyntaxException {
        Token keyword = consume(TokenType.RETURN, "Expected 'return'");
        Expression value = check(TokenType.SEMICOLON) ? null : expression();
        consume(TokenType.SEMICOLON, "Expected ';' after return statement");
        return new ReturnStatement(value, keyword.line(), keyword.column());
    }

    private IfStatement ifStatement() throws SyntaxException {
        Token keyword = consume(TokenType.IF, "Expected 'if'");
        consume(TokenType.LEFT_PAREN, "Expected '(' after 'if'");
        Expression condition = expression();
        consume(TokenType.RIGHT_PAREN, "Expected ')' after condition");

        Statement consequent = statement();
        Statement alternate = match(TokenType.ELSE) ? statement() : null;
        return new IfStatement(condition, consequent, alternate, keyword.line(), keyword.column());
    }

    private WhileStatement whileStatement() throws SyntaxException {
        Token keyword = consume(TokenType.WHILE, "Expected 'while'");
        consume(TokenType.LEFT_PAREN, "Expected '(' after 'while'");
        Expression condition = expression();
        consume(TokenType.RIGHT_PAREN, "Expected ')' after condition");
        return new WhileStatement(condition, statement(), keyword.line(), keyword.column());
    }

    private ForStatement forStatement() throws SyntaxException {
        Token keyword = consume(TokenType.FOR, "Expected 'for'");
        consume(TokenType.LEFT_PAREN, "Expected '(' after 'for'");

        Statement initializer;
        if (match(TokenType.SEMICOLON)) {
            initializer = null;
        } else if (check(TokenType.CONST) || check(TokenType.VAR)) {
            initializer = variableDeclaration();
        } else {
            initializer = expressionStatement();
        }

        Expression condition = check(TokenType.SEMICOLON) ? null : expression();
        consume(TokenType.SEMICOLON, "Expected ';' after loop condition");
        Expression increment = check(TokenType.RIGHT_PAREN) ? null : expression();
        consume(TokenType.RIGHT_PAREN, "Expected ')' after for clauses");

        return new ForStatement(initializer, condition, increment, statement(), keyword.line(), keyword.column());
    }

    private ExpressionStatement expressionStatement() throws SyntaxException {
        Expression expression = expression();
        consume(TokenType.SEMICOLON, "Expected ';' after expression");
        return new ExpressionStatement(expression, expression.line(), expression.column());
    }

    // ---- expressions ----

    /**
     * One tier of the expression grammar.
     */
    @FunctionalInterface
    private interface Tier {
        Expression parse() throws SyntaxException;
    }

    private Expression expression() throws SyntaxException {
        return assignment();
    }

    private Expression assignment() throws SyntaxException {
        Expression target = logicalOr();
        if (match(Precedence.ASSIGNMENT.operators())) {
            String operator = Precedence.spelling(previous().type());
            Expression value = assignment();
            return new AssignmentExpression(operator, target, value, target.line(), target.column());
        }
        return target;
    }

    private Expression logicalOr() throws SyntaxException {
        return leftAssociative(Precedence.LOGICAL_OR, this::logicalAnd);
    }

    private Expression logicalAnd() throws SyntaxException {
        return leftAssociative(Precedence.LOGICAL_AND, this::equality);
    }

    private Expression equality() throws SyntaxException {
        return leftAssociative(Precedence.EQUALITY, this::relational);
    }

    private Expression relational() throws SyntaxException {
        return leftAssociative(Precedence.RELATIONAL, this::additive);
    }

    private Expression additive() throws SyntaxException {
        return leftAssociative(Precedence.ADDITIVE, this::multiplicative);
    }

    private Expression multiplicative() throws SyntaxException {
        return leftAssociative(Precedence.MULTIPLICATIVE, this::unary);
    }

    private Expression leftAssociative(Precedence tier, Tier operand) throws SyntaxException {
        Expression left = operand.parse();
        while (match(tier.operators())) {
            String operator = Precedence.spelling(previous().type());
            Expression right = operand.parse();
            left = new BinaryExpression(operator, left, right, left.line(), left.column());
        }
        return left;
    }

    private Expression unary() throws SyntaxException {
        if (match(Precedence.UNARY.operators())) {
            Token operator = previous();
            Expression operand = unary();
            return new UnaryExpression(Precedence.spelling(operator.type()), operand, operator.line(), operator.column());
        }
        return postfix();
    }

    private Expression postfix() throws SyntaxException {
        Expression expression = primary();
        while (true) {
            if (match(TokenType.LEFT_PAREN)) {
                List<Expression> arguments = new ArrayList<>();
                if (!check(TokenType.RIGHT_PAREN)) {
                    do {
                        arguments.add(expression());
                    } while (match(TokenType.COMMA));
                }
                consume(TokenType.RIGHT_PAREN, "Expected ')' after arguments");
                expression = new CallExpression(expression, arguments, expression.line(), expression.column());
            } else if (match(TokenType.DOT)) {
                Token property = consume(TokenType.IDENTIFIER, "Expected property name");
                expression = new MemberAccessExpression(expression, property.text(), expression.line(), expression.column());
            } else if (match(TokenType.LEFT_BRACKET)) {
                Expression index = expression();
                consume(TokenType.RIGHT_BRACKET, "Expected ']' after index");
                expression = new IndexExpression(expression, index, expression.line(), expression.column());
            } else {
                return expression;
            }
        }
    }

    private Expression primary() throws SyntaxException {
        Token token = peek();
        if (match(TokenType.NUMBER)) {
            return new NumberLiteral((BigDecimal) token.value(), token.line(), token.column());
        }
        if (match(TokenType.STRING)) {
            return new StringLiteral((String) token.value(), token.line(), token.column());
        }
        if (match(TokenType.TRUE, TokenType.FALSE)) {
            return new BooleanLiteral(token.type() == TokenType.TRUE, token.line(), token.column());
        }
        if (match(TokenType.IDENTIFIER)) {
            return new Identifier(token.text(), token.line(), token.column());
        }
        if (match(TokenType.LEFT_PAREN)) {
            Expression inner = expression();
            consume(TokenType.RIGHT_PAREN, "Expected ')' after expression");
            return inner;
        }
        throw error("Expected expression");
    }

    // ---- token cursor ----

    private boolean match(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) {
                advance();
                return true;
            }
        }
        return false;
    }

    private boolean check(TokenType type) {
        if (isAtEnd()) return false;
        return peek().type() == type;
    }

    private Token advance() {
        if (!isAtEnd()) current++;
        return previous();
    }

    private boolean isAtEnd() {
        return peek().type() == TokenType.END_OF_FILE;
    }

    private Token peek() {
        return tokens.get(current);
    }

    private Token previous() {
        return tokens.get(current - 1);
    }

    private Token consume(TokenType type, String errorMessage) throws SyntaxException {
        if (check(type)) return advance();
        throw error(errorMessage);
    }

    private SyntaxException error(String message) {
        return new SyntaxException(message, peek());
    }
}
