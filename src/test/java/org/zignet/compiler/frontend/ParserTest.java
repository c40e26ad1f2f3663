package org.zignet.compiler.frontend;

import org.zignet.compiler.api.CompilationException;
import org.zignet.compiler.api.SourceInfo;
import org.zignet.compiler.frontend.lexer.Lexer;
import org.zignet.compiler.frontend.lexer.Token;
import org.zignet.compiler.frontend.lexer.TokenType;
import org.zignet.compiler.frontend.parser.Parser;
import org.zignet.compiler.frontend.parser.SyntaxException;
import org.zignet.compiler.frontend.parser.ast.*;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Contains unit tests for the {@link Parser}.
 * These tests verify operator precedence and associativity, the shape of declarations and
 * statements, node positions, and the fail-fast error reporting.
 */
public class ParserTest {

    private static Program parse(String source) throws CompilationException {
        return new Parser(new Lexer(source).scanTokens()).parse();
    }

    private static Expression initializerOf(String source) throws CompilationException {
        Program program = parse(source);
        return ((VariableDeclaration) program.declarations().get(0)).initializer();
    }

    private static List<Statement> bodyOf(String source) throws CompilationException {
        Program program = parse(source);
        return ((FunctionDeclaration) program.declarations().get(0)).body().statements();
    }

    private static void assertNumber(Expression expression, int expected) {
        assertThat(expression).isInstanceOf(NumberLiteral.class);
        assertThat(((NumberLiteral) expression).value()).isEqualByComparingTo(BigDecimal.valueOf(expected));
    }

    @Test
    @Tag("unit")
    void testEmptyInputYieldsEmptyProgram() throws CompilationException {
        assertThat(parse("").declarations()).isEmpty();
        assertThat(parse("  // only a comment\n").declarations()).isEmpty();
    }

    /**
     * Verifies that multiplication binds tighter than addition: {@code 1 + 2 * 3}
     * becomes {@code 1 + (2 * 3)}.
     */
    @Test
    @Tag("unit")
    void testMultiplicationBindsTighterThanAddition() throws CompilationException {
        // Act
        Expression expression = initializerOf("const x = 1 + 2 * 3;");

        // Assert
        assertThat(expression).isInstanceOf(BinaryExpression.class);
        BinaryExpression sum = (BinaryExpression) expression;
        assertThat(sum.operator()).isEqualTo("+");
        assertNumber(sum.left(), 1);
        assertThat(sum.right()).isInstanceOf(BinaryExpression.class);
        BinaryExpression product = (BinaryExpression) sum.right();
        assertThat(product.operator()).isEqualTo("*");
        assertNumber(product.left(), 2);
        assertNumber(product.right(), 3);
    }

    @Test
    @Tag("unit")
    void testSubtractionIsLeftAssociative() throws CompilationException {
        BinaryExpression outer = (BinaryExpression) initializerOf("const x = 1 - 2 - 3;");

        assertThat(outer.left()).isInstanceOf(BinaryExpression.class);
        assertNumber(((BinaryExpression) outer.left()).left(), 1);
        assertNumber(outer.right(), 3);
    }

    /**
     * Verifies that {@code a = b = 1} nests to the right.
     */
    @Test
    @Tag("unit")
    void testAssignmentIsRightAssociative() throws CompilationException {
        // Act
        List<Statement> body = bodyOf("fn f() void { a = b = 1; }");

        // Assert
        Expression expression = ((ExpressionStatement) body.get(0)).expression();
        assertThat(expression).isInstanceOf(AssignmentExpression.class);
        AssignmentExpression outer = (AssignmentExpression) expression;
        assertThat(((Identifier) outer.left()).name()).isEqualTo("a");
        assertThat(outer.right()).isInstanceOf(AssignmentExpression.class);
        AssignmentExpression inner = (AssignmentExpression) outer.right();
        assertThat(((Identifier) inner.left()).name()).isEqualTo("b");
        assertNumber(inner.right(), 1);
    }

    @Test
    @Tag("unit")
    void testLogicalOperatorsAreNormalized() throws CompilationException {
        BinaryExpression or = (BinaryExpression) initializerOf("const b = x && y || !z;");

        assertThat(or.operator()).isEqualTo("or");
        assertThat(((BinaryExpression) or.left()).operator()).isEqualTo("and");
        assertThat(or.right()).isInstanceOf(UnaryExpression.class);
    }

    /**
     * Binary nodes take the position of their left operand, unary nodes that of the operator.
     */
    @Test
    @Tag("unit")
    void testExpressionPositions() throws CompilationException {
        Expression binary = initializerOf("const z = a + b;");
        Expression unary = initializerOf("const y =  -x;");

        assertThat(binary).extracting(Expression::line, Expression::column).containsExactly(1, 11);
        assertThat(unary).extracting(Expression::line, Expression::column).containsExactly(1, 12);
        assertThat(((UnaryExpression) unary).operand().column()).isEqualTo(13);
    }

    @Test
    @Tag("unit")
    void testPostfixChain() throws CompilationException {
        Expression expression = initializerOf("const v = a.b(1, 2)[0];");

        assertThat(expression).isInstanceOf(IndexExpression.class);
        IndexExpression index = (IndexExpression) expression;
        assertNumber(index.index(), 0);
        CallExpression call = (CallExpression) index.object();
        assertThat(call.arguments()).hasSize(2);
        MemberAccessExpression member = (MemberAccessExpression) call.callee();
        assertThat(member.property()).isEqualTo("b");
        assertThat(((Identifier) member.object()).name()).isEqualTo("a");
        assertThat(index.column()).isEqualTo(11);
    }

    @Test
    @Tag("unit")
    void testFunctionDeclaration() throws CompilationException {
        // Act
        Program program = parse("inline fn add(comptime a: i32, b: Point) !i32 { return a; }");

        // Assert
        FunctionDeclaration function = (FunctionDeclaration) program.declarations().get(0);
        assertThat(function.name()).isEqualTo("add");
        assertThat(function.isInline()).isTrue();
        assertThat(function.isComptime()).isFalse();
        assertThat(function.errorUnion()).isTrue();
        assertThat(function.returnType()).isEqualTo(new PrimitiveType("i32", 1, 43));
        assertThat(function).extracting(FunctionDeclaration::line, FunctionDeclaration::column).containsExactly(1, 8);

        assertThat(function.parameters()).hasSize(2);
        Parameter first = function.parameters().get(0);
        assertThat(first.isComptime()).isTrue();
        assertThat(first.name()).isEqualTo("a");
        Parameter second = function.parameters().get(1);
        assertThat(second.typeAnnotation()).isInstanceOf(NamedType.class);
        assertThat(((NamedType) second.typeAnnotation()).name()).isEqualTo("Point");

        assertThat(function.body().statements()).singleElement().isInstanceOf(ReturnStatement.class);
    }

    @Test
    @Tag("unit")
    void testVariableDeclarations() throws CompilationException {
        Program program = parse("var count: u32;\nconst name = \"zig\";");

        VariableDeclaration count = (VariableDeclaration) program.declarations().get(0);
        assertThat(count.isConst()).isFalse();
        assertThat(count.initializer()).isNull();
        assertThat(((PrimitiveType) count.typeAnnotation()).name()).isEqualTo("u32");

        VariableDeclaration name = (VariableDeclaration) program.declarations().get(1);
        assertThat(name.isConst()).isTrue();
        assertThat(name.typeAnnotation()).isNull();
        assertThat(((StringLiteral) name.initializer()).value()).isEqualTo("zig");
        assertThat(name).extracting(VariableDeclaration::line, VariableDeclaration::column).containsExactly(2, 7);
    }

    @Test
    @Tag("unit")
    void testIfElseChainAndWhile() throws CompilationException {
        List<Statement> body = bodyOf(String.join("\n",
                "fn f(x: i32) void {",
                "    if (x > 0) { return; } else if (x < 0) return; else { }",
                "    while (true) { break; }",
                "}"));

        IfStatement ifStatement = (IfStatement) body.get(0);
        assertThat(ifStatement.consequent()).isInstanceOf(BlockStatement.class);
        assertThat(ifStatement.alternate()).isInstanceOf(IfStatement.class);
        IfStatement elseIf = (IfStatement) ifStatement.alternate();
        assertThat(elseIf.consequent()).isInstanceOf(ReturnStatement.class);
        assertThat(elseIf.alternate()).isInstanceOf(BlockStatement.class);

        WhileStatement loop = (WhileStatement) body.get(1);
        assertThat(loop.condition()).isEqualTo(new BooleanLiteral(true, 3, 12));
        assertThat(((BlockStatement) loop.body()).statements()).singleElement().isInstanceOf(BreakStatement.class);
    }

    @Test
    @Tag("unit")
    void testForLoop() throws CompilationException {
        List<Statement> body = bodyOf("fn f() void { for (var i: i32 = 0; i < 10; i += 1) { continue; } for (;;) break; }");

        ForStatement loop = (ForStatement) body.get(0);
        assertThat(loop.initializer()).isInstanceOf(VariableDeclaration.class);
        assertThat(((BinaryExpression) loop.condition()).operator()).isEqualTo("<");
        assertThat(((AssignmentExpression) loop.increment()).operator()).isEqualTo("+=");
        assertThat(((BlockStatement) loop.body()).statements()).singleElement().isInstanceOf(ContinueStatement.class);

        ForStatement endless = (ForStatement) body.get(1);
        assertThat(endless.initializer()).isNull();
        assertThat(endless.condition()).isNull();
        assertThat(endless.increment()).isNull();
        assertThat(endless.body()).isInstanceOf(BreakStatement.class);
    }

    @Test
    @Tag("unit")
    void testComptimeBlockAndNestedBlock() throws CompilationException {
        List<Statement> body = bodyOf("fn f() void { comptime { const a = 1; } { var b = 2; } }");

        assertThat(body.get(0)).isInstanceOf(ComptimeStatement.class);
        assertThat(((ComptimeStatement) body.get(0)).body().statements()).hasSize(1);
        assertThat(body.get(1)).isInstanceOf(BlockStatement.class);
    }

    /**
     * Verifies the top-level container forms {@code const Name = struct|union|enum { ... };}.
     */
    @Test
    @Tag("unit")
    void testContainerDeclarations() throws CompilationException {
        // Act
        Program program = parse(String.join("\n",
                "const Point = struct { x: i32, y: i32, };",
                "const Value = union { int: i64, float: f64 };",
                "const Color = enum { red, green = 2 };"));

        // Assert
        StructDeclaration point = (StructDeclaration) program.declarations().get(0);
        assertThat(point.name()).isEqualTo("Point");
        assertThat(point.fields()).extracting(ContainerField::name).containsExactly("x", "y");
        assertThat(point).extracting(StructDeclaration::line, StructDeclaration::column).containsExactly(1, 7);

        UnionDeclaration value = (UnionDeclaration) program.declarations().get(1);
        assertThat(value.fields()).extracting(ContainerField::name).containsExactly("int", "float");

        EnumDeclaration color = (EnumDeclaration) program.declarations().get(2);
        assertThat(color.members()).extracting(EnumMember::name).containsExactly("red", "green");
        assertThat(color.members().get(0).value()).isNull();
        assertNumber(color.members().get(1).value(), 2);
    }

    @Test
    @Tag("unit")
    void testChildrenFollowSourceOrder() throws CompilationException {
        Program program = parse("fn f(a: i32) i32 { return a; }");

        FunctionDeclaration function = (FunctionDeclaration) program.declarations().get(0);
        assertThat(program.getChildren()).containsExactly(function);
        assertThat(function.getChildren()).hasSize(3);
        assertThat(function.getChildren().get(0)).isInstanceOf(Parameter.class);
        assertThat(function.getChildren().get(1)).isInstanceOf(PrimitiveType.class);
        assertThat(function.getChildren().get(2)).isInstanceOf(BlockStatement.class);
    }

    @Test
    @Tag("unit")
    void testMissingSemicolonAtEndOfInput() {
        assertThatThrownBy(() -> parse("const x = 1"))
                .isInstanceOf(SyntaxException.class)
                .hasMessage("Expected ';' after variable declaration, found end of input at 1:12");
    }

    /**
     * The first defect aborts parsing; the reported position is that of the offending token.
     */
    @Test
    @Tag("unit")
    void testMissingSemicolonBeforeBrace() {
        assertThatThrownBy(() -> parse("fn f() void { return 1 }\nfn g( void {}"))
                .isInstanceOfSatisfying(SyntaxException.class, e -> {
                    assertThat(e.getDetail()).isEqualTo("Expected ';' after return statement, found '}'");
                    assertThat(e.getSourceInfo()).isEqualTo(new SourceInfo(1, 24));
                    assertThat(e.getToken().type()).isEqualTo(TokenType.RIGHT_BRACE);
                });
    }

    @Test
    @Tag("unit")
    void testStatementAtTopLevelIsRejected() {
        assertThatThrownBy(() -> parse("return 1;"))
                .isInstanceOf(SyntaxException.class)
                .hasMessage("Expected declaration, found 'return' at 1:1");
    }

    @Test
    @Tag("unit")
    void testContainerRequiresConst() {
        assertThatThrownBy(() -> parse("var P = struct {};"))
                .isInstanceOf(SyntaxException.class)
                .hasMessage("Expected expression, found 'struct' at 1:9");
    }

    @Test
    @Tag("unit")
    void testMissingExpression() {
        assertThatThrownBy(() -> parse("const x = 1 + ;"))
                .isInstanceOf(SyntaxException.class)
                .hasMessage("Expected expression, found ';' at 1:15");
    }

    @Test
    @Tag("unit")
    void testTokensMustEndWithEndOfFile() {
        List<Token> tokens = List.of(new Token(TokenType.IDENTIFIER, "x", null, 1, 1));

        assertThatThrownBy(() -> new Parser(tokens))
                .isInstanceOf(IllegalArgumentException.class);
    }

    /**
     * Top-level variables accept the {@code comptime} and {@code inline} modifiers; the node
     * position stays on the name.
     */
    @Test
    @Tag("unit")
    void testModifiedTopLevelVariables() throws CompilationException {
        // Act
        Program program = parse("comptime const x = 1;\ninline var y: i32 = 2;");

        // Assert
        VariableDeclaration x = (VariableDeclaration) program.declarations().get(0);
        assertThat(x.isComptime()).isTrue();
        assertThat(x.isInline()).isFalse();
        assertThat(x.isConst()).isTrue();
        assertNumber(x.initializer(), 1);
        assertThat(x).extracting(VariableDeclaration::line, VariableDeclaration::column).containsExactly(1, 16);

        VariableDeclaration y = (VariableDeclaration) program.declarations().get(1);
        assertThat(y.isInline()).isTrue();
        assertThat(y.isComptime()).isFalse();
        assertThat(y.isConst()).isFalse();
        assertThat(((PrimitiveType) y.typeAnnotation()).name()).isEqualTo("i32");
        assertThat(y).extracting(VariableDeclaration::line, VariableDeclaration::column).containsExactly(2, 12);
    }

    @Test
    @Tag("unit")
    void testModifiedContainerIsRejected() {
        assertThatThrownBy(() -> parse("comptime const P = struct {};"))
                .isInstanceOf(SyntaxException.class)
                .hasMessage("Expected expression, found 'struct' at 1:20");
    }
}
