package org.zignet.compiler.backend;

import org.zignet.compiler.api.CompilationException;
import org.zignet.compiler.backend.emit.CodeGenOptions;
import org.zignet.compiler.backend.emit.CodeGenerator;
import org.zignet.compiler.frontend.lexer.Lexer;
import org.zignet.compiler.frontend.parser.Parser;
import org.zignet.compiler.frontend.parser.ast.*;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.math.BigDecimal;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contains unit tests for the {@link CodeGenerator}.
 * These tests verify the canonical layout, the minimal parenthesization of expressions
 * and the effect of the layout options.
 */
public class CodeGeneratorTest {

    private static Program parse(String source) throws CompilationException {
        return new Parser(new Lexer(source).scanTokens()).parse();
    }

    private static String format(String source) throws CompilationException {
        return new CodeGenerator().generate(parse(source));
    }

    private static String format(String source, CodeGenOptions options) throws CompilationException {
        return new CodeGenerator(options).generate(parse(source));
    }

    private static String lines(String... lines) {
        return String.join("\n", lines) + "\n";
    }

    /**
     * Formats an expression through a constant initializer and returns only the expression text.
     */
    private static String formatExpression(String expression) throws CompilationException {
        String output = format("const v = " + expression + ";");
        return output.substring("const v = ".length(), output.length() - ";\n".length());
    }

    /**
     * Verifies that compact source is laid out with one declaration per paragraph
     * and four-space indentation.
     */
    @Test
    @Tag("unit")
    void testCanonicalLayout() throws CompilationException {
        // Arrange
        String source = "const Point=struct{x:i32,y:i32};fn add(a:i32,b:i32) i32{return a+b;}const x:i32=add(1,2);";

        // Act
        String output = format(source);

        // Assert
        assertThat(output).isEqualTo(lines(
                "const Point = struct {",
                "    x: i32,",
                "    y: i32,",
                "};",
                "",
                "fn add(a: i32, b: i32) i32 {",
                "    return a + b;",
                "}",
                "",
                "const x: i32 = add(1, 2);"));
    }

    @Test
    @Tag("unit")
    void testEmptyProgramYieldsEmptyOutput() throws CompilationException {
        assertThat(format("// nothing here\n")).isEmpty();
    }

    @Test
    @Tag("unit")
    void testEmptyFunctionBody() throws CompilationException {
        assertThat(format("fn f() void {}")).isEqualTo(lines("fn f() void {", "}"));
    }

    @Test
    @Tag("unit")
    void testIfElseChainIsCuddled() throws CompilationException {
        String output = format("fn f(a: i32) void { if (a > 0) { a = 1; } else if (a < 0) { a = 2; } else { a = 3; } }");

        assertThat(output).isEqualTo(lines(
                "fn f(a: i32) void {",
                "    if (a > 0) {",
                "        a = 1;",
                "    } else if (a < 0) {",
                "        a = 2;",
                "    } else {",
                "        a = 3;",
                "    }",
                "}"));
    }

    @Test
    @Tag("unit")
    void testNonBlockBodiesAreIndented() throws CompilationException {
        String output = format("fn f(a: bool) void { if (a) return; else return; while (a) break; }");

        assertThat(output).isEqualTo(lines(
                "fn f(a: bool) void {",
                "    if (a)",
                "        return;",
                "    else",
                "        return;",
                "    while (a)",
                "        break;",
                "}"));
    }

    @Test
    @Tag("unit")
    void testForLoopLayout() throws CompilationException {
        String output = format("fn f() void { for (var i: i32 = 0; i < 10; i += 1) { continue; } for (;;) break; }");

        assertThat(output).isEqualTo(lines(
                "fn f() void {",
                "    for (var i: i32 = 0; i < 10; i += 1) {",
                "        continue;",
                "    }",
                "    for (;;)",
                "        break;",
                "}"));
    }

    @Test
    @Tag("unit")
    void testModifiersComptimeBlockAndNestedBlock() throws CompilationException {
        String output = format("inline comptime fn f(comptime n: i32) !void { comptime { const a = 1; } { var b = n; } }");

        assertThat(output).isEqualTo(lines(
                "inline comptime fn f(comptime n: i32) !void {",
                "    comptime {",
                "        const a = 1;",
                "    }",
                "    {",
                "        var b = n;",
                "    }",
                "}"));
    }

    @Test
    @Tag("unit")
    void testEnumAndUnionLayout() throws CompilationException {
        String output = format("const Color = enum { red, green = 2 }; const V = union { a: i64 };");

        assertThat(output).isEqualTo(lines(
                "const Color = enum {",
                "    red,",
                "    green = 2,",
                "};",
                "",
                "const V = union {",
                "    a: i64,",
                "};"));
    }

    /**
     * Parentheses are kept only where dropping them would change the tree.
     */
    @Test
    @Tag("unit")
    void testMinimalParentheses() throws CompilationException {
        assertThat(formatExpression("(1 + 2) * 3")).isEqualTo("(1 + 2) * 3");
        assertThat(formatExpression("1 + (2 * 3)")).isEqualTo("1 + 2 * 3");
        assertThat(formatExpression("1 - (2 - 3)")).isEqualTo("1 - (2 - 3)");
        assertThat(formatExpression("(1 - 2) - 3")).isEqualTo("1 - 2 - 3");
        assertThat(formatExpression("((a))")).isEqualTo("a");
        assertThat(formatExpression("-(a + b)")).isEqualTo("-(a + b)");
        assertThat(formatExpression("!(a == b)")).isEqualTo("!(a == b)");
        assertThat(formatExpression("(a or b) and c")).isEqualTo("(a or b) and c");
        assertThat(formatExpression("a || b && c")).isEqualTo("a or b and c");
        assertThat(formatExpression("(-a).b")).isEqualTo("(-a).b");
        assertThat(formatExpression("(a.b)(1)[2]")).isEqualTo("a.b(1)[2]");
        assertThat(formatExpression("(a = b) + 1")).isEqualTo("(a = b) + 1");
    }

    @Test
    @Tag("unit")
    void testAssignmentChainNeedsNoParentheses() throws CompilationException {
        String output = format("fn f() void { a = (b = 1); c += 2; }");

        assertThat(output).isEqualTo(lines(
                "fn f() void {",
                "    a = b = 1;",
                "    c += 2;",
                "}"));
    }

    @Test
    @Tag("unit")
    void testLiteralsAreNormalized() throws CompilationException {
        assertThat(formatExpression("'hi\\n'")).isEqualTo("\"hi\\n\"");
        assertThat(formatExpression("\"say \\\"x\\\"\\t\"")).isEqualTo("\"say \\\"x\\\"\\t\"");
        assertThat(formatExpression("1.50")).isEqualTo("1.5");
        assertThat(formatExpression("2.0")).isEqualTo("2");
        assertThat(formatExpression("100")).isEqualTo("100");
        assertThat(formatExpression("true")).isEqualTo("true");
    }

    @Test
    @Tag("unit")
    void testLiteralsAndTypesWithoutSurfaceSyntax() {
        // Arrange
        NamedType point = new NamedType("Point", 1, 1);
        VariableDeclaration structValue = new VariableDeclaration(true, "p", new PointerType(point, 1, 1),
                new StructLiteral("Point", List.of(
                        new StructLiteralField("x", number(1), 1, 1),
                        new StructLiteralField("y", number(2), 1, 1)), 1, 1), 1, 1);
        VariableDeclaration emptyStruct = new VariableDeclaration(true, "o", point,
                new StructLiteral("Point", List.of(), 1, 1), 1, 1);
        VariableDeclaration array = new VariableDeclaration(false, "xs",
                new ArrayType(3, new PrimitiveType("i32", 1, 1), 1, 1),
                new ArrayLiteral(List.of(number(1), number(2), number(3)), 1, 1), 1, 1);
        VariableDeclaration emptyArray = new VariableDeclaration(false, "e",
                new OptionalType(new ArrayType(null, new PrimitiveType("u8", 1, 1), 1, 1), 1, 1),
                new ArrayLiteral(List.of(), 1, 1), 1, 1);
        VariableDeclaration errorUnion = new VariableDeclaration(false, "r",
                new ErrorUnionType(new PrimitiveType("i32", 1, 1), 1, 1), null, 1, 1);

        // Act
        String output = new CodeGenerator().generate(
                new Program(List.of(structValue, emptyStruct, array, emptyArray, errorUnion)));

        // Assert
        assertThat(output).isEqualTo(lines(
                "const p: *Point = Point{ .x = 1, .y = 2 };",
                "",
                "const o: Point = Point{};",
                "",
                "var xs: [3]i32 = [_]{ 1, 2, 3 };",
                "",
                "var e: ?[]u8 = [_]{};",
                "",
                "var r: !i32;"));
    }

    @Test
    @Tag("unit")
    void testIndentationOptions() throws CompilationException {
        String source = "fn f() void { while (true) { break; } }";

        assertThat(format(source, CodeGenOptions.defaults().withUseTabs(true)))
                .isEqualTo("fn f() void {\n\twhile (true) {\n\t\tbreak;\n\t}\n}\n");
        assertThat(format(source, CodeGenOptions.defaults().withIndentSize(2)))
                .isEqualTo(lines("fn f() void {", "  while (true) {", "    break;", "  }", "}"));
    }

    @Test
    @Tag("unit")
    void testNewlineBeforeFunctionBrace() throws CompilationException {
        CodeGenOptions options = new CodeGenOptions(4, false, true);

        assertThat(format("fn f() void { return; }", options))
                .isEqualTo(lines("fn f() void", "{", "    return;", "}"));
    }

    /**
     * Formatting already formatted output must not change it.
     */
    @ParameterizedTest
    @Tag("unit")
    @ValueSource(strings = {
            "const Point = struct { x: i32, y: i32 }; fn len(p: Point) i32 { return p.x * p.x + p.y * p.y; }",
            "fn f(a: bool) void { if (a) return; else if (!a) { return; } else return; }",
            "fn g() void { for (;;) { break; } var x = -(1 - (2 - 3)) * 4; x += 1; }",
            "const Color = enum { red = 1, green }; const s = 'quote \"me\"';",
            "comptime fn h(comptime n: u32) !u32 { comptime { const k = n % 2 == 0 and n > 0; } return n; }",
            "comptime const x = 1; inline var y: i32 = 2;"
    })
    void testFormattingIsIdempotent(String source) throws CompilationException {
        // Act
        String once = format(source);
        String twice = format(once);

        // Assert
        assertThat(twice).isEqualTo(once);
    }

    private static NumberLiteral number(int value) {
        return new NumberLiteral(BigDecimal.valueOf(value), 1, 1);
    }

    @Test
    @Tag("unit")
    void testTopLevelVariableModifiersAreKept() throws CompilationException {
        assertThat(format("comptime   const x=1;")).isEqualTo("comptime const x = 1;\n");
        assertThat(format("inline var y:i32=2;")).isEqualTo("inline var y: i32 = 2;\n");
    }
}
