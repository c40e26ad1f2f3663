package org.zignet.compiler.util;

import org.zignet.compiler.api.CompilationException;
import org.zignet.compiler.frontend.lexer.Lexer;
import org.zignet.compiler.frontend.parser.Parser;
import org.zignet.compiler.frontend.parser.ast.Program;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

public class AstDumpTest {

    @Test
    @Tag("unit")
    void testDumpListsNodesInPreOrder() throws CompilationException {
        Program program = new Parser(new Lexer("const x: i32 = -y.z;\nfn f() void { }").scanTokens()).parse();

        String dump = AstDump.dump(program);

        assertThat(dump).isEqualTo(String.join("\n",
                "Program @1:1",
                "  VariableDeclaration x @1:7",
                "    PrimitiveType i32 @1:10",
                "    UnaryExpression - @1:16",
                "      MemberAccessExpression .z @1:17",
                "        Identifier y @1:17",
                "  FunctionDeclaration f @2:1",
                "    PrimitiveType void @2:8",
                "    BlockStatement @2:13",
                ""));
    }
}
