package org.zignet.compiler.frontend.parser.ast;

import java.util.List;

/**
 * A function declaration, e.g. {@code fn add(a: i32, b: i32) i32 { return a + b; }}.
 *
 * @param name The function name.
 * @param parameters The parameters in declaration order.
 * @param returnType The declared return type.
 * @param body The function body.
 * @param isInline Whether the declaration carries the {@code inline} modifier.
 * @param isComptime Whether the declaration carries the {@code comptime} modifier.
 * @param errorUnion Whether the return type is prefixed with {@code !}.
 * @param line The line of the {@code fn} keyword.
 * @param column The column of the {@code fn} keyword.
 */
public record FunctionDeclaration(
        String name,
        List<Parameter> parameters,
        TypeAnnotation returnType,
        BlockStatement body,
        boolean isInline,
        boolean isComptime,
        boolean errorUnion,
        int line,
        int column
) implements Declaration {

    public FunctionDeclaration {
        parameters = List.copyOf(parameters);
    }

    @Override
    public <R> R accept(DeclarationVisitor<R> visitor) {
        return visitor.visitFunction(this);
    }

    @Override
    public List<AstNode> getChildren() {
        return AstNode.children(parameters, returnType, body);
    }
}
