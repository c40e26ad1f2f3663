package org.zignet.compiler.frontend.parser.ast;

import java.util.List;

/**
 * A struct declaration, e.g. {@code const Point = struct { x: i32, y: i32 };}.
 *
 * @param name The struct name.
 * @param fields The fields in declaration order.
 * @param line The line of the declared name.
 * @param column The column of the declared name.
 */
public record StructDeclaration(String name, List<ContainerField> fields, int line, int column) implements Declaration {

    public StructDeclaration {
        fields = List.copyOf(fields);
    }

    @Override
    public <R> R accept(DeclarationVisitor<R> visitor) {
        return visitor.visitStruct(this);
    }

    @Override
    public List<AstNode> getChildren() {
        return AstNode.children(fields);
    }
}
