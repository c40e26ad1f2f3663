package org.zignet.compiler.frontend.parser.ast;

import java.util.List;

/**
 * A union declaration, e.g. {@code const Value = union { int: i64, float: f64 };}.
 *
 * @param name The union name.
 * @param fields The fields in declaration order.
 * @param line The line of the declared name.
 * @param column The column of the declared name.
 */
public record UnionDeclaration(String name, List<ContainerField> fields, int line, int column) implements Declaration {

    public UnionDeclaration {
        fields = List.copyOf(fields);
    }

    @Override
    public <R> R accept(DeclarationVisitor<R> visitor) {
        return visitor.visitUnion(this);
    }

    @Override
    public List<AstNode> getChildren() {
        return AstNode.children(fields);
    }
}
