package org.zignet.compiler.frontend.parser.ast;

import java.util.List;

/**
 * A struct literal, {@code Point{ .x = 1, .y = 2 }}. Not produced by the parser.
 *
 * @param typeName The name of the struct type.
 * @param fields The initialized fields.
 * @param line The line of the type name.
 * @param column The column of the type name.
 */
public record StructLiteral(String typeName, List<StructLiteralField> fields, int line, int column) implements Expression {

    public StructLiteral {
        fields = List.copyOf(fields);
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitStructLiteral(this);
    }

    @Override
    public List<AstNode> getChildren() {
        return AstNode.children(fields);
    }
}
