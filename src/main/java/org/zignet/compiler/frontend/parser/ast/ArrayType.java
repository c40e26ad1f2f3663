package org.zignet.compiler.frontend.parser.ast;

import java.util.List;

/**
 * {@code [N]T}, or {@code []T} when the size is absent.
 *
 * @param size The element count, or {@code null}.
 * @param elementType The element type.
 * @param line The line of the opening bracket.
 * @param column The column of the opening bracket.
 */
public record ArrayType(Integer size, TypeAnnotation elementType, int line, int column) implements TypeAnnotation {

    @Override
    public <R> R accept(TypeAnnotationVisitor<R> visitor) {
        return visitor.visitArray(this);
    }

    @Override
    public List<AstNode> getChildren() {
        return AstNode.children(elementType);
    }
}
