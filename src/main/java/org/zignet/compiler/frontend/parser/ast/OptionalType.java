package org.zignet.compiler.frontend.parser.ast;

import java.util.List;

/**
 * {@code ?T}.
 */
public record OptionalType(TypeAnnotation valueType, int line, int column) implements TypeAnnotation {

    @Override
    public <R> R accept(TypeAnnotationVisitor<R> visitor) {
        return visitor.visitOptional(this);
    }

    @Override
    public List<AstNode> getChildren() {
        return AstNode.children(valueType);
    }
}
