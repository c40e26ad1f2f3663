package org.zignet.compiler.frontend.parser.ast;

import java.util.List;

/**
 * {@code *T}.
 */
public record PointerType(TypeAnnotation pointeeType, int line, int column) implements TypeAnnotation {

    @Override
    public <R> R accept(TypeAnnotationVisitor<R> visitor) {
        return visitor.visitPointer(this);
    }

    @Override
    public List<AstNode> getChildren() {
        return AstNode.children(pointeeType);
    }
}
