package org.zignet.compiler.frontend.parser.ast;

/**
 * A type referenced by an identifier, e.g. a struct name or {@code usize}.
 */
public record NamedType(String name, int line, int column) implements TypeAnnotation {

    @Override
    public <R> R accept(TypeAnnotationVisitor<R> visitor) {
        return visitor.visitNamed(this);
    }
}
