package org.zignet.compiler.frontend.parser.ast;

/**
 * One of the built-in types {@code i32 i64 u32 f32 f64 bool void}.
 */
public record PrimitiveType(String name, int line, int column) implements TypeAnnotation {

    @Override
    public <R> R accept(TypeAnnotationVisitor<R> visitor) {
        return visitor.visitPrimitive(this);
    }
}
