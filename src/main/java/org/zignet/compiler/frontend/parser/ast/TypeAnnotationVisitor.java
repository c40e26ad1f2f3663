package org.zignet.compiler.frontend.parser.ast;

/**
 * A visitor over the closed set of {@link TypeAnnotation} nodes.
 *
 * @param <R> The return type of the visit methods.
 */
public interface TypeAnnotationVisitor<R> {
    R visitPrimitive(PrimitiveType node);
    R visitNamed(NamedType node);
    R visitPointer(PointerType node);
    R visitArray(ArrayType node);
    R visitErrorUnion(ErrorUnionType node);
    R visitOptional(OptionalType node);
}
