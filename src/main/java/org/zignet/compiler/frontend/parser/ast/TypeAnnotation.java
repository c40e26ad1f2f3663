package org.zignet.compiler.frontend.parser.ast;

/**
 * A written type. The parser only produces {@link PrimitiveType} and {@link NamedType};
 * the other variants can be built programmatically and are understood by the later phases.
 */
public sealed interface TypeAnnotation extends AstNode
        permits PrimitiveType, NamedType, PointerType, ArrayType, ErrorUnionType, OptionalType {

    <R> R accept(TypeAnnotationVisitor<R> visitor);
}
