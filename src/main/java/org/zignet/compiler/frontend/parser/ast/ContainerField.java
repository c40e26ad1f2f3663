package org.zignet.compiler.frontend.parser.ast;

import java.util.List;

/**
 * A field of a struct or union, {@code name: type}.
 *
 * @param name The field name.
 * @param typeAnnotation The field type.
 * @param line The line of the field name.
 * @param column The column of the field name.
 */
public record ContainerField(String name, TypeAnnotation typeAnnotation, int line, int column) implements AstNode {

    @Override
    public List<AstNode> getChildren() {
        return AstNode.children(typeAnnotation);
    }
}
