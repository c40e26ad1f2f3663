package org.zignet.compiler.frontend.parser.ast;

import java.util.List;

/**
 * A function parameter, {@code [comptime] name: type}.
 *
 * @param name The parameter name.
 * @param typeAnnotation The parameter type.
 * @param isComptime Whether the parameter is {@code comptime}-qualified.
 * @param line The line of the parameter name.
 * @param column The column of the parameter name.
 */
public record Parameter(
        String name,
        TypeAnnotation typeAnnotation,
        boolean isComptime,
        int line,
        int column
) implements AstNode {

    @Override
    public List<AstNode> getChildren() {
        return AstNode.children(typeAnnotation);
    }
}
