package org.zignet.compiler.frontend.parser.ast;

import java.util.List;

/**
 * One {@code .name = value} entry of a {@link StructLiteral}.
 */
public record StructLiteralField(String name, Expression value, int line, int column) implements AstNode {

    @Override
    public List<AstNode> getChildren() {
        return AstNode.children(value);
    }
}
