package org.zignet.compiler.frontend.parser.ast;

import java.util.List;

/**
 * A member of an enum, optionally with an explicit value.
 *
 * @param name The member name.
 * @param value The explicit value, or {@code null}.
 * @param line The line of the member name.
 * @param column The column of the member name.
 */
public record EnumMember(String name, Expression value, int line, int column) implements AstNode {

    @Override
    public List<AstNode> getChildren() {
        return AstNode.children(value);
    }
}
