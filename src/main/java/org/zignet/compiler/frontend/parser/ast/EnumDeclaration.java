package org.zignet.compiler.frontend.parser.ast;

import java.util.List;

/**
 * An enum declaration, e.g. {@code const Color = enum { red, green, blue };}.
 *
 * @param name The enum name.
 * @param members The members in declaration order.
 * @param line The line of the declared name.
 * @param column The column of the declared name.
 */
public record EnumDeclaration(String name, List<EnumMember> members, int line, int column) implements Declaration {

    public EnumDeclaration {
        members = List.copyOf(members);
    }

    @Override
    public <R> R accept(DeclarationVisitor<R> visitor) {
        return visitor.visitEnum(this);
    }

    @Override
    public List<AstNode> getChildren() {
        return AstNode.children(members);
    }
}
