package org.zignet.compiler.frontend.parser.ast;

/**
 * A top-level declaration.
 */
public sealed interface Declaration extends AstNode
        permits FunctionDeclaration, VariableDeclaration, StructDeclaration, UnionDeclaration, EnumDeclaration {

    /**
     * @return The declared name.
     */
    String name();

    <R> R accept(DeclarationVisitor<R> visitor);
}
