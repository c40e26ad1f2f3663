package org.zignet.compiler.frontend.parser.ast;

/**
 * A visitor over the closed set of {@link Declaration} nodes.
 *
 * @param <R> The return type of the visit methods.
 */
public interface DeclarationVisitor<R> {
    R visitFunction(FunctionDeclaration node);
    R visitVariable(VariableDeclaration node);
    R visitStruct(StructDeclaration node);
    R visitUnion(UnionDeclaration node);
    R visitEnum(EnumDeclaration node);
}
