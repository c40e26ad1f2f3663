package org.zignet.compiler.frontend.parser.ast;

import java.util.List;

/**
 * A {@code const} or {@code var} declaration. It appears both at the top level and as a
 * statement inside blocks. Only top-level declarations may carry modifiers.
 *
 * @param isInline Whether the declaration carries the {@code inline} modifier.
 * @param isComptime Whether the declaration carries the {@code comptime} modifier.
 * @param isConst {@code true} for {@code const}, {@code false} for {@code var}.
 * @param name The variable name.
 * @param typeAnnotation The declared type, or {@code null}.
 * @param initializer The initial value, or {@code null}.
 * @param line The line of the variable name.
 * @param column The column of the variable name.
 */
public record VariableDeclaration(
        boolean isInline,
        boolean isComptime,
        boolean isConst,
        String name,
        TypeAnnotation typeAnnotation,
        Expression initializer,
        int line,
        int column
) implements Declaration, Statement {

    /**
     * Creates a declaration without modifiers.
     */
    public VariableDeclaration(boolean isConst, String name, TypeAnnotation typeAnnotation, Expression initializer,
                               int line, int column) {
        this(false, false, isConst, name, typeAnnotation, initializer, line, column);
    }

    @Override
    public <R> R accept(DeclarationVisitor<R> visitor) {
        return visitor.visitVariable(this);
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitVariable(this);
    }

    @Override
    public List<AstNode> getChildren() {
        return AstNode.children(typeAnnotation, initializer);
    }
}
