package org.zignet.compiler.frontend.parser.ast;

import java.util.List;

/**
 * An array literal, {@code [_]{ 1, 2, 3 }}. Not produced by the parser.
 */
public record ArrayLiteral(List<Expression> elements, int line, int column) implements Expression {

    public ArrayLiteral {
        elements = List.copyOf(elements);
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitArrayLiteral(this);
    }

    @Override
    public List<AstNode> getChildren() {
        return AstNode.children(elements);
    }
}
