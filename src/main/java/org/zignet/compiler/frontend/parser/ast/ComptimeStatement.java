package org.zignet.compiler.frontend.parser.ast;

import java.util.List;

/**
 * A {@code comptime { ... }} block.
 */
public record ComptimeStatement(BlockStatement body, int line, int column) implements Statement {

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitComptime(this);
    }

    @Override
    public List<AstNode> getChildren() {
        return AstNode.children(body);
    }
}
