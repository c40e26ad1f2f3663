package org.zignet.compiler.frontend.parser.ast;

import java.util.List;

/**
 * The root of the tree: the top-level declarations of one source unit, in source order.
 * An empty source yields a program without declarations.
 *
 * @param declarations The top-level declarations.
 */
public record Program(List<Declaration> declarations) implements AstNode {

    public Program {
        declarations = List.copyOf(declarations);
    }

    @Override
    public int line() {
        return 1;
    }

    @Override
    public int column() {
        return 1;
    }

    @Override
    public List<AstNode> getChildren() {
        return AstNode.children(declarations);
    }
}
