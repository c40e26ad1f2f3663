package org.zignet.compiler.frontend.parser.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The base interface for all nodes in the Abstract Syntax Tree (AST).
 * <p>
 * Every node knows the source position it was created from. Nodes are immutable and own
 * their children exclusively; the tree never shares a node between two parents.
 */
public interface AstNode {

    /**
     * @return The 1-based line of the node.
     */
    int line();

    /**
     * @return The 1-based column of the node.
     */
    int column();

    /**
     * Returns a list of the direct child nodes in source order.
     * This allows generic traversals to walk the tree
     * without knowing the specific structure of each node.
     *
     * @return A list of child nodes. Returns an empty list if the node has no children.
     */
    default List<AstNode> getChildren() {
        return Collections.emptyList();
    }

    /**
     * Builds a child list from single nodes and node lists, skipping absent ({@code null}) parts.
     *
     * @param parts {@link AstNode}s or {@link List}s of nodes, in source order.
     * @return An unmodifiable list of the present children.
     */
    static List<AstNode> children(Object... parts) {
        List<AstNode> result = new ArrayList<>();
        for (Object part : parts) {
            if (part instanceof AstNode node) {
                result.add(node);
            } else if (part instanceof List<?> list) {
                for (Object element : list) {
                    result.add((AstNode) element);
                }
            }
        }
        return Collections.unmodifiableList(result);
    }
}
