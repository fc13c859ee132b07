package org.mdacademic.compiler.frontend.parser.ast;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The base interface for all nodes in the Abstract Syntax Tree (AST).
 */
public interface AstNode {
    /**
     * Returns a list of the direct child nodes.
     * This allows a generic TreeWalker to traverse the tree
     * without knowing the specific structure of each node.
     *
     * @return A list of child nodes. Returns an empty list if the node has no children.
     */
    @JsonIgnore
    default List<AstNode> getChildren() {
        return Collections.emptyList();
    }

    /**
     * Creates a new instance of this node with the given children.
     * This allows the TreeWalker to reconstruct nodes generically without
     * knowing their specific types.
     *
     * @param newChildren The new children for this node, in the order returned by {@link #getChildren()}
     * @return A new instance of this node with the new children, or this node if it has no children
     */
    default AstNode reconstructWithChildren(List<AstNode> newChildren) {
        return this;
    }

    /**
     * Narrows a list of generic children back to the element type a node stores.
     *
     * @param nodes The nodes to narrow.
     * @param type The expected element type.
     * @param <T> The element type.
     * @return A new list with every node cast to {@code type}.
     * @throws ClassCastException if a rewrite produced a node of the wrong category.
     */
    static <T> List<T> narrow(List<AstNode> nodes, Class<T> type) {
        List<T> out = new ArrayList<>(nodes.size());
        for (AstNode node : nodes) {
            out.add(type.cast(node));
        }
        return out;
    }
}
