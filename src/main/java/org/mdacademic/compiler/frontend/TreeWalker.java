package org.mdacademic.compiler.frontend;

import org.mdacademic.compiler.frontend.parser.ast.AstNode;
import org.mdacademic.compiler.frontend.parser.ast.Block;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;

/**
 * A generic class for traversing an Abstract Syntax Tree.
 * Instead of the Visitor pattern, this walker uses a handler-based system
 * to minimize coupling between compiler passes and the AST structure.
 */
public class TreeWalker {

    private final Map<Class<? extends AstNode>, Consumer<AstNode>> handlers;

    /**
     * Constructs a new TreeWalker.
     * @param handlers A map from AST node classes to their corresponding handlers.
     */
    public TreeWalker(Map<Class<? extends AstNode>, Consumer<AstNode>> handlers) {
        this.handlers = handlers;
    }

    /**
     * Walks a list of AST nodes in order.
     * @param nodes The list of nodes to walk.
     */
    public void walk(List<? extends AstNode> nodes) {
        for (AstNode node : nodes) {
            walk(node);
        }
    }

    /**
     * Walks a single AST node and its children recursively, depth-first in document order.
     * @param node The node to walk.
     */
    public void walk(AstNode node) {
        if (node == null) {
            return;
        }

        handlers.getOrDefault(node.getClass(), n -> {}).accept(node);

        for (AstNode child : node.getChildren()) {
            walk(child);
        }
    }

    /**
     * Rewrites a tree bottom-up. Children are transformed first; a node whose children changed is
     * rebuilt through {@link AstNode#reconstructWithChildren(List)} before the rewriter sees it.
     * Untouched subtrees are shared with the input, which is never modified.
     *
     * @param node The root node to transform.
     * @param rewriter Maps a node to its replacement, or returns it unchanged.
     * @return The transformed node (may be the same instance).
     */
    public static AstNode transform(AstNode node, UnaryOperator<AstNode> rewriter) {
        if (node == null) {
            return null;
        }

        List<AstNode> children = node.getChildren();
        List<AstNode> transformedChildren = new ArrayList<>(children.size());
        boolean childrenChanged = false;

        for (AstNode child : children) {
            AstNode transformedChild = transform(child, rewriter);
            if (transformedChild != child) {
                childrenChanged = true;
            }
            transformedChildren.add(transformedChild);
        }

        AstNode current = childrenChanged ? node.reconstructWithChildren(transformedChildren) : node;
        return rewriter.apply(current);
    }

    /**
     * Transforms a sequence of top-level blocks.
     * @param blocks The blocks.
     * @param rewriter The node rewriter.
     * @return The transformed blocks.
     */
    public static List<Block> transformBlocks(List<Block> blocks, UnaryOperator<AstNode> rewriter) {
        List<Block> out = new ArrayList<>(blocks.size());
        for (Block block : blocks) {
            out.add((Block) transform(block, rewriter));
        }
        return out;
    }
}
