package org.rpncalc.compiler.frontend.tree;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * A generic class for traversing an expression tree.
 * Instead of the Visitor pattern, this walker uses a handler-based system
 * so callers only register for the node types they care about.
 * Nodes are visited in pre-order, left child before right child.
 */
public class TreeWalker {

    private final Map<Class<? extends ExprNode>, Consumer<ExprNode>> handlers;

    /**
     * Constructs a new TreeWalker.
     * @param handlers A map from node classes to their corresponding handlers.
     */
    public TreeWalker(Map<Class<? extends ExprNode>, Consumer<ExprNode>> handlers) {
        this.handlers = handlers;
    }

    /**
     * Walks a node and everything below it. The walk uses an explicit stack,
     * so arbitrarily deep trees are safe.
     * @param node The node to walk.
     */
    public void walk(ExprNode node) {
        if (node == null) {
            return;
        }

        Deque<ExprNode> stack = new ArrayDeque<>();
        stack.push(node);
        while (!stack.isEmpty()) {
            ExprNode current = stack.pop();
            handlers.getOrDefault(current.getClass(), n -> {}).accept(current);

            List<ExprNode> children = current.getChildren();
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(children.get(i));
            }
        }
    }
}
