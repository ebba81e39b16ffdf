package org.rpncalc.compiler.frontend.tree;

import org.rpncalc.compiler.frontend.lexer.Token;

import java.util.Collections;
import java.util.List;

/**
 * The base interface for all nodes of an expression tree.
 * Leaves hold a constant or a variable; inner nodes hold a binary operator.
 */
public sealed interface ExprNode permits ConstantNode, VariableNode, BinaryOperatorNode {

    /**
     * @return The token this node represents. Never a bracket.
     */
    Token token();

    /**
     * Returns a list of the direct child nodes.
     * This allows a generic {@link TreeWalker} to traverse the tree
     * without knowing the specific structure of each node.
     *
     * @return A list of child nodes. Returns an empty list if the node has no children.
     */
    default List<ExprNode> getChildren() {
        return Collections.emptyList();
    }
}
