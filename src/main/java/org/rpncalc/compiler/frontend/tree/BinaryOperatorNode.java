package org.rpncalc.compiler.frontend.tree;

import org.rpncalc.compiler.frontend.lexer.Token;

import java.util.List;
import java.util.Objects;

/**
 * An inner node that applies a binary operator to its two operands.
 *
 * @param token The operator token.
 * @param left The left operand.
 * @param right The right operand.
 */
public record BinaryOperatorNode(
        Token token,
        ExprNode left,
        ExprNode right
) implements ExprNode {

    public BinaryOperatorNode {
        Objects.requireNonNull(left, "left");
        Objects.requireNonNull(right, "right");
    }

    @Override
    public List<ExprNode> getChildren() {
        return List.of(left, right);
    }
}
