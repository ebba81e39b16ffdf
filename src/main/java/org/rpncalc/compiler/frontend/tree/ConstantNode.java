package org.rpncalc.compiler.frontend.tree;

import org.rpncalc.compiler.frontend.lexer.Token;

/**
 * A leaf that represents a numeric literal.
 *
 * @param token The constant token.
 */
public record ConstantNode(
        Token token
) implements ExprNode {

    /**
     * Gets the numeric value of the literal. Integer-looking literals are read as doubles too.
     * @return The value.
     */
    public double getValue() {
        return Double.parseDouble(token.text());
    }
}
