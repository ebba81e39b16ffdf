package org.rpncalc.compiler.frontend.tree;

import org.rpncalc.compiler.frontend.lexer.Token;

/**
 * A leaf that refers to a variable by name.
 *
 * @param token The variable token.
 */
public record VariableNode(
        Token token
) implements ExprNode {

    /**
     * @return The variable name used for lookup in the bindings.
     */
    public String name() {
        return token.text();
    }
}
