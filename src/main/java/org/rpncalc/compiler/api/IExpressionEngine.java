package org.rpncalc.compiler.api;

import org.rpncalc.compiler.frontend.lexer.Token;
import org.rpncalc.compiler.frontend.tree.ExpressionTree;

import java.util.List;
import java.util.Map;

/**
 * Defines the public interface of the expression pipeline:
 * text, then tokens, then postfix tokens, then tree, then number.
 */
public interface IExpressionEngine {

    /**
     * Scans the expression text into tokens in source order.
     *
     * @param text The infix expression.
     * @return The tokens in source order.
     * @throws ExpressionException with {@link ExpressionErrorCode#LEX_ERROR} if an unknown character is rejected.
     */
    List<Token> tokenize(String text) throws ExpressionException;

    /**
     * Reorders infix tokens into postfix order.
     *
     * @param tokens The tokens in source order.
     * @return The tokens in postfix order, without brackets.
     * @throws ExpressionException with {@link ExpressionErrorCode#SYNTAX_ERROR} on mismatched parentheses.
     */
    List<Token> toPostfix(List<Token> tokens) throws ExpressionException;

    /**
     * Builds an expression tree from a postfix sequence.
     *
     * @param postfix The tokens in postfix order.
     * @return The immutable expression tree.
     * @throws ExpressionException with {@link ExpressionErrorCode#SYNTAX_ERROR} or {@link ExpressionErrorCode#INVALID_TOKEN}.
     */
    ExpressionTree build(List<Token> postfix) throws ExpressionException;

    /**
     * Runs tokenize, toPostfix and build in sequence.
     *
     * @param text The infix expression.
     * @return The immutable expression tree.
     * @throws ExpressionException if any phase fails.
     */
    default ExpressionTree compile(String text) throws ExpressionException {
        return build(toPostfix(tokenize(text)));
    }

    /**
     * Compiles the expression and solves it against the given bindings.
     *
     * @param text The infix expression.
     * @param bindings Variable values by name. May be null for expressions without variables.
     * @return The result.
     * @throws ExpressionException if any phase or the evaluation fails.
     */
    default double evaluate(String text, Map<String, Double> bindings) throws ExpressionException {
        return compile(text).solve(bindings);
    }
}
