package org.rpncalc.compiler.frontend.tree;

import org.rpncalc.compiler.api.ExpressionErrorCode;
import org.rpncalc.compiler.api.ExpressionException;
import org.rpncalc.compiler.frontend.lexer.Token;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Builds an {@link ExpressionTree} from a token sequence in postfix order.
 */
public final class ExpressionTreeBuilder {

    private ExpressionTreeBuilder() {}

    /**
     * Builds the tree in a single pass over the postfix tokens.
     * For every operator the first pop is the right operand and the second pop the left one.
     *
     * @param postfix The tokens in postfix order.
     * @return The tree and its variable leaf count.
     * @throws ExpressionException with {@link ExpressionErrorCode#SYNTAX_ERROR} if the sequence
     *         does not reduce to exactly one node, or {@link ExpressionErrorCode#INVALID_TOKEN}
     *         if it contains a bracket.
     */
    public static ExpressionTree build(List<Token> postfix) throws ExpressionException {
        Deque<ExprNode> stack = new ArrayDeque<>();
        int variableCount = 0;

        for (Token token : postfix) {
            switch (token.type()) {
                case CONSTANT -> stack.push(new ConstantNode(token));
                case VARIABLE -> {
                    variableCount++;
                    stack.push(new VariableNode(token));
                }
                case ADD, SUB, MULT, DIV, REM, POW -> {
                    if (stack.size() < 2) {
                        throw invalidPostfix("operator '" + token.text() + "' is missing an operand");
                    }
                    ExprNode right = stack.pop();
                    ExprNode left = stack.pop();
                    stack.push(new BinaryOperatorNode(token, left, right));
                }
                case OPEN_BRACKET, CLOSED_BRACKET -> throw new ExpressionException(ExpressionErrorCode.INVALID_TOKEN,
                        "Invalid token in postfix sequence: '" + token.text() + "'");
            }
        }

        if (stack.size() != 1) {
            throw invalidPostfix(stack.isEmpty() ? "empty expression" : stack.size() + " operands left over");
        }
        return new ExpressionTree(stack.pop(), variableCount);
    }

    private static ExpressionException invalidPostfix(String detail) {
        return new ExpressionException(ExpressionErrorCode.SYNTAX_ERROR, "Invalid postfix notation: " + detail);
    }
}
