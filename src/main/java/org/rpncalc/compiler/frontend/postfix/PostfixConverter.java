package org.rpncalc.compiler.frontend.postfix;

import org.rpncalc.compiler.api.ExpressionErrorCode;
import org.rpncalc.compiler.api.ExpressionException;
import org.rpncalc.compiler.frontend.lexer.Token;
import org.rpncalc.compiler.frontend.lexer.TokenType;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Reorders an infix token sequence into postfix (reverse Polish) order using the
 * shunting-yard algorithm.
 * <p>
 * All six operators are treated as left-associative, {@code ^} included, so
 * {@code 2^3^2} becomes {@code 2 3 ^ 2 ^}. Brackets are consumed and never appear in the output.
 */
public final class PostfixConverter {

    private PostfixConverter() {}

    /**
     * Converts tokens in source order to postfix order.
     *
     * @param tokens The infix tokens.
     * @return A new list holding the operands and operators in postfix order.
     * @throws ExpressionException with {@link ExpressionErrorCode#SYNTAX_ERROR} on mismatched parentheses.
     */
    public static List<Token> convert(List<Token> tokens) throws ExpressionException {
        Deque<Token> operators = new ArrayDeque<>();
        List<Token> output = new ArrayList<>(tokens.size());

        for (Token token : tokens) {
            switch (token.type()) {
                case CONSTANT, VARIABLE -> output.add(token);
                case OPEN_BRACKET -> operators.push(token);
                case CLOSED_BRACKET -> {
                    while (!operators.isEmpty() && operators.peek().type() != TokenType.OPEN_BRACKET) {
                        output.add(operators.pop());
                    }
                    if (operators.isEmpty()) {
                        throw mismatched(token);
                    }
                    operators.pop();
                }
                case ADD, SUB, MULT, DIV, REM, POW -> {
                    int precedence = precedence(token);
                    // >= makes equal precedence pop first: left-associative
                    while (!operators.isEmpty() && operators.peek().type() != TokenType.OPEN_BRACKET
                            && precedence(operators.peek()) >= precedence) {
                        output.add(operators.pop());
                    }
                    operators.push(token);
                }
            }
        }

        while (!operators.isEmpty()) {
            Token op = operators.pop();
            if (op.type() == TokenType.OPEN_BRACKET) {
                throw mismatched(op);
            }
            output.add(op);
        }
        return output;
    }

    /**
     * Returns the binding strength of an operator token; higher binds tighter.
     *
     * @param op An operator token.
     * @return 1 for + and -, 2 for *, / and %, 3 for ^.
     * @throws ExpressionException with {@link ExpressionErrorCode#INTERNAL_ERROR} for any non-operator token.
     */
    static int precedence(Token op) throws ExpressionException {
        return switch (op.type()) {
            case ADD, SUB -> 1;
            case MULT, DIV, REM -> 2;
            case POW -> 3;
            default -> throw new ExpressionException(ExpressionErrorCode.INTERNAL_ERROR,
                    "Invalid operator: " + op.type() + " '" + op.text() + "'");
        };
    }

    private static ExpressionException mismatched(Token token) {
        return new ExpressionException(ExpressionErrorCode.SYNTAX_ERROR,
                "Mismatched parentheses in expression at column " + token.column());
    }
}
