package org.rpncalc.compiler.frontend.tree;

import org.rpncalc.compiler.api.ExpressionErrorCode;
import org.rpncalc.compiler.api.ExpressionException;
import org.rpncalc.compiler.frontend.lexer.Token;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;

/**
 * Evaluates an expression tree in post-order. Pending nodes and intermediate results live
 * on explicit stacks, so the depth of the tree is bounded by the heap and not the call stack.
 * <p>
 * Arithmetic is IEEE 754 double throughout: division by zero yields an infinity or NaN
 * and is not an error. {@code %} is the Java floating-point remainder (sign of the dividend).
 */
final class TreeEvaluator {

    private TreeEvaluator() {}

    static double evaluate(ExprNode root, Map<String, Double> bindings) throws ExpressionException {
        Deque<Frame> pending = new ArrayDeque<>();
        Deque<Double> values = new ArrayDeque<>();
        pending.push(new Frame(root, false));

        while (!pending.isEmpty()) {
            Frame frame = pending.pop();
            ExprNode node = frame.node();
            if (node instanceof ConstantNode constant) {
                values.push(constant.getValue());
            } else if (node instanceof VariableNode variable) {
                values.push(lookup(variable, bindings));
            } else if (node instanceof BinaryOperatorNode op) {
                if (frame.operandsDone()) {
                    double b = values.pop();
                    double a = values.pop();
                    values.push(apply(op.token(), a, b));
                } else {
                    // Left is popped first
                    pending.push(new Frame(op, true));
                    pending.push(new Frame(op.right(), false));
                    pending.push(new Frame(op.left(), false));
                }
            }
        }
        return values.pop();
    }

    private static double lookup(VariableNode variable, Map<String, Double> bindings) throws ExpressionException {
        Double value = bindings == null ? null : bindings.get(variable.name());
        if (value == null) {
            throw new ExpressionException(ExpressionErrorCode.MISSING_VARIABLE,
                    "Missing variable in bindings: '" + variable.name() + "'");
        }
        return value;
    }

    private static double apply(Token op, double a, double b) throws ExpressionException {
        return switch (op.type()) {
            case ADD -> a + b;
            case SUB -> a - b;
            case MULT -> a * b;
            case DIV -> a / b;
            case REM -> a % b;
            case POW -> Math.pow(a, b);
            case VARIABLE, CONSTANT, OPEN_BRACKET, CLOSED_BRACKET -> throw new ExpressionException(
                    ExpressionErrorCode.INTERNAL_ERROR,
                    "Operator node holds a non-operator token: " + op.type());
        };
    }

    private record Frame(ExprNode node, boolean operandsDone) {
    }
}
