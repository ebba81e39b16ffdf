package org.rpncalc.compiler.frontend.tree;

import org.rpncalc.compiler.api.ExpressionErrorCode;
import org.rpncalc.compiler.api.ExpressionException;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;

/**
 * An immutable expression tree together with the number of variable leaves it contains.
 * <p>
 * A tree can be solved any number of times, also concurrently, against different bindings.
 */
public final class ExpressionTree {

    private final ExprNode root;
    private final int variableCount;

    ExpressionTree(ExprNode root, int variableCount) {
        this.root = root;
        this.variableCount = variableCount;
    }

    /**
     * @return The root node.
     */
    public ExprNode root() {
        return root;
    }

    /**
     * Returns the number of variable leaves. A name that occurs twice is counted twice.
     * @return The variable leaf count.
     */
    public int variableCount() {
        return variableCount;
    }

    /**
     * Returns the distinct variable names in the order they first appear, left to right.
     * @return The variable names.
     */
    public List<String> variableNames() {
        Set<String> names = new LinkedHashSet<>();
        Map<Class<? extends ExprNode>, Consumer<ExprNode>> handlers =
                Map.of(VariableNode.class, n -> names.add(((VariableNode) n).name()));
        new TreeWalker(handlers).walk(root);
        return new ArrayList<>(names);
    }

    /**
     * Solves a tree that has no variables.
     *
     * @return The result.
     * @throws ExpressionException with {@link ExpressionErrorCode#ARITY_ERROR} if the tree has variables.
     */
    public double solve() throws ExpressionException {
        return solve(null);
    }

    /**
     * Solves the tree against the given bindings.
     * <p>
     * Bindings are first checked by count only: fewer entries than variable leaves fail
     * with {@link ExpressionErrorCode#ARITY_ERROR} before anything is evaluated. A name that
     * is absent from a large enough map fails later, with
     * {@link ExpressionErrorCode#MISSING_VARIABLE}, when its leaf is reached.
     *
     * @param bindings Variable values by name, or null.
     * @return The result.
     * @throws ExpressionException if the bindings do not cover the tree.
     */
    public double solve(Map<String, Double> bindings) throws ExpressionException {
        int supplied = bindings == null ? 0 : bindings.size();
        if (variableCount > supplied) {
            throw new ExpressionException(ExpressionErrorCode.ARITY_ERROR,
                    "Wrong count of variables given: expected " + variableCount + ", got " + supplied);
        }
        return TreeEvaluator.evaluate(root, bindings);
    }
}
