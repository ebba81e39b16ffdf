package org.rpncalc.compiler.frontend.tree;

import org.rpncalc.compiler.frontend.lexer.Token;
import org.rpncalc.compiler.frontend.lexer.TokenType;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class TreeWalkerTest {

    @Test
    void visitsNodesPreOrderLeftBeforeRight() {
        // (1 - x) * 2
        ExprNode root = new BinaryOperatorNode(Token.of(TokenType.MULT, "*"),
                new BinaryOperatorNode(Token.of(TokenType.SUB, "-"),
                        new ConstantNode(Token.of(TokenType.CONSTANT, "1")),
                        new VariableNode(Token.of(TokenType.VARIABLE, "x"))),
                new ConstantNode(Token.of(TokenType.CONSTANT, "2")));
        List<String> visited = new ArrayList<>();
        Consumer<ExprNode> record = n -> visited.add(n.token().text());

        Map<Class<? extends ExprNode>, Consumer<ExprNode>> handlers = Map.of(
                BinaryOperatorNode.class, record,
                ConstantNode.class, record,
                VariableNode.class, record);

        new TreeWalker(handlers).walk(root);

        assertThat(visited).containsExactly("*", "-", "1", "x", "2");
    }

    @Test
    void nodesWithoutHandlerAreStillDescended() {
        ExprNode root = new BinaryOperatorNode(Token.of(TokenType.ADD, "+"),
                new VariableNode(Token.of(TokenType.VARIABLE, "a")),
                new VariableNode(Token.of(TokenType.VARIABLE, "b")));
        List<String> names = new ArrayList<>();
        Map<Class<? extends ExprNode>, Consumer<ExprNode>> handlers =
                Map.of(VariableNode.class, n -> names.add(((VariableNode) n).name()));

        new TreeWalker(handlers).walk(root);

        assertThat(names).containsExactly("a", "b");
    }

    @Test
    void walksDegenerateTreesIteratively() {
        Token plus = Token.of(TokenType.ADD, "+");
        ExprNode root = new ConstantNode(Token.of(TokenType.CONSTANT, "0"));
        for (int i = 0; i < 100_000; i++) {
            root = new BinaryOperatorNode(plus, root, new VariableNode(Token.of(TokenType.VARIABLE, "v")));
        }
        int[] leaves = new int[1];
        Map<Class<? extends ExprNode>, Consumer<ExprNode>> handlers = Map.of(VariableNode.class, n -> leaves[0]++);

        new TreeWalker(handlers).walk(root);

        assertThat(leaves[0]).isEqualTo(100_000);
    }
}
