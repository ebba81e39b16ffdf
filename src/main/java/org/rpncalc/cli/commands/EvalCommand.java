package org.rpncalc.cli.commands;

import com.typesafe.config.ConfigException;
import org.rpncalc.cli.CommandLineInterface;
import org.rpncalc.compiler.ExpressionEngine;
import org.rpncalc.compiler.api.ExpressionException;
import org.rpncalc.compiler.frontend.lexer.Token;
import org.rpncalc.compiler.frontend.postfix.PostfixFormatter;
import org.rpncalc.compiler.frontend.tree.ExpressionTree;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

@Command(
    name = "eval",
    description = "Evaluate an infix expression and print the result"
)
public class EvalCommand implements Callable<Integer> {

    @Parameters(
        index = "0",
        description = "The infix expression, e.g. \"(3 + a) * 2 / (b - 5) ^ 2 ^ 3\""
    )
    private String expression;

    @Option(
        names = {"-D", "--define"},
        description = "Variable binding as name=value (repeatable)"
    )
    private Map<String, Double> bindings = new LinkedHashMap<>();

    @Option(
        names = "--show-tokens",
        description = "Print the token texts, one per line, before the result"
    )
    private boolean showTokens;

    @Option(
        names = "--show-postfix",
        description = "Print the postfix order before the result"
    )
    private boolean showPostfix;

    @Option(
        names = "--skip-unknown",
        description = "Skip unknown characters instead of rejecting the expression"
    )
    private boolean skipUnknown;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        try {
            ExpressionEngine engine = parent.createEngine(skipUnknown);

            List<Token> tokens = engine.tokenize(expression);
            if (showTokens) {
                tokens.forEach(token -> out.println(token.text()));
            }

            List<Token> postfix = engine.toPostfix(tokens);
            if (showPostfix) {
                out.println(PostfixFormatter.format(postfix));
            }

            ExpressionTree tree = engine.build(postfix);
            out.println(tree.solve(bindings));
            out.flush();
            return 0;
        } catch (ExpressionException e) {
            return CommandLineInterface.reportFailure(err, e.getErrorCode().name(), e.getMessage());
        } catch (ConfigException e) {
            return CommandLineInterface.reportFailure(err, "CONFIG", e.getMessage());
        }
    }
}
