package org.rpncalc.cli.commands;

import com.typesafe.config.ConfigException;
import org.rpncalc.cli.CommandLineInterface;
import org.rpncalc.compiler.ExpressionEngine;
import org.rpncalc.compiler.api.ExpressionException;
import org.rpncalc.compiler.frontend.postfix.PostfixFormatter;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.util.concurrent.Callable;

@Command(
    name = "postfix",
    description = "Print an infix expression in postfix (reverse Polish) order"
)
public class PostfixCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "The infix expression")
    private String expression;

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
        try {
            ExpressionEngine engine = parent.createEngine(skipUnknown);
            spec.commandLine().getOut().println(PostfixFormatter.format(engine.toPostfix(engine.tokenize(expression))));
            spec.commandLine().getOut().flush();
            return 0;
        } catch (ExpressionException e) {
            return CommandLineInterface.reportFailure(spec.commandLine().getErr(), e.getErrorCode().name(), e.getMessage());
        } catch (ConfigException e) {
            return CommandLineInterface.reportFailure(spec.commandLine().getErr(), "CONFIG", e.getMessage());
        }
    }
}
