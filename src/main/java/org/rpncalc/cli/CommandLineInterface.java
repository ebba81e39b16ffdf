package org.rpncalc.cli;

import com.typesafe.config.Config;
import org.rpncalc.cli.commands.EvalCommand;
import org.rpncalc.cli.commands.PostfixCommand;
import org.rpncalc.compiler.EngineOptions;
import org.rpncalc.compiler.ExpressionEngine;
import org.rpncalc.compiler.frontend.lexer.UnknownCharacterPolicy;
import org.rpncalc.config.ConfigLoader;
import org.rpncalc.config.LoggingConfigurator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.File;
import java.io.PrintWriter;
import java.util.concurrent.Callable;

@Command(
    name = "rpncalc",
    mixinStandardHelpOptions = true,
    version = "rpncalc 1.0",
    description = "Evaluates infix arithmetic expressions via reverse Polish notation",
    subcommands = {
        EvalCommand.class,
        PostfixCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(CommandLineInterface.class);

    @Option(
        names = {"-c", "--config"},
        description = "Path to custom configuration file (default: " + ConfigLoader.CONFIG_FILE_NAME + ")"
    )
    private File configFile;

    @Spec
    private CommandSpec spec;

    private Config config;

    @Override
    public Integer call() {
        // If no subcommand is specified, show the help message.
        spec.commandLine().usage(spec.commandLine().getOut());
        return 0;
    }

    public static void main(final String[] args) {
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        final int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    /**
     * Returns the merged configuration, loading it on first use. The file is looked up in this order:
     * the --config option, the -Dconfig.file system property, rpncalc.conf in the working directory.
     * Without any of them only the classpath defaults apply.
     *
     * @return The resolved configuration.
     */
    public Config getConfig() {
        if (config != null) {
            return config;
        }

        File file = configFile;
        if (file != null) {
            if (!file.isFile()) {
                throw new CommandLine.ParameterException(spec.commandLine(),
                        "Configuration file specified via --config was not found: " + file.getAbsolutePath());
            }
        } else {
            final String systemConfigPath = System.getProperty("config.file");
            if (systemConfigPath != null && !systemConfigPath.isBlank()) {
                file = new File(systemConfigPath).getAbsoluteFile();
            } else if (new File(ConfigLoader.CONFIG_FILE_NAME).isFile()) {
                file = new File(ConfigLoader.CONFIG_FILE_NAME);
            } else {
                LOG.debug("No '{}' found in current directory. Using default configuration from classpath.", ConfigLoader.CONFIG_FILE_NAME);
            }
        }

        config = ConfigLoader.load(file);
        LoggingConfigurator.configure(config);
        return config;
    }

    /**
     * Creates an engine from the configuration.
     *
     * @param skipUnknown Forces the SKIP policy for unknown characters regardless of the configuration.
     * @return The engine.
     */
    public ExpressionEngine createEngine(boolean skipUnknown) {
        EngineOptions options = EngineOptions.fromConfig(getConfig());
        if (skipUnknown) {
            options = options.withUnknownCharacterPolicy(UnknownCharacterPolicy.SKIP);
        }
        return new ExpressionEngine(options);
    }

    /**
     * Prints a failure in the form {@code error [KIND]: message}.
     *
     * @param err The error stream of the running command.
     * @param kind The failure kind.
     * @param message The detail message.
     * @return The exit code for failures.
     */
    public static int reportFailure(PrintWriter err, String kind, String message) {
        err.println("error [" + kind + "]: " + message);
        err.flush();
        return 1;
    }
}
