package org.rpncalc.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.joran.JoranConfigurator;
import ch.qos.logback.classic.turbo.TurboFilter;
import ch.qos.logback.core.joran.spi.JoranException;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigValue;
import org.slf4j.LoggerFactory;

import java.net.URL;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Configures the application's logging system based on HOCON configuration.
 * This class reads logging settings from the configuration and applies them
 * to the Logback logging framework at runtime.
 *
 * <h3>Configuration Structure:</h3>
 * <pre>
 * logging {
 *   format = "PLAIN"  # Can be "PLAIN" or "JSON". Defaults to PLAIN
 *   default-level = "WARN"  # Default log level for all loggers
 *   levels {
 *     # Specific logger levels - override the default for particular components
 *     "org.rpncalc.compiler" = "DEBUG"
 *   }
 * }
 * </pre>
 */
public final class LoggingConfigurator {

    private static final org.slf4j.Logger LOGGER = LoggerFactory.getLogger(LoggingConfigurator.class);
    private static final String LOGGING_CONFIG_PATH = "logging";
    private static final String FORMAT_KEY = "format";
    private static final String DEFAULT_LEVEL_KEY = "default-level";
    private static final String LEVELS_KEY = "levels";

    /** Selects the appender in logback.xml. */
    static final String FORMAT_PROPERTY = "rpncalc.logging.format";
    static final String PLAIN_APPENDER = "CONSOLE_PLAIN";
    static final String JSON_APPENDER = "CONSOLE_JSON";

    private static boolean loggingConfigured = false;

    private LoggingConfigurator() {}

    /**
     * Configures the logging system based on the provided configuration.
     * This method is idempotent - calling it multiple times has no additional effect.
     *
     * @param config The application configuration containing logging settings.
     */
    public static void configure(final Config config) {
        if (loggingConfigured) {
            LOGGER.debug("Logging already configured, skipping.");
            return;
        }

        if (!config.hasPath(LOGGING_CONFIG_PATH)) {
            LOGGER.debug("No logging configuration found, using Logback defaults.");
            loggingConfigured = true;
            return;
        }

        try {
            final Config loggingConfig = config.getConfig(LOGGING_CONFIG_PATH);
            final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();

            configureFormat(loggingConfig, context);
            configureDefaultLevel(loggingConfig, context);
            configureSpecificLevels(loggingConfig, context);

            loggingConfigured = true;
            LOGGER.debug("Logging configuration applied successfully.");

        } catch (final Exception e) {
            LOGGER.error("Failed to configure logging, using Logback defaults.", e);
            loggingConfigured = true; // Prevent retry attempts
        }
    }

    /**
     * Selects the console appender. Logback is only reloaded when the selection changes.
     * Turbo filters installed at runtime survive the reload.
     */
    private static void configureFormat(final Config loggingConfig, final LoggerContext context) throws JoranException {
        final String format = loggingConfig.hasPath(FORMAT_KEY)
            ? loggingConfig.getString(FORMAT_KEY)
            : "PLAIN";
        final String appender = "JSON".equalsIgnoreCase(format) ? JSON_APPENDER : PLAIN_APPENDER;

        if (appender.equals(System.getProperty(FORMAT_PROPERTY, PLAIN_APPENDER))) {
            return;
        }
        System.setProperty(FORMAT_PROPERTY, appender);

        final URL configUrl = LoggingConfigurator.class.getClassLoader().getResource("logback.xml");
        if (configUrl != null) {
            final JoranConfigurator configurator = new JoranConfigurator();
            configurator.setContext(context);
            final List<TurboFilter> turboFilters = new ArrayList<>(context.getTurboFilterList());
            context.reset();
            configurator.doConfigure(configUrl);
            for (final TurboFilter filter : turboFilters) {
                filter.start();
                context.addTurboFilter(filter);
            }
        }
        LOGGER.debug("Configured logging format: {}", format);
    }

    /**
     * Configures the default log level for all loggers.
     */
    private static void configureDefaultLevel(final Config loggingConfig, final LoggerContext context) {
        if (loggingConfig.hasPath(DEFAULT_LEVEL_KEY)) {
            final String levelStr = loggingConfig.getString(DEFAULT_LEVEL_KEY);
            final Level level = Level.toLevel(levelStr, Level.WARN);

            final Logger rootLogger = context.getLogger(Logger.ROOT_LOGGER_NAME);
            rootLogger.setLevel(level);

            LOGGER.debug("Configured default log level: {}", level);
        }
    }

    /**
     * Configures specific logger levels as defined in the configuration.
     */
    private static void configureSpecificLevels(final Config loggingConfig, final LoggerContext context) {
        if (!loggingConfig.hasPath(LEVELS_KEY)) {
            LOGGER.debug("No specific logger levels configured.");
            return;
        }

        final Config levelsConfig = loggingConfig.getConfig(LEVELS_KEY);
        int configuredCount = 0;

        for (final Map.Entry<String, ConfigValue> entry : levelsConfig.root().entrySet()) {
            final String loggerName = entry.getKey();
            final String levelName = entry.getValue().unwrapped().toString();

            final Level level = Level.toLevel(levelName, null);
            if (level == null) {
                LOGGER.warn("Ignoring unknown level '{}' for logger '{}'", levelName, loggerName);
                continue;
            }
            context.getLogger(loggerName).setLevel(level);
            configuredCount++;
            LOGGER.debug("Configured logger '{}' to level: {}", loggerName, level);
        }

        LOGGER.debug("Configured {} specific logger levels.", configuredCount);
    }

    /**
     * Resets the logging configuration state. This is primarily useful for testing.
     * In production, this method should not be called after the initial configuration.
     */
    public static void reset() {
        loggingConfigured = false;
    }
}
