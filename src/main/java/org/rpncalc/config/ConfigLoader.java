package org.rpncalc.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;

/**
 * Responsible for loading the application configuration from various sources.
 * The loader respects a specific precedence order to allow for flexible configuration.
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);

    /** The file looked up in the working directory when no file is given explicitly. */
    public static final String CONFIG_FILE_NAME = "rpncalc.conf";

    private ConfigLoader() {
        // Private constructor to prevent instantiation
    }

    /**
     * Loads the configuration without a configuration file.
     *
     * @return A resolved {@link Config} of system properties, environment and classpath defaults.
     */
    public static Config load() {
        return load(null);
    }

    /**
     * Loads the application configuration, respecting the precedence order:
     * 1. Java System Properties (e.g., -Drpncalc.lexer.unknown-characters=SKIP)
     * 2. Environment Variables
     * 3. Configuration File (if given and present)
     * 4. Default values (from reference.conf on the classpath)
     *
     * @param configFile The configuration file, or null to skip file-based configuration.
     * @return A resolved {@link Config} object containing the merged configuration.
     */
    public static Config load(final File configFile) {
        final Config fileConfig;
        if (configFile != null && configFile.isFile()) {
            LOG.info("Loading configuration from file: {}", configFile.getAbsolutePath());
            fileConfig = ConfigFactory.parseFile(configFile);
        } else {
            if (configFile != null) {
                LOG.warn("Configuration file '{}' not found or is a directory. Using defaults.", configFile.getPath());
            }
            fileConfig = ConfigFactory.empty();
        }

        // Chain the configs together. The one provided first wins.
        return ConfigFactory.systemProperties()
                .withFallback(ConfigFactory.systemEnvironment())
                .withFallback(fileConfig)
                .withFallback(ConfigFactory.parseResources("reference.conf"))
                .resolve();
    }
}
