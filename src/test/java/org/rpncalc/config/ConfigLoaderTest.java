package org.rpncalc.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.rpncalc.junit.extensions.logging.ExpectLog;
import org.rpncalc.junit.extensions.logging.LogLevel;
import org.rpncalc.junit.extensions.logging.LogWatchExtension;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for ConfigLoader to verify the configuration priority hierarchy:
 * 1. System Properties (highest priority)
 * 2. Environment Variables
 * 3. Configuration File
 * 4. Default reference configuration (lowest priority)
 */
@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class ConfigLoaderTest {

    private static final String POLICY_PATH = "rpncalc.lexer.unknown-characters";

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() {
        ConfigFactory.invalidateCaches();
    }

    @AfterEach
    void tearDown() {
        System.clearProperty(POLICY_PATH);
        System.clearProperty("logging.default-level");
        ConfigFactory.invalidateCaches();
    }

    private File writeConfig(String content) throws IOException {
        Path file = tempDir.resolve("rpncalc.conf");
        Files.writeString(file, content);
        return file.toFile();
    }

    @Test
    @DisplayName("Should expose reference.conf defaults when no file is given")
    void load_shouldUseReferenceDefaults() {
        Config config = ConfigLoader.load();

        assertEquals("REJECT", config.getString(POLICY_PATH));
        assertEquals("PLAIN", config.getString("logging.format"));
        assertEquals("WARN", config.getString("logging.default-level"));
    }

    @Test
    @DisplayName("Configuration file should override defaults")
    void load_fileShouldOverrideDefaults() throws IOException {
        File file = writeConfig("rpncalc.lexer.unknown-characters = \"SKIP\"\n");

        Config config = ConfigLoader.load(file);

        assertEquals("SKIP", config.getString(POLICY_PATH));
        // Values absent from the file still come from reference.conf
        assertEquals("WARN", config.getString("logging.default-level"));
    }

    @Test
    @DisplayName("System property should override file configuration")
    void load_systemPropertyShouldOverrideFileConfig() throws IOException {
        File file = writeConfig("rpncalc.lexer.unknown-characters = \"SKIP\"\nlogging.default-level = \"INFO\"\n");
        System.setProperty(POLICY_PATH, "REJECT");
        ConfigFactory.invalidateCaches();

        Config config = ConfigLoader.load(file);

        assertEquals("REJECT", config.getString(POLICY_PATH));
        assertEquals("INFO", config.getString("logging.default-level"));
    }

    @Test
    @DisplayName("File substitutions should be resolved")
    void load_shouldResolveSubstitutions() throws IOException {
        File file = writeConfig("base = \"SKIP\"\nrpncalc.lexer.unknown-characters = ${base}\n");

        Config config = ConfigLoader.load(file);

        assertEquals("SKIP", config.getString(POLICY_PATH));
    }

    @Test
    @ExpectLog(level = LogLevel.WARN, messagePattern = "Configuration file '.*missing.conf' not found or is a directory. Using defaults.")
    @DisplayName("Should fall back to defaults when the file does not exist")
    void load_shouldHandleMissingConfigFile() {
        Config config = ConfigLoader.load(tempDir.resolve("missing.conf").toFile());

        assertEquals("REJECT", config.getString(POLICY_PATH));
    }
}
