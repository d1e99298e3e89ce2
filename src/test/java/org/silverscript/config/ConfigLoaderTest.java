package org.silverscript.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for ConfigLoader to verify the configuration priority hierarchy:
 * system properties over the configuration file over {@code reference.conf}.
 */
@Tag("unit")
class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() {
        ConfigFactory.invalidateCaches();
    }

    @AfterEach
    void tearDown() {
        System.clearProperty("silverscript.debugger.max-steps");
        ConfigFactory.invalidateCaches();
    }

    @Test
    @DisplayName("Should fall back to reference.conf when the file does not exist")
    void load_shouldUseDefaultsWithoutFile() {
        Config config = ConfigLoader.load(tempDir.resolve("absent.conf").toFile());

        assertEquals(100000, config.getLong("silverscript.debugger.max-steps"));
        assertTrue(config.getBoolean("silverscript.cli.pretty-print"));
        assertEquals("WARN", config.getString("logging.default-level"));
    }

    @Test
    @DisplayName("Configuration file should override defaults")
    void load_fileShouldOverrideDefaults() throws Exception {
        File file = writeConfig("silverscript.debugger.max-steps = 42\nsilverscript.transaction.value = 7\n");

        Config config = ConfigLoader.load(file);

        assertEquals(42, config.getLong("silverscript.debugger.max-steps"));
        assertEquals(7, config.getLong("silverscript.transaction.value"));
        assertEquals(8, config.getInt("silverscript.transaction.sig-op-count"));
    }

    @Test
    @DisplayName("System property should override file configuration")
    void load_systemPropertyShouldOverrideFile() throws Exception {
        File file = writeConfig("silverscript.debugger.max-steps = 42\n");
        System.setProperty("silverscript.debugger.max-steps", "9");
        ConfigFactory.invalidateCaches();

        Config config = ConfigLoader.load(file);

        assertEquals(9, config.getLong("silverscript.debugger.max-steps"));
    }

    private File writeConfig(String content) throws Exception {
        Path file = tempDir.resolve("silverscript.conf");
        Files.writeString(file, content);
        return file.toFile();
    }
}
