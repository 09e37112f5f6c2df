package org.loxcore.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.loxcore.junit.extensions.logging.ExpectLog;
import org.loxcore.junit.extensions.logging.LogLevel;
import org.loxcore.junit.extensions.logging.LogWatchExtension;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for ConfigLoader to verify the configuration priority hierarchy:
 * 1. System Properties over
 * 2. Configuration File over
 * 3. Default reference configuration
 */
@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class ConfigLoaderTest {

    @BeforeEach
    void setUp() {
        ConfigFactory.invalidateCaches();
    }

    @AfterEach
    void tearDown() {
        System.clearProperty("loxcore.parser.max-nesting-depth");
        ConfigFactory.invalidateCaches();
    }

    @Test
    @DisplayName("Should fall back to reference.conf defaults")
    void load_shouldProvideReferenceDefaults() {
        Config config = ConfigLoader.load();

        assertEquals(200, config.getInt("loxcore.parser.max-nesting-depth"));
        assertTrue(config.getBoolean("loxcore.diagnostics.print-to-stderr"));
        assertEquals("WARN", config.getString("logging.default-level"));
    }

    @Test
    @DisplayName("Should let a configuration resource override defaults")
    void load_shouldApplyResourceOverDefaults() {
        Config config = ConfigLoader.load("org/loxcore/config/test-config.conf");

        assertEquals(8, config.getInt("loxcore.parser.max-nesting-depth"));
        assertFalse(config.getBoolean("loxcore.diagnostics.print-to-stderr"));
        assertEquals("WARN", config.getString("logging.default-level"));
    }

    @Test
    @DisplayName("Should let system properties override the configuration resource")
    void load_systemPropertiesWin() {
        System.setProperty("loxcore.parser.max-nesting-depth", "16");
        ConfigFactory.invalidateCaches();

        Config config = ConfigLoader.load("org/loxcore/config/test-config.conf");

        assertEquals(16, config.getInt("loxcore.parser.max-nesting-depth"));
    }

    @Test
    @DisplayName("Should warn when a configuration resource is missing")
    @ExpectLog(level = LogLevel.WARN, loggerPattern = ".*ConfigLoader", messagePattern = ".*missing\\.conf.*not found.*")
    void load_missingResourceWarns() {
        Config config = ConfigLoader.load("org/loxcore/config/missing.conf");

        assertEquals(200, config.getInt("loxcore.parser.max-nesting-depth"));
    }
}
