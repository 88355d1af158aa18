package org.multicode.cli.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

/**
 * Tests for the LoggingConfigurator class.
 */
@Tag("unit")
class LoggingConfiguratorTest {

    private static final String TEST_LOGGER = "org.multicode.test.logging";

    private final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
    private Level originalRootLevel;

    @BeforeEach
    void setUp() {
        LoggingConfigurator.reset();
        originalRootLevel = context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel();
    }

    @AfterEach
    void tearDown() {
        context.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(originalRootLevel);
        context.getLogger(TEST_LOGGER).setLevel(null);
        LoggingConfigurator.reset();
    }

    @Test
    void configure_appliesDefaultAndSpecificLevels() {
        // Given
        final Config config = ConfigFactory.parseString("""
            logging {
              default-level = "ERROR"
              levels {
                "org.multicode.test.logging" = "DEBUG"
              }
            }
            """);

        // When
        LoggingConfigurator.configure(config);

        // Then
        assertEquals(Level.ERROR, context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel());
        assertEquals(Level.DEBUG, context.getLogger(TEST_LOGGER).getLevel());
    }

    @Test
    void configure_isIdempotentUntilReset() {
        LoggingConfigurator.configure(ConfigFactory.parseString("logging.levels { \"org.multicode.test.logging\" = \"INFO\" }"));
        LoggingConfigurator.configure(ConfigFactory.parseString("logging.levels { \"org.multicode.test.logging\" = \"TRACE\" }"));

        assertEquals(Level.INFO, context.getLogger(TEST_LOGGER).getLevel());

        LoggingConfigurator.reset();
        LoggingConfigurator.configure(ConfigFactory.parseString("logging.levels { \"org.multicode.test.logging\" = \"TRACE\" }"));

        assertEquals(Level.TRACE, context.getLogger(TEST_LOGGER).getLevel());
    }

    @Test
    void configure_ignoresUnknownLevels() {
        LoggingConfigurator.configure(ConfigFactory.parseString("logging.levels { \"org.multicode.test.logging\" = \"LOUD\" }"));

        assertNull(context.getLogger(TEST_LOGGER).getLevel());
    }

    @Test
    void configure_withoutLoggingSectionKeepsLevels() {
        LoggingConfigurator.configure(ConfigFactory.empty());

        assertEquals(originalRootLevel, context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel());
    }
}
