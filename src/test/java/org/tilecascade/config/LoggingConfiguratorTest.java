package org.tilecascade.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.tilecascade.junit.extensions.logging.ExpectLog;
import org.tilecascade.junit.extensions.logging.LogLevel;
import org.tilecascade.junit.extensions.logging.LogWatchExtension;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the LoggingConfigurator class.
 */
@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class LoggingConfiguratorTest {

    private static final String ENGINE_LOGGER = "org.tilecascade.runtime.CascadeStateMachine";

    private Level originalRootLevel;

    @BeforeEach
    void setUp() {
        LoggingConfigurator.reset();
        originalRootLevel = context().getLogger(Logger.ROOT_LOGGER_NAME).getLevel();
    }

    @AfterEach
    void tearDown() {
        context().getLogger(Logger.ROOT_LOGGER_NAME).setLevel(originalRootLevel);
        context().getLogger(ENGINE_LOGGER).setLevel(null);
        LoggingConfigurator.reset();
    }

    private static LoggerContext context() {
        return (LoggerContext) LoggerFactory.getILoggerFactory();
    }

    @Test
    void configure_shouldApplyDefaultAndSpecificLevels() {
        final Config config = ConfigFactory.parseString("""
            logging {
              default-level = "ERROR"
              levels {
                "org.tilecascade.runtime.CascadeStateMachine" = "DEBUG"
              }
            }
            """);

        LoggingConfigurator.configure(config);

        assertEquals(Level.ERROR, context().getLogger(Logger.ROOT_LOGGER_NAME).getLevel());
        assertEquals(Level.DEBUG, context().getLogger(ENGINE_LOGGER).getLevel());
    }

    @Test
    void configure_shouldBeIdempotent() {
        LoggingConfigurator.configure(ConfigFactory.parseString("logging.default-level = \"ERROR\""));
        LoggingConfigurator.configure(ConfigFactory.parseString("logging.default-level = \"DEBUG\""));

        assertEquals(Level.ERROR, context().getLogger(Logger.ROOT_LOGGER_NAME).getLevel());
    }

    @Test
    void configure_withoutLoggingSection_shouldKeepLevels() {
        LoggingConfigurator.configure(ConfigFactory.empty());

        assertEquals(originalRootLevel, context().getLogger(Logger.ROOT_LOGGER_NAME).getLevel());
    }

    @Test
    @ExpectLog(level = LogLevel.WARN, loggerPattern = ".*LoggingConfigurator", messagePattern = "Ignoring unknown level 'LOUD'.*")
    void configure_withUnknownLevel_shouldWarnAndSkip() {
        final Config config = ConfigFactory.parseString("""
            logging.levels {
              "org.tilecascade.runtime.CascadeStateMachine" = "LOUD"
            }
            """);

        LoggingConfigurator.configure(config);

        assertNull(context().getLogger(ENGINE_LOGGER).getLevel());
    }
}
