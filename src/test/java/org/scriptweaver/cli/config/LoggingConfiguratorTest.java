package org.scriptweaver.cli.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

public class LoggingConfiguratorTest {

    private static final String LOGGER_NAME = "org.scriptweaver.test.Configured";

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
        context.getLogger(LOGGER_NAME).setLevel(null);
        LoggingConfigurator.reset();
    }

    @Test
    @Tag("unit")
    void appliesDefaultAndSpecificLevels() {
        LoggingConfigurator.configure(ConfigFactory.parseString(
                "logging { default-level = ERROR, levels { \"" + LOGGER_NAME + "\" = DEBUG } }"));

        assertEquals(Level.ERROR, context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel());
        assertEquals(Level.DEBUG, context.getLogger(LOGGER_NAME).getLevel());
    }

    @Test
    @Tag("unit")
    void secondCallIsIgnoredUntilReset() {
        LoggingConfigurator.configure(ConfigFactory.parseString("logging { default-level = ERROR }"));
        LoggingConfigurator.configure(ConfigFactory.parseString("logging { default-level = TRACE }"));

        assertEquals(Level.ERROR, context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel());

        LoggingConfigurator.reset();
        LoggingConfigurator.configure(ConfigFactory.parseString("logging { default-level = TRACE }"));

        assertEquals(Level.TRACE, context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel());
    }

    @Test
    @Tag("unit")
    void unknownLevelIsSkipped() {
        LoggingConfigurator.configure(ConfigFactory.parseString(
                "logging { levels { \"" + LOGGER_NAME + "\" = LOUD } }"));

        assertNull(context.getLogger(LOGGER_NAME).getLevel());
    }
}
