package org.skylane.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
public class LoggingConfiguratorTest {

    private LoggerContext context;
    private Level originalRootLevel;

    @BeforeEach
    void setUp() {
        context = (LoggerContext) LoggerFactory.getILoggerFactory();
        originalRootLevel = context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel();
        LoggingConfigurator.reset();
    }

    @AfterEach
    void tearDown() {
        context.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(originalRootLevel);
        context.getLogger("org.skylane.test.noisy").setLevel(null);
        LoggingConfigurator.reset();
    }

    @Test
    void appliesDefaultAndSpecificLevels() {
        Config config = ConfigFactory.parseString(
                "logging { default-level = ERROR, levels { \"org.skylane.test.noisy\" = DEBUG } }");

        LoggingConfigurator.configure(config);

        assertEquals(Level.ERROR, context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel());
        assertEquals(Level.DEBUG, context.getLogger("org.skylane.test.noisy").getLevel());
    }

    @Test
    void configuresOnlyOnce() {
        LoggingConfigurator.configure(ConfigFactory.parseString("logging.default-level = ERROR"));
        LoggingConfigurator.configure(ConfigFactory.parseString("logging.default-level = TRACE"));

        assertEquals(Level.ERROR, context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel());
    }

    @Test
    void malformedLevelsFallBackToDefaults() {
        Config config = ConfigFactory.parseString("logging { default-level = ERROR, levels = 5 }");

        assertDoesNotThrow(() -> LoggingConfigurator.configure(config));
        assertEquals(Level.ERROR, context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel());
    }

    @Test
    void selectsLogbackFileByFormat() {
        assertEquals("logback-json.xml", LoggingConfigurator.logbackFileFor(ConfigFactory.parseString("logging.format = json")));
        assertEquals("logback.xml", LoggingConfigurator.logbackFileFor(ConfigFactory.parseString("logging.format = PLAIN")));
        assertEquals("logback.xml", LoggingConfigurator.logbackFileFor(ConfigFactory.empty()));
    }
}
