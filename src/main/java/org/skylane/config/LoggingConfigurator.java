package org.skylane.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigValue;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Applies the {@code logging} section of the configuration to Logback at runtime.
 *
 * <h3>Configuration Structure:</h3>
 * <pre>
 * logging {
 *   format = "PLAIN"        # "PLAIN" or "JSON", chosen before Logback starts (see Main)
 *   default-level = "INFO"  # Root logger level
 *   levels {
 *     "org.skylane.workers.core" = "DEBUG"
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

    private static boolean loggingConfigured = false;

    private LoggingConfigurator() {
        // Utility class
    }

    /**
     * Returns the Logback configuration file matching {@code logging.format}.
     * Must be set as {@code logback.configurationFile} before the first logger is created.
     *
     * @param config The application configuration.
     * @return {@code logback-json.xml} for JSON, {@code logback.xml} otherwise.
     */
    public static String logbackFileFor(final Config config) {
        final String format = config.hasPath(LOGGING_CONFIG_PATH + "." + FORMAT_KEY)
            ? config.getString(LOGGING_CONFIG_PATH + "." + FORMAT_KEY)
            : "PLAIN";
        return "JSON".equalsIgnoreCase(format) ? "logback-json.xml" : "logback.xml";
    }

    /**
     * Configures log levels from the provided configuration.
     * This method is idempotent - calling it multiple times has no additional effect.
     *
     * @param config The application configuration containing logging settings.
     */
    public static synchronized void configure(final Config config) {
        if (loggingConfigured) {
            LOGGER.debug("Logging already configured, skipping.");
            return;
        }
        loggingConfigured = true;

        if (!config.hasPath(LOGGING_CONFIG_PATH)) {
            LOGGER.debug("No logging configuration found, using Logback defaults.");
            return;
        }

        try {
            final Config loggingConfig = config.getConfig(LOGGING_CONFIG_PATH);
            if (!(LoggerFactory.getILoggerFactory() instanceof LoggerContext)) {
                LOGGER.warn("Logback is not the active SLF4J binding, ignoring logging levels.");
                return;
            }
            final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
            configureDefaultLevel(loggingConfig, context);
            configureSpecificLevels(loggingConfig, context);
            LOGGER.debug("Logging configuration applied successfully.");
        } catch (final Exception e) {
            LOGGER.error("Failed to configure logging, using Logback defaults: {}", e.getMessage());
        }
    }

    private static void configureDefaultLevel(final Config loggingConfig, final LoggerContext context) {
        if (loggingConfig.hasPath(DEFAULT_LEVEL_KEY)) {
            final Level level = Level.toLevel(loggingConfig.getString(DEFAULT_LEVEL_KEY), Level.INFO);
            context.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(level);
            LOGGER.debug("Configured default log level: {}", level);
        }
    }

    private static void configureSpecificLevels(final Config loggingConfig, final LoggerContext context) {
        if (!loggingConfig.hasPath(LEVELS_KEY)) {
            LOGGER.debug("No specific logger levels configured.");
            return;
        }
        int configuredCount = 0;
        for (final Map.Entry<String, ConfigValue> entry : loggingConfig.getConfig(LEVELS_KEY).root().entrySet()) {
            final String loggerName = entry.getKey();
            final String levelName = entry.getValue().unwrapped().toString();
            context.getLogger(loggerName).setLevel(Level.toLevel(levelName, Level.INFO));
            configuredCount++;
            LOGGER.debug("Configured logger '{}' to level: {}", loggerName, levelName);
        }
        LOGGER.debug("Configured {} specific logger levels.", configuredCount);
    }

    /**
     * Resets the configured flag. Intended for tests.
     */
    static synchronized void reset() {
        loggingConfigured = false;
    }
}
