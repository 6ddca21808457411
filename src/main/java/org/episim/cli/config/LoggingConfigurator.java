package org.episim.cli.config;

import java.util.Locale;
import java.util.Map;

import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigValue;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;

/**
 * Applies log levels from the application settings and the command line to Logback.
 * <p>
 * Settings:
 * <pre>
 * episim.logging {
 *   level = "INFO"                      # root level
 *   levels { "org.episim.io" = "DEBUG" } # per-logger overrides
 * }
 * </pre>
 */
public final class LoggingConfigurator {

    private LoggingConfigurator() {
    }

    /**
     * @param settings application settings; missing entries leave Logback untouched
     */
    public static void configure(Config settings) {
        if (settings.hasPath("episim.logging.level")) {
            setLevel(org.slf4j.Logger.ROOT_LOGGER_NAME, settings.getString("episim.logging.level"));
        }
        if (settings.hasPath("episim.logging.levels")) {
            for (Map.Entry<String, ConfigValue> entry : settings.getConfig("episim.logging.levels").root().entrySet()) {
                setLevel(entry.getKey(), String.valueOf(entry.getValue().unwrapped()));
            }
        }
    }

    /**
     * Sets the root level from a command line value.
     *
     * @param cliLevel one of debug, info, warn, error, silent (case-insensitive)
     * @throws IllegalArgumentException if the value is not one of these
     */
    public static void applyCliLevel(String cliLevel) {
        setLevel(org.slf4j.Logger.ROOT_LOGGER_NAME, cliLevel);
    }

    static Level parseLevel(String value) {
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        return switch (normalized) {
            case "DEBUG" -> Level.DEBUG;
            case "INFO" -> Level.INFO;
            case "WARN" -> Level.WARN;
            case "ERROR" -> Level.ERROR;
            case "SILENT", "OFF" -> Level.OFF;
            default -> throw new IllegalArgumentException(
                    "Unknown log level '" + value + "', expected debug, info, warn, error or silent");
        };
    }

    private static void setLevel(String loggerName, String value) {
        if (!(LoggerFactory.getILoggerFactory() instanceof LoggerContext context)) {
            return;
        }
        Logger logger = context.getLogger(loggerName);
        logger.setLevel(parseLevel(value));
    }
}
