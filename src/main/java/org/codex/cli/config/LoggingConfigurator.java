package org.codex.cli.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import com.typesafe.config.Config;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Applies the {@code logging} section of the configuration to Logback.
 * <pre>
 * logging {
 *   default-level = WARN
 *   levels { "org.codex.compiler" = DEBUG }
 * }
 * </pre>
 */
public final class LoggingConfigurator {

    private LoggingConfigurator() {
    }

    /**
     * Sets the root level and per-logger levels. Does nothing if SLF4J is not bound to Logback.
     * @param config The application configuration.
     */
    public static void configure(Config config) {
        ILoggerFactory factory = LoggerFactory.getILoggerFactory();
        if (!(factory instanceof LoggerContext context)) {
            return;
        }
        if (config.hasPath("logging.default-level")) {
            Level level = Level.toLevel(config.getString("logging.default-level"), Level.INFO);
            context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME).setLevel(level);
        }
        if (config.hasPath("logging.levels")) {
            for (Map.Entry<String, Object> entry : config.getConfig("logging.levels").root().unwrapped().entrySet()) {
                Logger logger = context.getLogger(entry.getKey());
                logger.setLevel(Level.toLevel(String.valueOf(entry.getValue()), null));
            }
        }
    }
}
