package org.qcircuit.cli.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigValue;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Applies the {@code logging.levels} section of the config to the Logback loggers, e.g.
 * {@code logging.levels { "org.qcircuit.frontend" = DEBUG }}.
 */
public final class LoggingConfigurator {

    private LoggingConfigurator() {
    }

    /**
     * @param config The resolved application config.
     */
    public static void configure(Config config) {
        if (!config.hasPath("logging.levels")) {
            return;
        }
        if (!(LoggerFactory.getILoggerFactory() instanceof LoggerContext context)) {
            return;
        }
        for (Map.Entry<String, ConfigValue> entry : config.getObject("logging.levels").entrySet()) {
            String loggerName = entry.getKey().replace("\"", "");
            Level level = Level.toLevel(String.valueOf(entry.getValue().unwrapped()), Level.INFO);
            context.getLogger(loggerName).setLevel(level);
        }
    }
}
