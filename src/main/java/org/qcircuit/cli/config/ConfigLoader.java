package org.qcircuit.cli.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

import java.io.File;

/**
 * Builds the CLI configuration.
 * <p>
 * Values are layered as system properties, then environment variables, then at most one user
 * file, then {@code reference.conf}. The user file is the {@code --config} argument, else
 * {@code -Dconfig.file}, else {@code config/qcircuit.conf} in the working directory.
 */
public final class ConfigLoader {

    static final File WORKING_DIR_CONFIG = new File("config", "qcircuit.conf");

    private ConfigLoader() {
    }

    /**
     * Receives a line describing which user file was picked.
     */
    @FunctionalInterface
    public interface ConfigMessageHandler {
        void log(String message);
    }

    /**
     * @param explicitConfigFile The {@code --config} argument, or null.
     * @param handler Receives the file selection message.
     * @return The resolved configuration.
     * @throws IllegalArgumentException if {@code --config} or {@code -Dconfig.file} names a
     *                                  missing file.
     * @throws com.typesafe.config.ConfigException if the chosen file does not parse or resolve.
     */
    public static Config resolve(final File explicitConfigFile, final ConfigMessageHandler handler) {
        if (explicitConfigFile != null) {
            return loadNamed(explicitConfigFile, "--config", handler);
        }
        final String property = System.getProperty("config.file");
        if (property != null && !property.isBlank()) {
            return loadNamed(new File(property).getAbsoluteFile(), "-Dconfig.file", handler);
        }
        if (WORKING_DIR_CONFIG.exists()) {
            handler.log("Using " + WORKING_DIR_CONFIG.getAbsolutePath());
            return loadFromFile(WORKING_DIR_CONFIG);
        }
        handler.log("No " + WORKING_DIR_CONFIG.getPath() + ", using built-in defaults");
        return loadDefaults();
    }

    private static Config loadNamed(File file, String origin, ConfigMessageHandler handler) {
        if (!file.exists()) {
            throw new IllegalArgumentException("Configuration file not found: " + file.getAbsolutePath()
                    + " (" + origin + ")");
        }
        handler.log("Using " + file.getAbsolutePath() + " (" + origin + ")");
        return loadFromFile(file);
    }

    static Config loadFromFile(final File configFile) {
        return overrides()
                .withFallback(ConfigFactory.parseFile(configFile))
                .withFallback(ConfigFactory.defaultReferenceUnresolved())
                .resolve();
    }

    static Config loadDefaults() {
        return overrides()
                .withFallback(ConfigFactory.defaultReferenceUnresolved())
                .resolve();
    }

    private static Config overrides() {
        return ConfigFactory.systemProperties().withFallback(ConfigFactory.systemEnvironment());
    }
}
