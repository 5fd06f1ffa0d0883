package org.conductor.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;

/**
 * Responsible for loading the application configuration from various sources.
 * The loader respects a specific precedence order to allow for flexible configuration.
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);
    public static final String CONFIG_FILE_NAME = "conductor.conf";

    private ConfigLoader() {
        // Private constructor to prevent instantiation
    }

    /**
     * Loads the configuration with {@code conductor.conf} in the working directory as the file source.
     *
     * @return The resolved configuration.
     */
    public static Config load() {
        return load(null);
    }

    /**
     * Loads the application configuration, respecting the precedence order:
     * 1. Environment Variables
     * 2. Java System Properties (e.g., -Dconductor.options.verbose=true)
     * 3. Configuration File (the given file, or conductor.conf in the working directory)
     * 4. Default values (from reference.conf on the classpath)
     *
     * @param configFile Explicit configuration file, or null to look for conductor.conf.
     * @return A resolved {@link Config} object containing the merged configuration.
     * @throws IllegalArgumentException if an explicit file was given but does not exist.
     */
    public static Config load(final File configFile) {
        final Config envConfig = ConfigFactory.systemEnvironment();
        final Config cliConfig = ConfigFactory.systemProperties();

        final Config fileConfig;
        if (configFile != null) {
            if (!configFile.isFile()) {
                throw new IllegalArgumentException("Configuration file not found: " + configFile.getAbsolutePath());
            }
            LOG.info("Loading configuration from file: {}", configFile.getAbsolutePath());
            fileConfig = ConfigFactory.parseFile(configFile);
        } else {
            final File defaultFile = new File(CONFIG_FILE_NAME);
            if (defaultFile.isFile()) {
                LOG.info("Loading configuration from file: {}", defaultFile.getAbsolutePath());
                fileConfig = ConfigFactory.parseFile(defaultFile);
            } else {
                LOG.info("Configuration file '{}' not found or is a directory. Skipping file-based configuration.", defaultFile.getPath());
                fileConfig = ConfigFactory.empty();
            }
        }

        final Config defaultConfig = ConfigFactory.parseResources("reference.conf");

        // The one provided first wins.
        return envConfig
            .withFallback(cliConfig)
            .withFallback(fileConfig)
            .withFallback(defaultConfig)
            .resolve();
    }
}
