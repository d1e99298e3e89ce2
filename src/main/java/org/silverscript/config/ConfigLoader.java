package org.silverscript.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;

/**
 * Responsible for loading the debugger configuration from various sources.
 * The loader respects a specific precedence order to allow for flexible configuration.
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);
    private static final String CONFIG_FILE_NAME = "silverscript.conf";

    private ConfigLoader() {
        // Private constructor to prevent instantiation
    }

    /**
     * Loads the configuration, respecting the precedence order:
     * 1. Environment Variables
     * 2. Java System Properties, e.g. {@code -Dsilverscript.debugger.max-steps=500}
     * 3. Configuration File ({@code silverscript.conf} in the working directory)
     * 4. Default values (from {@code reference.conf} on the classpath)
     *
     * @return A resolved {@link Config} object containing the merged configuration.
     */
    public static Config load() {
        return load(new File(CONFIG_FILE_NAME));
    }

    /**
     * Loads the configuration with an explicit configuration file in place of {@code silverscript.conf}.
     *
     * @param configFile The file layered between system properties and the defaults; skipped if it does not exist.
     * @return A resolved {@link Config} object containing the merged configuration.
     */
    public static Config load(File configFile) {
        final Config envConfig = ConfigFactory.systemEnvironment();
        final Config cliConfig = ConfigFactory.systemProperties();

        final Config fileConfig;
        if (configFile.exists() && !configFile.isDirectory()) {
            LOG.info("Loading configuration from file: {}", configFile.getAbsolutePath());
            fileConfig = ConfigFactory.parseFile(configFile);
        } else {
            LOG.debug("Configuration file '{}' not found or is a directory. Skipping file-based configuration.", configFile.getPath());
            fileConfig = ConfigFactory.empty();
        }

        final Config defaultConfig = ConfigFactory.parseResources("reference.conf");

        // The one provided first wins.
        final Config combinedConfig = envConfig
            .withFallback(cliConfig)
            .withFallback(fileConfig)
            .withFallback(defaultConfig);

        return combinedConfig.resolve();
    }
}
