package org.sprig.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;

/**
 * Responsible for loading the application configuration from various sources.
 * The loader respects a specific precedence order to allow for flexible configuration:
 * <ol>
 *     <li>Java system properties, e.g. {@code -Dscanner.source-name=main.sprig}</li>
 *     <li>Environment variables</li>
 *     <li>The configuration file ({@code sprig.conf} in the working directory, or an explicit classpath resource)</li>
 *     <li>Default values from {@code reference.conf} on the classpath</li>
 * </ol>
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);
    private static final String CONFIG_FILE_NAME = "sprig.conf";
    private static final String REFERENCE_RESOURCE = "reference.conf";

    private ConfigLoader() {
        // Private constructor to prevent instantiation
    }

    /**
     * Loads the configuration, using {@code sprig.conf} from the working directory if present.
     *
     * @return A resolved {@link Config} containing the merged configuration.
     */
    public static Config load() {
        final File configFile = new File(CONFIG_FILE_NAME);
        final Config fileConfig;
        if (configFile.exists() && !configFile.isDirectory()) {
            LOG.info("Loading configuration from file: {}", configFile.getAbsolutePath());
            fileConfig = ConfigFactory.parseFile(configFile);
        } else {
            LOG.debug("Configuration file '{}' not found. Using defaults.", configFile.getPath());
            fileConfig = ConfigFactory.empty();
        }
        return merge(fileConfig);
    }

    /**
     * Loads the configuration with the given classpath resource in place of {@code sprig.conf}.
     *
     * @param resource The classpath resource, e.g. {@code org/sprig/config/test-config.conf}.
     * @return A resolved {@link Config} containing the merged configuration.
     */
    public static Config load(final String resource) {
        LOG.info("Loading configuration from resource: {}", resource);
        return merge(ConfigFactory.parseResources(resource));
    }

    private static Config merge(final Config fileConfig) {
        // The one provided first wins.
        final Config combinedConfig = ConfigFactory.systemProperties()
            .withFallback(ConfigFactory.systemEnvironment())
            .withFallback(fileConfig)
            .withFallback(ConfigFactory.parseResources(REFERENCE_RESOURCE));

        // Resolve all substitutions (e.g., ${?some_value}) within the configuration.
        return combinedConfig.resolve();
    }
}
