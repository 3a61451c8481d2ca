package org.sprig.compiler.frontend.scanner;

import com.typesafe.config.Config;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Settings for a scan pass.
 *
 * @param sourceName The logical name of the scanned source, used in logs and diagnostics.
 */
public record ScannerOptions(String sourceName) {

    private static final Logger LOG = LoggerFactory.getLogger(ScannerOptions.class);

    /** Source name used when none is configured. */
    public static final String DEFAULT_SOURCE_NAME = "<memory>";

    private static final String SOURCE_NAME_PATH = "scanner.source-name";

    public ScannerOptions {
        if (sourceName == null || sourceName.isBlank()) {
            throw new IllegalArgumentException("Source name must not be blank");
        }
    }

    public static ScannerOptions defaults() {
        return new ScannerOptions(DEFAULT_SOURCE_NAME);
    }

    /**
     * Reads the options from the {@code scanner} section of the configuration.
     * Missing keys fall back to the defaults.
     *
     * @param config The application configuration.
     * @return The scanner options.
     */
    public static ScannerOptions fromConfig(Config config) {
        if (!config.hasPath(SOURCE_NAME_PATH)) {
            return defaults();
        }
        String sourceName = config.getString(SOURCE_NAME_PATH);
        if (sourceName.isBlank()) {
            LOG.warn("Configured '{}' is blank, using '{}'.", SOURCE_NAME_PATH, DEFAULT_SOURCE_NAME);
            return defaults();
        }
        return new ScannerOptions(sourceName);
    }

    /**
     * Returns a copy of these options for another source.
     * @param newSourceName The logical name of the source.
     * @return The new options.
     */
    public ScannerOptions withSourceName(String newSourceName) {
        return new ScannerOptions(newSourceName);
    }
}
