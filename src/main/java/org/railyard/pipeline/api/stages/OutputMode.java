package org.railyard.pipeline.api.stages;

import java.util.Locale;

/**
 * How a stage delivers its outputs.
 */
public enum OutputMode {

    /** Outputs are written to disk, chunk by chunk where the stage streams. */
    DEFAULT,

    /** Outputs are kept in memory and handed back through the data store; no files are written. */
    RETURN;

    /**
     * Parses a configuration value, case-insensitively.
     *
     * @throws ConfigurationException for unknown values
     */
    public static OutputMode parse(String value) {
        try {
            return OutputMode.valueOf(value.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Unknown output mode '" + value + "'. Supported: default, return", e);
        }
    }
}
