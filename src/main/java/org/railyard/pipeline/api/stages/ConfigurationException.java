package org.railyard.pipeline.api.stages;

/**
 * Thrown when stage or pipeline configuration is invalid: a missing required parameter,
 * an unknown parameter, a value of the wrong type, or an inconsistent declaration.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
