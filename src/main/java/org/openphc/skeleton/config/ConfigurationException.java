package org.openphc.skeleton.config;

/**
 * Thrown when configuration cannot be loaded or fails validation. Always fatal at startup.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
