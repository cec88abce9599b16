package com.repo.scopemetrics.config;

/**
 * A rule option or configuration file has the wrong shape.
 * Raised while loading configuration, before any document is analysed.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
