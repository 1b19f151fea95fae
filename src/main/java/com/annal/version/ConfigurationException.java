package com.annal.version;

/**
 * A record type or versioning setting is unusable. Raised at construction time.
 */
public class ConfigurationException extends RuntimeException {
    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
