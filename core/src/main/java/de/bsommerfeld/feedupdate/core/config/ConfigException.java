package de.bsommerfeld.feedupdate.core.config;

/**
 * Thrown when the updater configuration cannot be read, written or bound.
 */
public class ConfigException extends RuntimeException {

    public ConfigException(String message) {
        super(message);
    }

    public ConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
