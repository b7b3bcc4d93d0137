package dev.fumaz.graft.exception;

/**
 * Indicates an invalid registration, detected when the registration is made.
 */
public class ConfigurationException extends GraftException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
