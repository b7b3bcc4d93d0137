package dev.fumaz.graft.exception;

/**
 * Base unchecked exception for every failure raised by the registry.
 */
public class GraftException extends RuntimeException {

    public GraftException(String message) {
        super(message);
    }

    public GraftException(String message, Throwable cause) {
        super(message, cause);
    }
}
