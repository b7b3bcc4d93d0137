package dev.fumaz.graft.exception;

/**
 * Signals a failure inside user code while building or releasing an instance: a throwing constructor or factory,
 * a factory returning {@code null}, or a scoped instance failing to close.
 */
public class ProvisionException extends GraftException {

    public ProvisionException(String message) {
        super(message);
    }

    public ProvisionException(String message, Throwable cause) {
        super(message, cause);
    }
}
