package dev.fumaz.graft.exception;

/**
 * Thrown by the process-wide facade when it is used before being configured.
 */
public class ContainerNotConfiguredException extends GraftException {

    public ContainerNotConfiguredException() {
        super("Graft is not configured. Call Graft.configure(...) first");
    }
}
