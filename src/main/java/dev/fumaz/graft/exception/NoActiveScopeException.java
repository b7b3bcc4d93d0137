package dev.fumaz.graft.exception;

/**
 * Thrown when a scope is ended while none is active on the calling thread.
 */
public class NoActiveScopeException extends ScopeException {

    public NoActiveScopeException() {
        super("No scope is active on the current thread");
    }
}
