package dev.fumaz.graft.exception;

/**
 * Base exception for misuse of scopes.
 */
public class ScopeException extends GraftException {

    public ScopeException(String message) {
        super(message);
    }
}
