package dev.fumaz.graft.scope;

import org.jetbrains.annotations.NotNull;

import java.util.UUID;

/**
 * Represents a scope begun on the current thread. Closing the handle ends the scope, releasing its scoped instances,
 * so a try-with-resources block ends the scope on every exit path.
 */
public interface ScopeHandle extends AutoCloseable {

    /**
     * @return the unique token of the scope
     */
    @NotNull UUID getId();

    /**
     * @return whether the scope has not ended yet
     */
    boolean isActive();

    /**
     * Ends the scope if it is still active. Does nothing if the scope already ended.
     *
     * @throws IllegalStateException if the scope is active on another thread
     */
    @Override
    void close();
}
