package dev.fumaz.graft.exception;

import org.jetbrains.annotations.NotNull;

import java.util.UUID;

/**
 * Thrown when a scope is begun while another one is still active on the calling thread. Scopes do not nest.
 */
public class ScopeAlreadyActiveException extends ScopeException {

    private final @NotNull UUID activeScope;

    public ScopeAlreadyActiveException(@NotNull UUID activeScope) {
        super("Scope " + activeScope + " is already active on the current thread");
        this.activeScope = activeScope;
    }

    public @NotNull UUID getActiveScope() {
        return activeScope;
    }
}
