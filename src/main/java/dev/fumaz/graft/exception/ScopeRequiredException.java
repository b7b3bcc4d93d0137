package dev.fumaz.graft.exception;

import dev.fumaz.graft.bind.ServiceKey;
import org.jetbrains.annotations.NotNull;

/**
 * Thrown when a scoped service is resolved while the calling thread has no active scope.
 */
public class ScopeRequiredException extends ScopeException {

    private final @NotNull ServiceKey<?> key;

    public ScopeRequiredException(@NotNull ServiceKey<?> key) {
        super("No active scope for scoped service " + key.describe());
        this.key = key;
    }

    public @NotNull ServiceKey<?> getKey() {
        return key;
    }
}
