package dev.fumaz.graft.container;

import dev.fumaz.graft.bind.ServiceKey;
import dev.fumaz.graft.context.ResolutionContext;
import dev.fumaz.graft.scope.ScopeState;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.UUID;

/**
 * One top-level resolve call: its resolution stack and the scope that was active when it started.
 */
final class ActiveResolution implements ResolutionContext {

    private final @NotNull GraftContainer container;
    private final @NotNull ResolutionStack stack;
    private final @Nullable ScopeState scope;

    ActiveResolution(@NotNull GraftContainer container, @Nullable ScopeState scope) {
        this.container = container;
        this.stack = new ResolutionStack();
        this.scope = scope;
    }

    @Override
    public @NotNull Container getContainer() {
        return container;
    }

    @Override
    public @NotNull ServiceKey<?> getRequested() {
        return stack.peek();
    }

    @Override
    public @NotNull List<ServiceKey<?>> getPath() {
        return stack.snapshot();
    }

    @Override
    public @Nullable UUID getScope() {
        return scope == null ? null : scope.getId();
    }

    @Override
    public <T> @NotNull T resolve(@NotNull ServiceKey<T> key) {
        return container.resolveWithin(key, this);
    }

    @NotNull ResolutionStack stack() {
        return stack;
    }

    @Nullable ScopeState scope() {
        return scope;
    }
}
