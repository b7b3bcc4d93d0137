package dev.fumaz.graft.scope;

import dev.fumaz.graft.exception.NoActiveScopeException;
import dev.fumaz.graft.exception.ScopeAlreadyActiveException;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.UUID;
import java.util.logging.Logger;

/**
 * Tracks the active scope of each thread for one container. A thread has at most one active scope; scopes do not
 * nest.
 */
public final class ScopeContexts {

    private static final Logger LOGGER = Logger.getLogger(ScopeContexts.class.getName());

    private final ThreadLocal<Handle> active = new ThreadLocal<>();

    /**
     * Begins a new scope on the current thread.
     *
     * @throws ScopeAlreadyActiveException if the thread already has an active scope
     */
    public @NotNull ScopeHandle begin() {
        Handle current = active.get();

        if (current != null) {
            throw new ScopeAlreadyActiveException(current.getId());
        }

        Handle handle = new Handle(new ScopeState());
        active.set(handle);
        LOGGER.fine(() -> "Began scope " + handle.getId() + " on " + Thread.currentThread().getName());

        return handle;
    }

    /**
     * Ends the current thread's scope. The thread has no active scope afterwards, even if closing a scoped instance
     * fails.
     *
     * @throws NoActiveScopeException if the thread has no active scope
     */
    public void end() {
        Handle handle = active.get();

        if (handle == null) {
            throw new NoActiveScopeException();
        }

        ScopeState state = handle.state;
        active.remove();
        LOGGER.fine(() -> "Ending scope " + state.getId() + " with " + state.size() + " scoped instances");
        state.end();
    }

    public @Nullable ScopeState current() {
        Handle handle = active.get();
        return handle == null ? null : handle.state;
    }

    public @Nullable ScopeHandle currentHandle() {
        return active.get();
    }

    public boolean isActive() {
        return active.get() != null;
    }

    private final class Handle implements ScopeHandle {

        private final ScopeState state;

        private Handle(ScopeState state) {
            this.state = state;
        }

        @Override
        public @NotNull UUID getId() {
            return state.getId();
        }

        @Override
        public boolean isActive() {
            return !state.isEnded();
        }

        @Override
        public void close() {
            if (state.isEnded()) {
                return;
            }

            if (active.get() != this) {
                throw new IllegalStateException("Scope " + state.getId() + " is not active on the current thread");
            }

            end();
        }

        @Override
        public String toString() {
            return "ScopeHandle{" + state.getId() + (state.isEnded() ? ", ended" : "") + "}";
        }
    }
}
