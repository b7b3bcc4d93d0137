package dev.fumaz.graft.context;

import dev.fumaz.graft.bind.ServiceKey;
import dev.fumaz.graft.container.Container;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.UUID;

/**
 * The view a {@link dev.fumaz.graft.provider.Provider} gets of the resolve call it is building an instance for.
 * Dependencies resolved through a context share the call's resolution stack and its active scope.
 */
public interface ResolutionContext {

    @NotNull Container getContainer();

    /**
     * @return the identity whose instance is being built
     */
    @NotNull ServiceKey<?> getRequested();

    /**
     * @return the identities currently being resolved, outermost first
     */
    @NotNull List<ServiceKey<?>> getPath();

    /**
     * @return the token of the scope the call resolves scoped services in, or {@code null} when there is none
     */
    @Nullable UUID getScope();

    <T> @NotNull T resolve(@NotNull ServiceKey<T> key);

    default <T> @NotNull T resolve(@NotNull Class<T> type) {
        return resolve(ServiceKey.of(type));
    }

}
