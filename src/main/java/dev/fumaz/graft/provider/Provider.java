package dev.fumaz.graft.provider;

import dev.fumaz.graft.bind.ServiceKey;
import dev.fumaz.graft.context.ResolutionContext;
import org.jetbrains.annotations.NotNull;

import java.util.List;

/**
 * A {@link Provider} builds instances of a service. Lifetime caching is applied around it by the container, so a
 * provider builds a new instance on every call unless it holds a prebuilt one.
 *
 * @param <T> the type of the service
 */
public interface Provider<T> {

    @NotNull BuildStrategy getStrategy();

    /**
     * The identities this provider resolves before building, in the order they are resolved.
     */
    @NotNull List<ServiceKey<?>> getDependencies();

    @NotNull T provide(@NotNull ResolutionContext context);

}
