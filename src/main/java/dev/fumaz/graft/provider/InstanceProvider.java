package dev.fumaz.graft.provider;

import dev.fumaz.graft.bind.ServiceKey;
import dev.fumaz.graft.context.ResolutionContext;
import org.jetbrains.annotations.NotNull;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * An {@link InstanceProvider} is a {@link Provider} that returns the same prebuilt instance on every call, whatever
 * lifetime it is registered with.
 *
 * @param <T> the type of the service
 */
public class InstanceProvider<T> implements Provider<T> {

    private final @NotNull T instance;

    public InstanceProvider(@NotNull T instance) {
        this.instance = Objects.requireNonNull(instance, "instance");
    }

    @Override
    public @NotNull BuildStrategy getStrategy() {
        return BuildStrategy.INSTANCE;
    }

    @Override
    public @NotNull List<ServiceKey<?>> getDependencies() {
        return Collections.emptyList();
    }

    @Override
    public @NotNull T provide(@NotNull ResolutionContext context) {
        return instance;
    }

    @Override
    public String toString() {
        return "instance of " + instance.getClass().getName();
    }

}
