package dev.fumaz.graft.bind;

import dev.fumaz.graft.provider.BuildStrategy;
import dev.fumaz.graft.provider.Provider;
import org.jetbrains.annotations.NotNull;

import java.util.List;
import java.util.Objects;

/**
 * A {@link Registration} describes how a service is built and how long its instances live. Registrations are
 * immutable; registering again under the same {@link ServiceKey} replaces them wholesale.
 *
 * @param <T> the type of the service
 */
public final class Registration<T> {

    private final @NotNull ServiceKey<T> key;
    private final @NotNull Lifetime lifetime;
    private final @NotNull Provider<? extends T> provider;

    public Registration(@NotNull ServiceKey<T> key,
                        @NotNull Lifetime lifetime,
                        @NotNull Provider<? extends T> provider) {
        this.key = Objects.requireNonNull(key, "key");
        this.lifetime = Objects.requireNonNull(lifetime, "lifetime");
        this.provider = Objects.requireNonNull(provider, "provider");
    }

    public @NotNull ServiceKey<T> getKey() {
        return key;
    }

    public @NotNull Class<T> getType() {
        return key.getType();
    }

    public @NotNull Lifetime getLifetime() {
        return lifetime;
    }

    public @NotNull Provider<? extends T> getProvider() {
        return provider;
    }

    public @NotNull BuildStrategy getStrategy() {
        return provider.getStrategy();
    }

    public @NotNull List<ServiceKey<?>> getDependencies() {
        return provider.getDependencies();
    }

    public String describe() {
        return key.describe() + " [lifetime=" + lifetime + ", " + provider + "]";
    }

    @Override
    public String toString() {
        return "Registration{" + describe() + "}";
    }
}
