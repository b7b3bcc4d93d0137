package dev.fumaz.graft.container;

import dev.fumaz.graft.bind.Lifetime;
import dev.fumaz.graft.bind.Registration;
import dev.fumaz.graft.bind.RegistrationBuilder;
import dev.fumaz.graft.bind.ServiceKey;
import dev.fumaz.graft.module.Module;
import dev.fumaz.graft.scope.ScopeHandle;
import org.jetbrains.annotations.NotNull;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * A {@link Container} maps service identities to registrations and builds object graphs from them, honoring each
 * registration's {@link Lifetime}.
 * <p>
 * Containers are safe for concurrent use. Registration is typically done once at startup; resolution may happen from
 * any number of threads. Scopes are per thread: each thread begins and ends its own.
 */
public interface Container {

    static @NotNull Container create(@NotNull List<Module> modules) {
        return new GraftContainer(modules);
    }

    static @NotNull Container create(@NotNull Module... modules) {
        return create(Arrays.asList(modules));
    }

    /**
     * Starts a registration of {@code type}. The registration is stored when a terminal {@code to...} method of the
     * returned builder is called, replacing any registration under the same type and key.
     */
    <T> @NotNull RegistrationBuilder<T> bind(@NotNull Class<T> type);

    @NotNull Container register(@NotNull Registration<?> registration);

    default <T> @NotNull Container register(@NotNull Class<T> type, @NotNull Lifetime lifetime) {
        bind(type).in(lifetime).toSelf();
        return this;
    }

    default <T> @NotNull Container register(@NotNull Class<T> type,
                                            @NotNull Class<? extends T> implementation,
                                            @NotNull Lifetime lifetime) {
        bind(type).in(lifetime).to(implementation);
        return this;
    }

    default <T> @NotNull Container registerKeyed(@NotNull Class<T> type,
                                                 @NotNull String key,
                                                 @NotNull Class<? extends T> implementation,
                                                 @NotNull Lifetime lifetime) {
        bind(type).named(key).in(lifetime).to(implementation);
        return this;
    }

    default <T> @NotNull Container registerInstance(@NotNull Class<T> type, @NotNull T instance) {
        bind(type).asSingleton().toInstance(instance);
        return this;
    }

    default <T> @NotNull Container registerKeyedInstance(@NotNull Class<T> type,
                                                         @NotNull String key,
                                                         @NotNull T instance) {
        bind(type).named(key).asSingleton().toInstance(instance);
        return this;
    }

    default <T> @NotNull Container registerFactory(@NotNull Class<T> type,
                                                   @NotNull Supplier<? extends T> factory,
                                                   @NotNull Lifetime lifetime) {
        bind(type).in(lifetime).toSupplier(factory);
        return this;
    }

    default <T> @NotNull Container registerKeyedFactory(@NotNull Class<T> type,
                                                        @NotNull String key,
                                                        @NotNull Supplier<? extends T> factory,
                                                        @NotNull Lifetime lifetime) {
        bind(type).named(key).in(lifetime).toSupplier(factory);
        return this;
    }

    /**
     * Resolves an instance of {@code key}, building its dependencies first.
     *
     * @throws dev.fumaz.graft.exception.NotRegisteredException if the key, or a dependency, has no registration
     * @throws dev.fumaz.graft.exception.CircularDependencyException if the dependency graph contains a cycle
     * @throws dev.fumaz.graft.exception.ScopeRequiredException if a scoped service is needed without an active scope
     * @throws dev.fumaz.graft.exception.ProvisionException if a constructor or factory fails
     */
    <T> @NotNull T resolve(@NotNull ServiceKey<T> key);

    default <T> @NotNull T resolve(@NotNull Class<T> type) {
        return resolve(ServiceKey.of(type));
    }

    default <T> @NotNull T resolveKeyed(@NotNull Class<T> type, @NotNull String key) {
        return resolve(ServiceKey.of(type, key));
    }

    /**
     * Like {@link #resolve(ServiceKey)}, but returns an empty result instead of failing when a registration is
     * missing. Every other failure still propagates.
     */
    <T> @NotNull Optional<T> tryResolve(@NotNull ServiceKey<T> key);

    default <T> @NotNull Optional<T> tryResolve(@NotNull Class<T> type) {
        return tryResolve(ServiceKey.of(type));
    }

    default <T> @NotNull Optional<T> tryResolveKeyed(@NotNull Class<T> type, @NotNull String key) {
        return tryResolve(ServiceKey.of(type, key));
    }

    /**
     * Resolves one instance per registration of {@code type}, unkeyed and keyed, in registration order. Each instance
     * follows the lifetime of its own registration.
     */
    <T> @NotNull List<T> getAll(@NotNull Class<T> type);

    boolean isRegistered(@NotNull ServiceKey<?> key);

    default boolean isRegistered(@NotNull Class<?> type) {
        return isRegistered(ServiceKey.of(type));
    }

    default boolean isRegistered(@NotNull Class<?> type, @NotNull String key) {
        return isRegistered(ServiceKey.of(type, key));
    }

    @NotNull List<Registration<?>> getRegistrations();

    /**
     * Begins a scope on the current thread.
     *
     * @throws dev.fumaz.graft.exception.ScopeAlreadyActiveException if the thread already has an active scope
     */
    @NotNull ScopeHandle beginScope();

    /**
     * Ends the current thread's scope, releasing its scoped instances.
     *
     * @throws dev.fumaz.graft.exception.NoActiveScopeException if the thread has no active scope
     */
    void endScope();

    boolean hasActiveScope();

    @NotNull Optional<ScopeHandle> currentScope();

    /**
     * Drops every registration and cached singleton, and ends the current thread's scope if one is active.
     */
    void clear();

}
