package dev.fumaz.graft.container;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

import org.jetbrains.annotations.NotNull;

import dev.fumaz.graft.bind.Registration;
import dev.fumaz.graft.bind.RegistrationBuilder;
import dev.fumaz.graft.bind.RegistrationStore;
import dev.fumaz.graft.bind.ServiceKey;
import dev.fumaz.graft.exception.NotRegisteredException;
import dev.fumaz.graft.exception.ProvisionException;
import dev.fumaz.graft.exception.ScopeRequiredException;
import dev.fumaz.graft.module.Module;
import dev.fumaz.graft.scope.ScopeContexts;
import dev.fumaz.graft.scope.ScopeHandle;
import dev.fumaz.graft.scope.ScopeState;

public class GraftContainer implements Container {

    private static final Logger LOGGER = Logger.getLogger(GraftContainer.class.getName());

    private final @NotNull RegistrationStore store;
    private final @NotNull SingletonCache singletons;
    private final @NotNull ScopeContexts scopes;

    public GraftContainer() {
        this(Collections.emptyList());
    }

    public GraftContainer(@NotNull List<Module> modules) {
        this.store = new RegistrationStore();
        this.singletons = new SingletonCache();
        this.scopes = new ScopeContexts();

        for (Module module : modules) {
            module.reset();
            module.configure();

            for (Registration<?> registration : module.getRegistrations()) {
                register(registration);
            }
        }
    }

    @Override
    public <T> @NotNull RegistrationBuilder<T> bind(@NotNull Class<T> type) {
        return new RegistrationBuilder<>(type, this::register);
    }

    @Override
    public @NotNull Container register(@NotNull Registration<?> registration) {
        Registration<?> previous = store.register(registration);

        if (previous != null) {
            LOGGER.fine(() -> "Replaced registration " + previous.describe() + " with " + registration.describe());
        }

        return this;
    }

    @Override
    public <T> @NotNull T resolve(@NotNull ServiceKey<T> key) {
        Objects.requireNonNull(key, "key");

        return resolveWithin(key, new ActiveResolution(this, scopes.current()));
    }

    @Override
    public <T> @NotNull Optional<T> tryResolve(@NotNull ServiceKey<T> key) {
        try {
            return Optional.of(resolve(key));
        } catch (NotRegisteredException e) {
            LOGGER.fine(() -> "Could not resolve " + key.describe() + ": " + e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public <T> @NotNull List<T> getAll(@NotNull Class<T> type) {
        List<Registration<T>> registrations = store.allFor(type);
        List<T> instances = new ArrayList<>(registrations.size());
        ScopeState scope = scopes.current();

        for (Registration<T> registration : registrations) {
            ActiveResolution resolution = new ActiveResolution(this, scope);
            ResolutionStack stack = resolution.stack();
            ServiceKey<T> key = registration.getKey();

            stack.push(key);

            try {
                instances.add(provision(registration, resolution));
            } finally {
                stack.pop(key);
            }
        }

        return instances;
    }

    @Override
    public boolean isRegistered(@NotNull ServiceKey<?> key) {
        return store.isRegistered(key);
    }

    @Override
    public @NotNull List<Registration<?>> getRegistrations() {
        return Collections.unmodifiableList(store.all());
    }

    @Override
    public @NotNull ScopeHandle beginScope() {
        return scopes.begin();
    }

    @Override
    public void endScope() {
        scopes.end();
    }

    @Override
    public boolean hasActiveScope() {
        return scopes.isActive();
    }

    @Override
    public @NotNull Optional<ScopeHandle> currentScope() {
        return Optional.ofNullable(scopes.currentHandle());
    }

    @Override
    public void clear() {
        store.clear();
        singletons.clear();

        if (scopes.isActive()) {
            scopes.end();
        }
    }

    <T> @NotNull T resolveWithin(@NotNull ServiceKey<T> key, @NotNull ActiveResolution resolution) {
        ResolutionStack stack = resolution.stack();
        stack.push(key);

        try {
            Registration<T> registration = store.lookup(key);

            if (registration == null) {
                throw new NotRegisteredException(key, stack.snapshot());
            }

            return provision(registration, resolution);
        } finally {
            stack.pop(key);
        }
    }

    private <T> @NotNull T provision(@NotNull Registration<T> registration, @NotNull ActiveResolution resolution) {
        switch (registration.getLifetime()) {
            case SINGLETON:
                return singletons.getOrCreate(registration, () -> build(registration, resolution));
            case SCOPED:
                ScopeState scope = resolution.scope();

                if (scope == null) {
                    throw new ScopeRequiredException(registration.getKey());
                }

                return scope.getOrCreate(registration, () -> build(registration, resolution));
            case TRANSIENT:
            default:
                return build(registration, resolution);
        }
    }

    private <T> @NotNull T build(@NotNull Registration<T> registration, @NotNull ActiveResolution resolution) {
        T instance = registration.getProvider().provide(resolution);

        if (instance == null) {
            throw new ProvisionException("Provider for " + registration.getKey().describe() + " produced null");
        }

        return instance;
    }

    @Override
    public String toString() {
        return "GraftContainer{registrations=" + store.size() + ", singletons=" + singletons.size() + "}";
    }

}
