package dev.fumaz.graft.scope;

import dev.fumaz.graft.bind.Registration;
import dev.fumaz.graft.bind.ServiceKey;
import dev.fumaz.graft.exception.ProvisionException;
import dev.fumaz.graft.provider.BuildStrategy;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Holds the scoped instances created while a scope is active. A scope belongs to the thread that began it and is
 * only ever touched by that thread, so it needs no locking.
 */
public final class ScopeState {

    private static final Logger LOGGER = Logger.getLogger(ScopeState.class.getName());

    private final UUID id = UUID.randomUUID();
    private final Map<ServiceKey<?>, ScopedInstance> instances = new HashMap<>();
    private final List<ScopedInstance> created = new ArrayList<>();
    private volatile boolean ended;

    ScopeState() {
    }

    public @NotNull UUID getId() {
        return id;
    }

    public boolean isEnded() {
        return ended;
    }

    /**
     * Returns the instance this scope holds for the registration, building and storing one on a miss. An instance
     * built from a registration that has since been replaced counts as a miss.
     */
    public <T> @NotNull T getOrCreate(@NotNull Registration<T> registration, @NotNull Supplier<? extends T> supplier) {
        Objects.requireNonNull(registration, "registration");
        Objects.requireNonNull(supplier, "supplier");

        if (ended) {
            throw new IllegalStateException("Scope " + id + " has already ended");
        }

        ServiceKey<T> key = registration.getKey();
        ScopedInstance cached = instances.get(key);

        if (cached != null && cached.registration == registration) {
            return key.getType().cast(cached.instance);
        }

        T instance = supplier.get();
        ScopedInstance entry = new ScopedInstance(registration, instance);

        instances.put(key, entry);
        created.add(entry);

        return instance;
    }

    public int size() {
        return instances.size();
    }

    /**
     * Purges every instance and closes the ones the scope built that implement {@link AutoCloseable}, newest first.
     */
    void end() {
        if (ended) {
            return;
        }

        ended = true;
        ProvisionException failure = null;

        for (int i = created.size() - 1; i >= 0; i--) {
            ScopedInstance entry = created.get(i);

            if (!(entry.instance instanceof AutoCloseable)
                    || entry.registration.getStrategy() == BuildStrategy.INSTANCE) {
                continue;
            }

            try {
                ((AutoCloseable) entry.instance).close();
            } catch (Exception e) {
                LOGGER.log(Level.WARNING, "Failed to close scoped instance of "
                        + entry.registration.getKey().describe() + " in scope " + id, e);

                if (failure == null) {
                    failure = new ProvisionException("Failed to close scoped instances of scope " + id, e);
                } else {
                    failure.addSuppressed(e);
                }
            }
        }

        instances.clear();
        created.clear();

        if (failure != null) {
            throw failure;
        }
    }

    private static final class ScopedInstance {
        private final Registration<?> registration;
        private final Object instance;

        private ScopedInstance(Registration<?> registration, Object instance) {
            this.registration = registration;
            this.instance = instance;
        }
    }
}
