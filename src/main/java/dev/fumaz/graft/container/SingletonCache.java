package dev.fumaz.graft.container;

import dev.fumaz.graft.bind.Registration;
import dev.fumaz.graft.bind.ServiceKey;
import org.jetbrains.annotations.NotNull;

import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import java.util.logging.Logger;

/**
 * Process-lifetime cache of singleton instances, shared by every thread resolving from one container.
 * <p>
 * Hits are lock-free. A miss checks again, builds and stores under a single lock, so each registration is built at
 * most once even when many threads miss at the same time. The lock is reentrant because building a singleton may
 * build the singletons it depends on.
 */
final class SingletonCache {

    private static final Logger LOGGER = Logger.getLogger(SingletonCache.class.getName());

    private final ConcurrentMap<ServiceKey<?>, Entry> entries = new ConcurrentHashMap<>();
    private final ReentrantLock lock = new ReentrantLock();

    <T> @NotNull T getOrCreate(@NotNull Registration<T> registration, @NotNull Supplier<? extends T> supplier) {
        Objects.requireNonNull(registration, "registration");
        ServiceKey<T> key = registration.getKey();
        T cached = lookup(key, registration);

        if (cached != null) {
            return cached;
        }

        lock.lock();

        try {
            cached = lookup(key, registration);

            if (cached != null) {
                return cached;
            }

            T instance = supplier.get();
            entries.put(key, new Entry(registration, instance));
            LOGGER.finer(() -> "Built singleton " + key.describe());

            return instance;
        } finally {
            lock.unlock();
        }
    }

    int size() {
        return entries.size();
    }

    void clear() {
        lock.lock();

        try {
            entries.clear();
        } finally {
            lock.unlock();
        }
    }

    // entries built from a replaced registration are stale and count as misses
    private <T> T lookup(ServiceKey<T> key, Registration<T> registration) {
        Entry entry = entries.get(key);

        if (entry == null || entry.registration != registration) {
            return null;
        }

        return key.getType().cast(entry.instance);
    }

    private static final class Entry {
        private final Registration<?> registration;
        private final Object instance;

        private Entry(Registration<?> registration, Object instance) {
            this.registration = registration;
            this.instance = instance;
        }
    }
}
