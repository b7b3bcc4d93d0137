package dev.fumaz.graft.bind;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Stores registrations by {@link ServiceKey}. Registering under an existing key replaces the previous registration
 * and keeps its position in the insertion order. The store never builds anything.
 * <p>
 * Lookups are lock-free; writes are serialized.
 */
public final class RegistrationStore {

    private final Map<ServiceKey<?>, Registration<?>> registrations = new ConcurrentHashMap<>();
    private final Map<Class<?>, List<ServiceKey<?>>> keysByType = new ConcurrentHashMap<>();
    private final List<ServiceKey<?>> insertionOrder = new CopyOnWriteArrayList<>();
    private final Object lock = new Object();

    /**
     * Stores {@code registration}, replacing any registration under the same key.
     *
     * @return the replaced registration, or {@code null} if the key was free
     */
    public @Nullable Registration<?> register(@NotNull Registration<?> registration) {
        Objects.requireNonNull(registration, "registration");
        ServiceKey<?> key = registration.getKey();

        synchronized (lock) {
            Registration<?> previous = registrations.put(key, registration);

            if (previous == null) {
                keysByType.computeIfAbsent(key.getType(), ignored -> new CopyOnWriteArrayList<>()).add(key);
                insertionOrder.add(key);
            }

            return previous;
        }
    }

    @SuppressWarnings("unchecked")
    public <T> @Nullable Registration<T> lookup(@NotNull ServiceKey<T> key) {
        return (Registration<T>) registrations.get(key);
    }

    public boolean isRegistered(@NotNull ServiceKey<?> key) {
        return registrations.containsKey(key);
    }

    /**
     * @return every registration of {@code type}, unkeyed and keyed, in insertion order
     */
    @SuppressWarnings("unchecked")
    public <T> @NotNull List<Registration<T>> allFor(@NotNull Class<T> type) {
        List<ServiceKey<?>> keys = keysByType.get(type);

        if (keys == null) {
            return Collections.emptyList();
        }

        List<Registration<T>> matches = new ArrayList<>(keys.size());

        for (ServiceKey<?> key : keys) {
            Registration<?> registration = registrations.get(key);

            if (registration != null) {
                matches.add((Registration<T>) registration);
            }
        }

        return matches;
    }

    public @NotNull List<Registration<?>> all() {
        List<Registration<?>> all = new ArrayList<>(insertionOrder.size());

        for (ServiceKey<?> key : insertionOrder) {
            Registration<?> registration = registrations.get(key);

            if (registration != null) {
                all.add(registration);
            }
        }

        return all;
    }

    public int size() {
        return registrations.size();
    }

    public boolean isEmpty() {
        return registrations.isEmpty();
    }

    public void clear() {
        synchronized (lock) {
            registrations.clear();
            keysByType.clear();
            insertionOrder.clear();
        }
    }

}
