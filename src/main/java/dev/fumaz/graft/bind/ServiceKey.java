package dev.fumaz.graft.bind;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/**
 * Identifies a registration: the service type plus an optional key telling apart several registrations of the same
 * type. A {@code null} name denotes the default, unkeyed registration.
 *
 * @param <T> the service type
 */
public final class ServiceKey<T> {

    private final @NotNull Class<T> type;
    private final @Nullable String name;
    private final int hash;

    private ServiceKey(@NotNull Class<T> type, @Nullable String name) {
        this.type = Objects.requireNonNull(type, "type");
        this.name = name;
        this.hash = 31 * type.hashCode() + Objects.hashCode(name);
    }

    public static <T> @NotNull ServiceKey<T> of(@NotNull Class<T> type) {
        return new ServiceKey<>(type, null);
    }

    public static <T> @NotNull ServiceKey<T> of(@NotNull Class<T> type, @Nullable String name) {
        return new ServiceKey<>(type, name);
    }

    public @NotNull Class<T> getType() {
        return type;
    }

    public @Nullable String getName() {
        return name;
    }

    public boolean isKeyed() {
        return name != null;
    }

    public String describe() {
        return isKeyed() ? type.getName() + " [key=" + name + "]" : type.getName();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }

        if (!(o instanceof ServiceKey)) {
            return false;
        }

        ServiceKey<?> that = (ServiceKey<?>) o;
        return type == that.type && Objects.equals(name, that.name);
    }

    @Override
    public int hashCode() {
        return hash;
    }

    @Override
    public String toString() {
        return describe();
    }
}
