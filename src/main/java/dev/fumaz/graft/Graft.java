package dev.fumaz.graft;

import dev.fumaz.graft.container.Container;
import dev.fumaz.graft.exception.ConfigurationException;
import dev.fumaz.graft.exception.ContainerNotConfiguredException;
import dev.fumaz.graft.module.Module;
import dev.fumaz.graft.scope.ScopeHandle;
import org.jetbrains.annotations.NotNull;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.logging.Logger;

/**
 * Process-wide access to a single {@link Container}.
 * <p>
 * The container exists only between an explicit {@link #configure(Consumer)} and {@link #reset()}; it is never
 * created implicitly. Every other method fails with {@link ContainerNotConfiguredException} outside that window.
 */
public final class Graft {

    private static final Logger LOGGER = Logger.getLogger(Graft.class.getName());
    private static final Object LOCK = new Object();

    private static volatile Container container;

    private Graft() {
    }

    /**
     * Creates the process-wide container and lets {@code configuration} register its services.
     *
     * @throws ConfigurationException if the container is already configured
     */
    public static void configure(@NotNull Consumer<? super Container> configuration) {
        Objects.requireNonNull(configuration, "configuration");

        synchronized (LOCK) {
            if (container != null) {
                throw new ConfigurationException("Graft is already configured");
            }

            Container created = Container.create();
            configuration.accept(created);
            container = created;

            LOGGER.fine(() -> "Configured " + created);
        }
    }

    public static void configure(@NotNull Module... modules) {
        List<Module> list = Arrays.asList(modules);

        synchronized (LOCK) {
            if (container != null) {
                throw new ConfigurationException("Graft is already configured");
            }

            container = Container.create(list);
        }
    }

    public static boolean isConfigured() {
        return container != null;
    }

    /**
     * Discards the process-wide container. Mainly used to isolate tests from each other.
     */
    public static void reset() {
        synchronized (LOCK) {
            container = null;
        }
    }

    public static @NotNull Container container() {
        Container current = container;

        if (current == null) {
            throw new ContainerNotConfiguredException();
        }

        return current;
    }

    public static <T> @NotNull T resolve(@NotNull Class<T> type) {
        return container().resolve(type);
    }

    public static <T> @NotNull T resolveKeyed(@NotNull Class<T> type, @NotNull String key) {
        return container().resolveKeyed(type, key);
    }

    public static <T> @NotNull Optional<T> tryResolve(@NotNull Class<T> type) {
        return container().tryResolve(type);
    }

    public static <T> @NotNull Optional<T> tryResolveKeyed(@NotNull Class<T> type, @NotNull String key) {
        return container().tryResolveKeyed(type, key);
    }

    public static <T> @NotNull List<T> getAll(@NotNull Class<T> type) {
        return container().getAll(type);
    }

    public static boolean isRegistered(@NotNull Class<?> type) {
        return container().isRegistered(type);
    }

    public static boolean isRegistered(@NotNull Class<?> type, @NotNull String key) {
        return container().isRegistered(type, key);
    }

    public static @NotNull ScopeHandle beginScope() {
        return container().beginScope();
    }

    public static void endScope() {
        container().endScope();
    }
}
