package dev.fumaz.graft.exception;

import dev.fumaz.graft.bind.ServiceKey;
import org.jetbrains.annotations.NotNull;

import java.util.Collections;
import java.util.List;

/**
 * Thrown when a service identity (and key) has no registration.
 */
public class NotRegisteredException extends GraftException {

    private final @NotNull ServiceKey<?> key;
    private final @NotNull List<ServiceKey<?>> path;

    public NotRegisteredException(@NotNull ServiceKey<?> key, @NotNull List<ServiceKey<?>> path) {
        super(buildMessage(key, path));
        this.key = key;
        this.path = Collections.unmodifiableList(path);
    }

    /**
     * @return the identity that has no registration
     */
    public @NotNull ServiceKey<?> getKey() {
        return key;
    }

    /**
     * @return the identities being resolved when the missing one was requested, outermost first, ending with the
     * missing identity itself
     */
    public @NotNull List<ServiceKey<?>> getPath() {
        return path;
    }

    private static String buildMessage(ServiceKey<?> key, List<ServiceKey<?>> path) {
        StringBuilder builder = new StringBuilder("Service ").append(key.describe()).append(" is not registered");

        if (path.size() > 1) {
            builder.append(" (required by ");

            for (int i = path.size() - 2; i >= 0; i--) {
                builder.append(path.get(i).describe());

                if (i > 0) {
                    builder.append(" <- ");
                }
            }

            builder.append(')');
        }

        return builder.toString();
    }
}
