package dev.fumaz.graft.exception;

import dev.fumaz.graft.bind.ServiceKey;
import org.jetbrains.annotations.NotNull;

import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Thrown when resolving an identity requires that same identity further down its own dependency chain.
 */
public class CircularDependencyException extends GraftException {

    private final @NotNull List<ServiceKey<?>> path;

    public CircularDependencyException(@NotNull List<ServiceKey<?>> path) {
        super("Circular dependency detected: " + path.stream()
                .map(ServiceKey::describe)
                .collect(Collectors.joining(" -> ")));
        this.path = Collections.unmodifiableList(path);
    }

    /**
     * The full resolution stack at the moment the cycle was detected, outermost first, with the repeated identity
     * appended. Resolving {@code A -> B -> A} yields {@code [A, B, A]}.
     */
    public @NotNull List<ServiceKey<?>> getPath() {
        return path;
    }

    /**
     * The part of {@link #getPath()} that forms the cycle, starting at the first occurrence of the repeated identity.
     */
    public @NotNull List<ServiceKey<?>> getCycle() {
        ServiceKey<?> repeated = path.get(path.size() - 1);
        return path.subList(path.indexOf(repeated), path.size());
    }
}
