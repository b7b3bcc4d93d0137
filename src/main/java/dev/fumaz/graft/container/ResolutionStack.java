package dev.fumaz.graft.container;

import dev.fumaz.graft.bind.ServiceKey;
import dev.fumaz.graft.exception.CircularDependencyException;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * The identities under construction within one top-level resolve call. Created when the call starts, discarded when
 * it returns, never shared between calls or threads.
 */
final class ResolutionStack {

    private final List<ServiceKey<?>> path = new ArrayList<>();
    private final Set<ServiceKey<?>> inProgress = new HashSet<>();

    /**
     * @throws CircularDependencyException if {@code key} is already being resolved further up the stack
     */
    void push(@NotNull ServiceKey<?> key) {
        if (!inProgress.add(key)) {
            List<ServiceKey<?>> cycle = new ArrayList<>(path.size() + 1);
            cycle.addAll(path);
            cycle.add(key);

            throw new CircularDependencyException(cycle);
        }

        path.add(key);
    }

    void pop(@NotNull ServiceKey<?> key) {
        if (path.isEmpty()) {
            throw new IllegalStateException("Resolution stack is empty while finishing " + key.describe());
        }

        ServiceKey<?> finished = path.remove(path.size() - 1);

        if (!finished.equals(key)) {
            throw new IllegalStateException("Resolution stack mismatch: finished " + key.describe()
                    + " while " + finished.describe() + " was on top");
        }

        inProgress.remove(key);
    }

    @NotNull ServiceKey<?> peek() {
        if (path.isEmpty()) {
            throw new IllegalStateException("Resolution stack is empty");
        }

        return path.get(path.size() - 1);
    }

    boolean contains(@NotNull ServiceKey<?> key) {
        return inProgress.contains(key);
    }

    @NotNull List<ServiceKey<?>> snapshot() {
        return new ArrayList<>(path);
    }

    int depth() {
        return path.size();
    }

    boolean isEmpty() {
        return path.isEmpty();
    }
}
