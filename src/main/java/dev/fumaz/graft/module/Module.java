package dev.fumaz.graft.module;

import dev.fumaz.graft.bind.Registration;
import org.jetbrains.annotations.NotNull;

import java.util.List;

/**
 * A {@link Module} is a reusable collection of registrations.
 */
public interface Module {

    void configure();

    @NotNull List<Registration<?>> getRegistrations();

    /**
     * Discards the registrations of a previous {@link #configure()} call so the module can be applied again.
     */
    default void reset() {
    }

}
