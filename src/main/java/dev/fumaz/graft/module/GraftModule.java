package dev.fumaz.graft.module;

import dev.fumaz.graft.bind.Registration;
import dev.fumaz.graft.bind.RegistrationBuilder;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Base class for modules declaring their registrations with {@link #bind(Class)} inside {@link #configure()}.
 */
public abstract class GraftModule implements Module {

    private final List<Registration<?>> registrations = new ArrayList<>();
    private final List<Registration<?>> registrationsView = Collections.unmodifiableList(registrations);

    @Override
    public @NotNull List<Registration<?>> getRegistrations() {
        return registrationsView;
    }

    public <T> @NotNull RegistrationBuilder<T> bind(@NotNull Class<T> type) {
        return new RegistrationBuilder<>(type, registrations::add);
    }

    @Override
    public void reset() {
        registrations.clear();
    }

    protected final void install(@NotNull Module module) {
        Objects.requireNonNull(module, "module");

        if (module == this) {
            throw new IllegalArgumentException("A module cannot install itself");
        }

        module.reset();
        module.configure();

        registrations.addAll(module.getRegistrations());
    }

}
