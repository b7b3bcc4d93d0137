package dev.fumaz.graft.provider;

import dev.fumaz.graft.bind.ServiceKey;
import dev.fumaz.graft.context.ResolutionContext;
import dev.fumaz.graft.exception.GraftException;
import dev.fumaz.graft.exception.ProvisionException;
import org.jetbrains.annotations.NotNull;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A {@link FactoryProvider} is a {@link Provider} that resolves its declared parameters and hands them to a
 * {@link Factory}.
 *
 * @param <T> the type of the service
 */
public class FactoryProvider<T> implements Provider<T> {

    private final @NotNull Class<T> type;
    private final @NotNull Factory<? extends T> factory;
    private final @NotNull List<ServiceKey<?>> parameters;

    public FactoryProvider(@NotNull Class<T> type,
                           @NotNull Factory<? extends T> factory,
                           @NotNull List<ServiceKey<?>> parameters) {
        this.type = Objects.requireNonNull(type, "type");
        this.factory = Objects.requireNonNull(factory, "factory");
        this.parameters = List.copyOf(parameters);
    }

    public FactoryProvider(@NotNull Class<T> type, @NotNull Factory<? extends T> factory) {
        this(type, factory, Collections.emptyList());
    }

    @Override
    public @NotNull BuildStrategy getStrategy() {
        return BuildStrategy.FACTORY;
    }

    @Override
    public @NotNull List<ServiceKey<?>> getDependencies() {
        return parameters;
    }

    @Override
    public @NotNull T provide(@NotNull ResolutionContext context) {
        Object[] arguments = new Object[parameters.size()];

        for (int i = 0; i < arguments.length; i++) {
            arguments[i] = context.resolve(parameters.get(i));
        }

        T instance;

        try {
            instance = factory.create(arguments);
        } catch (GraftException e) {
            throw e;
        } catch (Exception e) {
            throw new ProvisionException("Factory for " + context.getRequested().describe() + " failed", e);
        }

        if (instance == null) {
            throw new ProvisionException("Factory for " + context.getRequested().describe() + " returned null");
        }

        return instance;
    }

    @Override
    public String toString() {
        return "factory for " + type.getName() + " with parameters " + parameters;
    }

}
