package dev.fumaz.graft.bind;

import dev.fumaz.graft.exception.ConfigurationException;
import dev.fumaz.graft.provider.ConstructorProvider;
import dev.fumaz.graft.provider.Factory;
import dev.fumaz.graft.provider.FactoryProvider;
import dev.fumaz.graft.provider.InstanceProvider;
import dev.fumaz.graft.provider.Provider;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.BiFunction;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * A {@link RegistrationBuilder} is used to create a {@link Registration}. Modifiers may be chained in any order; each
 * terminal method ({@code to...}) builds the registration and hands it to the owner.
 *
 * @param <T> the type of the service
 */
public class RegistrationBuilder<T> {

    private final @NotNull Class<T> type;
    private final @NotNull Consumer<? super Registration<?>> sink;

    private @Nullable String name;
    private @NotNull Lifetime lifetime = Lifetime.TRANSIENT;

    public RegistrationBuilder(@NotNull Class<T> type, @NotNull Consumer<? super Registration<?>> sink) {
        this.type = Objects.requireNonNull(type, "type");
        this.sink = Objects.requireNonNull(sink, "sink");
    }

    public RegistrationBuilder<T> named(@NotNull String name) {
        this.name = Objects.requireNonNull(name, "name");
        return this;
    }

    public RegistrationBuilder<T> in(@NotNull Lifetime lifetime) {
        this.lifetime = Objects.requireNonNull(lifetime, "lifetime");
        return this;
    }

    public RegistrationBuilder<T> asSingleton() {
        return in(Lifetime.SINGLETON);
    }

    public RegistrationBuilder<T> asScoped() {
        return in(Lifetime.SCOPED);
    }

    public RegistrationBuilder<T> asTransient() {
        return in(Lifetime.TRANSIENT);
    }

    public Registration<T> toSelf() {
        return to(type);
    }

    public Registration<T> to(@NotNull Class<? extends T> implementation) {
        Objects.requireNonNull(implementation, "implementation");
        ensureAssignable(implementation);

        return toProvider(ConstructorProvider.of(implementation));
    }

    public Registration<T> to(@NotNull Class<? extends T> implementation, @NotNull ServiceKey<?>... dependencies) {
        Objects.requireNonNull(implementation, "implementation");
        ensureAssignable(implementation);

        return toProvider(ConstructorProvider.of(implementation, Arrays.asList(dependencies)));
    }

    public Registration<T> toInstance(@NotNull T instance) {
        if (instance == null) {
            throw new ConfigurationException("Instance registered for " + type.getName() + " cannot be null");
        }

        ensureAssignable(instance.getClass());

        return toProvider(new InstanceProvider<>(instance));
    }

    public Registration<T> toSupplier(@NotNull Supplier<? extends T> supplier) {
        Objects.requireNonNull(supplier, "supplier");

        return toProvider(new FactoryProvider<>(type, arguments -> supplier.get()));
    }

    public <A> Registration<T> toFactory(@NotNull Class<A> dependency,
                                         @NotNull Function<? super A, ? extends T> factory) {
        Objects.requireNonNull(dependency, "dependency");
        Objects.requireNonNull(factory, "factory");

        return toFactory(arguments -> factory.apply(dependency.cast(arguments[0])), ServiceKey.of(dependency));
    }

    public <A, B> Registration<T> toFactory(@NotNull Class<A> first,
                                            @NotNull Class<B> second,
                                            @NotNull BiFunction<? super A, ? super B, ? extends T> factory) {
        Objects.requireNonNull(first, "first");
        Objects.requireNonNull(second, "second");
        Objects.requireNonNull(factory, "factory");

        return toFactory(arguments -> factory.apply(first.cast(arguments[0]), second.cast(arguments[1])),
                ServiceKey.of(first), ServiceKey.of(second));
    }

    public Registration<T> toFactory(@NotNull Factory<? extends T> factory, @NotNull ServiceKey<?>... parameters) {
        Objects.requireNonNull(factory, "factory");

        List<ServiceKey<?>> declared = parameters.length == 0
                ? Collections.emptyList()
                : Arrays.asList(parameters);

        return toProvider(new FactoryProvider<>(type, factory, declared));
    }

    public Registration<T> toProvider(@NotNull Provider<? extends T> provider) {
        Objects.requireNonNull(provider, "provider");

        Registration<T> registration = new Registration<>(ServiceKey.of(type, name), lifetime, provider);
        sink.accept(registration);

        return registration;
    }

    private void ensureAssignable(Class<?> implementation) {
        if (!type.isAssignableFrom(implementation)) {
            throw new ConfigurationException("Type " + implementation.getName()
                    + " is not assignable to " + type.getName());
        }
    }

}
