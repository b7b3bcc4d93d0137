package dev.fumaz.graft.provider;

import dev.fumaz.graft.annotation.Inject;
import dev.fumaz.graft.annotation.Named;
import dev.fumaz.graft.bind.ServiceKey;
import dev.fumaz.graft.context.ResolutionContext;
import dev.fumaz.graft.exception.ConfigurationException;
import dev.fumaz.graft.exception.GraftException;
import dev.fumaz.graft.exception.ProvisionException;
import org.jetbrains.annotations.NotNull;

import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Modifier;
import java.lang.reflect.Parameter;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * A {@link ConstructorProvider} is a {@link Provider} that instantiates an implementation class through one of its
 * constructors. The constructor and the identities of its parameters are fixed when the provider is created, so
 * resolution never inspects signatures.
 *
 * @param <T> the type of the implementation
 */
public class ConstructorProvider<T> implements Provider<T> {

    private static final Object[] NO_ARGUMENTS = new Object[0];

    private final @NotNull Constructor<T> constructor;
    private final @NotNull List<ServiceKey<?>> dependencies;
    private final @NotNull BitSet optional;

    private ConstructorProvider(@NotNull Constructor<T> constructor,
                                @NotNull List<ServiceKey<?>> dependencies,
                                @NotNull BitSet optional) {
        this.constructor = constructor;
        this.dependencies = Collections.unmodifiableList(dependencies);
        this.optional = optional;
    }

    /**
     * Plans construction of {@code implementation} from its own signature. The constructor used is the one annotated
     * with {@link Inject}, else the no-argument constructor, else the only declared constructor. Parameters are
     * resolved by their declared type, keyed by {@link Named} where present. A parameter of type
     * {@code Optional<X>} depends on {@code X} and receives {@link Optional#empty()} when {@code X} is not registered.
     */
    public static <T> @NotNull ConstructorProvider<T> of(@NotNull Class<T> implementation) {
        ensureInstantiable(implementation);

        Constructor<T> constructor = selectConstructor(implementation);
        List<ServiceKey<?>> dependencies = new ArrayList<>(constructor.getParameterCount());
        BitSet optional = new BitSet();

        for (Parameter parameter : constructor.getParameters()) {
            Class<?> type = parameter.getType();

            if (type == Optional.class) {
                optional.set(dependencies.size());
                type = optionalElement(implementation, parameter);
            }

            if (type.isPrimitive()) {
                throw new ConfigurationException("Constructor parameter " + parameter.getName() + " of "
                        + implementation.getName() + " has primitive type " + type.getName()
                        + " and cannot be resolved");
            }

            Named named = parameter.getAnnotation(Named.class);
            dependencies.add(ServiceKey.of(type, named == null ? null : named.value()));
        }

        return new ConstructorProvider<>(makeAccessible(constructor), dependencies, optional);
    }

    /**
     * Plans construction of {@code implementation} with explicitly declared parameter identities. Exactly one
     * constructor must accept the declared identities, in order.
     */
    public static <T> @NotNull ConstructorProvider<T> of(@NotNull Class<T> implementation,
                                                         @NotNull List<ServiceKey<?>> dependencies) {
        ensureInstantiable(implementation);

        Constructor<T> match = null;

        for (Constructor<?> candidate : implementation.getDeclaredConstructors()) {
            if (!accepts(candidate, dependencies)) {
                continue;
            }

            if (match != null) {
                throw new ConfigurationException("Multiple constructors of " + implementation.getName()
                        + " accept " + describe(dependencies));
            }

            @SuppressWarnings("unchecked")
            Constructor<T> typed = (Constructor<T>) candidate;
            match = typed;
        }

        if (match == null) {
            throw new ConfigurationException("No constructor of " + implementation.getName()
                    + " accepts " + describe(dependencies));
        }

        return new ConstructorProvider<>(makeAccessible(match), new ArrayList<>(dependencies), new BitSet());
    }

    @Override
    public @NotNull BuildStrategy getStrategy() {
        return BuildStrategy.CONSTRUCTOR;
    }

    @Override
    public @NotNull List<ServiceKey<?>> getDependencies() {
        return dependencies;
    }

    /**
     * @return whether the dependency at {@code index} is passed as an {@link Optional} that is empty when the
     * dependency is not registered
     */
    public boolean isOptional(int index) {
        return optional.get(index);
    }

    public @NotNull Class<T> getImplementation() {
        return constructor.getDeclaringClass();
    }

    @Override
    public @NotNull T provide(@NotNull ResolutionContext context) {
        Object[] arguments = dependencies.isEmpty() ? NO_ARGUMENTS : new Object[dependencies.size()];

        for (int i = 0; i < arguments.length; i++) {
            ServiceKey<?> dependency = dependencies.get(i);

            if (!optional.get(i)) {
                arguments[i] = context.resolve(dependency);
            } else if (context.getContainer().isRegistered(dependency)) {
                arguments[i] = Optional.of(context.resolve(dependency));
            } else {
                arguments[i] = Optional.empty();
            }
        }

        try {
            return constructor.newInstance(arguments);
        } catch (InvocationTargetException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;

            if (cause instanceof GraftException) {
                throw (GraftException) cause;
            }

            if (cause instanceof Error) {
                throw (Error) cause;
            }

            throw new ProvisionException("Constructor of " + getImplementation().getName() + " failed", cause);
        } catch (ReflectiveOperationException e) {
            throw new ProvisionException("Failed to invoke constructor " + constructor, e);
        }
    }

    @Override
    public String toString() {
        return "constructor of " + getImplementation().getName() + " with parameters " + dependencies;
    }

    private static <T> Constructor<T> selectConstructor(Class<T> implementation) {
        Constructor<?>[] declared = implementation.getDeclaredConstructors();
        Constructor<?> injectable = null;
        Constructor<?> zeroArg = null;

        for (Constructor<?> constructor : declared) {
            if (constructor.isAnnotationPresent(Inject.class)) {
                if (injectable != null) {
                    throw new ConfigurationException("Multiple @Inject constructors found for "
                            + implementation.getName());
                }

                injectable = constructor;
            }

            if (constructor.getParameterCount() == 0) {
                zeroArg = constructor;
            }
        }

        Constructor<?> selected = injectable;

        if (selected == null) {
            if (zeroArg != null) {
                selected = zeroArg;
            } else if (declared.length == 1) {
                selected = declared[0];
            }
        }

        if (selected == null) {
            throw new ConfigurationException(implementation.getName() + " declares " + declared.length
                    + " constructors; annotate the one to use with @Inject");
        }

        @SuppressWarnings("unchecked")
        Constructor<T> typed = (Constructor<T>) selected;
        return typed;
    }

    private static Class<?> optionalElement(Class<?> implementation, Parameter parameter) {
        Type generic = parameter.getParameterizedType();

        if (generic instanceof ParameterizedType) {
            Type element = ((ParameterizedType) generic).getActualTypeArguments()[0];

            if (element instanceof Class) {
                return (Class<?>) element;
            }

            if (element instanceof ParameterizedType) {
                return (Class<?>) ((ParameterizedType) element).getRawType();
            }
        }

        throw new ConfigurationException("Constructor parameter " + parameter.getName() + " of "
                + implementation.getName() + " must declare the type of its Optional, found " + generic);
    }

    private static boolean accepts(Constructor<?> constructor, List<ServiceKey<?>> dependencies) {
        Class<?>[] parameterTypes = constructor.getParameterTypes();

        if (parameterTypes.length != dependencies.size()) {
            return false;
        }

        for (int i = 0; i < parameterTypes.length; i++) {
            if (!parameterTypes[i].isAssignableFrom(dependencies.get(i).getType())) {
                return false;
            }
        }

        return true;
    }

    private static void ensureInstantiable(Class<?> implementation) {
        int modifiers = implementation.getModifiers();

        if (implementation.isInterface() || Modifier.isAbstract(modifiers) || implementation.isPrimitive()
                || implementation.isArray() || implementation.isEnum()) {
            throw new ConfigurationException(implementation.getName() + " cannot be instantiated");
        }

        if (implementation.isMemberClass() && !Modifier.isStatic(modifiers)) {
            throw new ConfigurationException(implementation.getName()
                    + " is an inner class; only static nested classes can be constructed");
        }
    }

    private static <T> Constructor<T> makeAccessible(Constructor<T> constructor) {
        try {
            constructor.setAccessible(true);
        } catch (RuntimeException e) {
            throw new ConfigurationException("Constructor " + constructor + " is not accessible", e);
        }

        return constructor;
    }

    private static String describe(List<ServiceKey<?>> dependencies) {
        return dependencies.stream()
                .map(ServiceKey::describe)
                .collect(Collectors.joining(", ", "(", ")"));
    }

}
