package dev.fumaz.graft.provider;

import org.jetbrains.annotations.NotNull;

/**
 * A factory function receiving its resolved parameters in declaration order.
 *
 * @param <T> the type of the service
 */
@FunctionalInterface
public interface Factory<T> {

    T create(@NotNull Object[] arguments) throws Exception;

}
