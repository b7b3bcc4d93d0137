package dev.fumaz.graft.provider;

/**
 * How a registration produces its instances.
 */
public enum BuildStrategy {

    /**
     * Instantiates an implementation class, resolving its constructor parameters first.
     */
    CONSTRUCTOR,

    /**
     * Returns a value built before registration.
     */
    INSTANCE,

    /**
     * Invokes a factory with its declared parameters resolved.
     */
    FACTORY

}
