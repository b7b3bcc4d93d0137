package dev.fumaz.graft.bind;

/**
 * Policy governing how often a registration builds a new instance.
 */
public enum Lifetime {

    /**
     * One instance for the lifetime of the container, built on first resolution.
     */
    SINGLETON,

    /**
     * One instance per active scope, released when the scope ends. Resolving without an active scope fails.
     */
    SCOPED,

    /**
     * A new instance on every resolution, never cached. This is the default.
     */
    TRANSIENT

}
