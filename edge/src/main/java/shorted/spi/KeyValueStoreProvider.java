package shorted.spi;

import shorted.core.port.out.KeyValueStore;

/**
 * Service Provider Interface for shared key-value store backends.
 *
 * <p>The backend is selected by name ({@code shorted.store.backend}). When the
 * configured backend is not available, the available provider with the highest
 * priority is used instead.
 *
 * <p>Built-in providers:
 * <ul>
 *   <li>In-memory (priority 0) - single replica only</li>
 *   <li>Redis (priority 10) - shared across replicas, recommended for production</li>
 * </ul>
 *
 * @see shorted.core.port.out.KeyValueStore
 */
public interface KeyValueStoreProvider {

    /**
     * Return the priority of this provider. Higher values are preferred when falling back.
     *
     * @return the provider priority
     */
    int priority();

    /**
     * Return the name of this provider, matched against configuration.
     *
     * @return the provider name (e.g., "memory", "redis")
     */
    String name();

    /**
     * Check if this provider can be used in the current environment.
     *
     * @return true if the provider can create a store
     */
    boolean isAvailable();

    /**
     * Create the store. Called once during startup; the store must be thread-safe.
     *
     * @return the store
     */
    KeyValueStore createStore();
}
