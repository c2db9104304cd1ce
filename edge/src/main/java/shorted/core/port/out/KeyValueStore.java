package shorted.core.port.out;

import java.util.Optional;

import io.smallrye.mutiny.Uni;

/**
 * Port interface for the shared key-value store.
 *
 * <p>Every replica talks to the same store, so counters and cache entries are
 * shared. Operations are non-blocking and never retried by the adapter; any
 * failure (connection error, server error or timeout) surfaces as a
 * {@link shorted.core.model.common.StoreUnavailableException}.
 */
public interface KeyValueStore {

    /**
     * Read a value.
     *
     * @param key the key
     * @return the value, or empty if absent or expired
     */
    Uni<Optional<String>> get(String key);

    /**
     * Write a value, replacing any existing one, with an expiry.
     *
     * @param key the key
     * @param value the value
     * @param ttlSeconds time to live in seconds, at least 1
     * @return completion signal
     */
    Uni<Void> set(String key, String value, long ttlSeconds);

    /**
     * Atomically increment an integer counter and (re)set its expiry.
     *
     * <p>A missing key counts as zero. Increment and expiry are applied as one store operation.
     *
     * @param key the counter key
     * @param ttlSeconds time to live in seconds
     * @return the counter value after the increment
     */
    Uni<Long> incrWithExpiry(String key, long ttlSeconds);

    /**
     * Remove a key. Removing a missing key is not an error.
     *
     * @param key the key
     * @return completion signal
     */
    Uni<Void> delete(String key);

    /**
     * Name of the backend, for logs and metrics.
     *
     * @return the backend name
     */
    String name();
}
