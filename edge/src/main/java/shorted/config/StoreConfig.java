package shorted.config;

import java.time.Duration;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for the shared key-value store.
 *
 * <p>Configuration prefix: {@code shorted.store}
 *
 * <p>The Redis connection itself is configured through {@code quarkus.redis.hosts}.
 *
 * <h2>Environment Variables</h2>
 * <ul>
 *   <li>{@code SHORTED_STORE_BACKEND} - {@code redis}, {@code memory} or {@code none}</li>
 *   <li>{@code SHORTED_STORE_KEY_PREFIX} - Prefix applied to every key</li>
 *   <li>{@code SHORTED_STORE_REDIS_OPERATION_TIMEOUT} - Per-operation timeout</li>
 * </ul>
 */
@ConfigMapping(prefix = "shorted.store")
public interface StoreConfig {

    /**
     * Store backend name, matched against {@code KeyValueStoreProvider.name()}.
     *
     * <p>{@code memory} is process-local and only suitable for a single replica.
     * {@code none} disables both caching and rate limiting.
     *
     * @return backend name (default: redis)
     */
    @WithDefault("redis")
    String backend();

    /**
     * Prefix applied to every key, allowing several deployments to share one Redis.
     *
     * @return key prefix (default: "shorted:")
     */
    @WithDefault("shorted:")
    String keyPrefix();

    /** Redis backend settings. */
    RedisStoreConfig redis();

    /** In-memory backend settings. */
    MemoryStoreConfig memory();

    /**
     * Redis backend settings.
     */
    interface RedisStoreConfig {

        /** @return upper bound for a single Redis operation (default: 1 second) */
        @WithDefault("PT1S")
        Duration operationTimeout();
    }

    /**
     * In-memory backend settings.
     */
    interface MemoryStoreConfig {

        /** @return maximum number of entries held (default: 10000) */
        @WithDefault("10000")
        long maximumSize();
    }
}
