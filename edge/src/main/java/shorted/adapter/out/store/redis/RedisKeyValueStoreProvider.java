package shorted.adapter.out.store.redis;

import java.time.Duration;

import io.quarkus.redis.datasource.ReactiveRedisDataSource;

import shorted.core.port.out.KeyValueStore;
import shorted.core.port.out.Metrics;
import shorted.spi.KeyValueStoreProvider;

/**
 * Redis store provider for multi-replica deployments.
 *
 * <p>Available when a {@link ReactiveRedisDataSource} is configured. Reachability
 * is not probed at startup; an unreachable Redis degrades per operation.
 */
public final class RedisKeyValueStoreProvider implements KeyValueStoreProvider {

    public static final String NAME = RedisKeyValueStore.NAME;

    private static final int PRIORITY = 10;

    private final ReactiveRedisDataSource redisDataSource;
    private final String keyPrefix;
    private final Duration operationTimeout;
    private final Metrics metrics;

    private RedisKeyValueStoreProvider(
            ReactiveRedisDataSource redisDataSource, String keyPrefix, Duration operationTimeout, Metrics metrics) {
        this.redisDataSource = redisDataSource;
        this.keyPrefix = keyPrefix;
        this.operationTimeout = operationTimeout;
        this.metrics = metrics;
    }

    /**
     * Creates a configured provider instance.
     *
     * @param redisDataSource the Redis data source, or null if none is configured
     * @param keyPrefix prefix applied to every key
     * @param operationTimeout per-operation timeout
     * @param metrics metrics for failure counting
     * @return the provider
     */
    public static RedisKeyValueStoreProvider configured(
            ReactiveRedisDataSource redisDataSource, String keyPrefix, Duration operationTimeout, Metrics metrics) {
        return new RedisKeyValueStoreProvider(redisDataSource, keyPrefix, operationTimeout, metrics);
    }

    @Override
    public int priority() {
        return PRIORITY;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public boolean isAvailable() {
        return redisDataSource != null;
    }

    @Override
    public KeyValueStore createStore() {
        if (redisDataSource == null) {
            throw new IllegalStateException("Redis data source is not configured");
        }
        return new RedisKeyValueStore(
                redisDataSource, keyPrefix, new RedisTimeoutHelper(operationTimeout, metrics, RedisKeyValueStore.NAME));
    }
}
