package shorted.adapter.out.store.redis;

import java.util.Optional;

import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import io.quarkus.redis.datasource.keys.ReactiveKeyCommands;
import io.quarkus.redis.datasource.value.ReactiveValueCommands;
import io.smallrye.mutiny.Uni;

import shorted.core.model.common.StoreUnavailableException;
import shorted.core.port.out.KeyValueStore;

/**
 * Redis implementation of the shared key-value store.
 *
 * <p>Commands: {@code GET}, {@code SET key value EX ttl}, {@code DEL}, and a Lua
 * script running {@code INCR} and {@code EXPIRE} as one atomic operation.
 * All keys carry the configured prefix.
 */
public final class RedisKeyValueStore implements KeyValueStore {

    static final String NAME = "redis";

    /**
     * Lua script for atomic increment-with-expiry.
     *
     * <p>Arguments:
     * <ol>
     *   <li>KEYS[1] - the counter key</li>
     *   <li>ARGV[1] - TTL in seconds</li>
     * </ol>
     *
     * <p>Returns the counter value after the increment.
     */
    private static final String INCR_WITH_EXPIRY_SCRIPT =
            """
            local count = redis.call('INCR', KEYS[1])
            redis.call('EXPIRE', KEYS[1], tonumber(ARGV[1]))
            return count
            """;

    private final ReactiveRedisDataSource redisDataSource;
    private final ReactiveValueCommands<String, String> valueCommands;
    private final ReactiveKeyCommands<String> keyCommands;
    private final RedisTimeoutHelper timeoutHelper;
    private final String keyPrefix;

    public RedisKeyValueStore(ReactiveRedisDataSource redisDataSource, String keyPrefix, RedisTimeoutHelper timeoutHelper) {
        this.redisDataSource = redisDataSource;
        this.valueCommands = redisDataSource.value(String.class, String.class);
        this.keyCommands = redisDataSource.key(String.class);
        this.timeoutHelper = timeoutHelper;
        this.keyPrefix = keyPrefix == null ? "" : keyPrefix;
    }

    @Override
    public Uni<Optional<String>> get(String key) {
        return timeoutHelper.bounded(valueCommands.get(prefixed(key)), "get").map(Optional::ofNullable);
    }

    @Override
    public Uni<Void> set(String key, String value, long ttlSeconds) {
        return timeoutHelper.bounded(valueCommands.setex(prefixed(key), Math.max(1, ttlSeconds), value), "set");
    }

    @Override
    public Uni<Long> incrWithExpiry(String key, long ttlSeconds) {
        final var operation = redisDataSource
                .execute(
                        "EVAL",
                        INCR_WITH_EXPIRY_SCRIPT,
                        "1", // numkeys
                        prefixed(key), // KEYS[1]
                        String.valueOf(Math.max(1, ttlSeconds)) // ARGV[1]
                        )
                .map(response -> {
                    if (response == null) {
                        throw new StoreUnavailableException("incr", "Redis returned no counter value for " + key);
                    }
                    return response.toLong();
                });
        return timeoutHelper.bounded(operation, "incr");
    }

    @Override
    public Uni<Void> delete(String key) {
        return timeoutHelper.bounded(keyCommands.del(prefixed(key)), "delete").replaceWithVoid();
    }

    @Override
    public String name() {
        return NAME;
    }

    private String prefixed(String key) {
        return keyPrefix + key;
    }
}
