package shorted.adapter.out.store.memory;

import java.util.Optional;
import java.util.concurrent.TimeUnit;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;
import io.smallrye.mutiny.Uni;

import shorted.core.port.out.KeyValueStore;

/**
 * Process-local key-value store backed by Caffeine.
 *
 * <p>Each entry carries its own TTL. Counters are incremented under
 * {@code asMap().compute}, which is atomic per key.
 *
 * <p>State is not shared between replicas; use it for development and single-instance deployments.
 */
public final class InMemoryKeyValueStore implements KeyValueStore {

    static final String NAME = "memory";

    private final Cache<String, StoredValue> cache;

    public InMemoryKeyValueStore(long maximumSize) {
        this(maximumSize, Ticker.systemTicker());
    }

    InMemoryKeyValueStore(long maximumSize, Ticker ticker) {
        this.cache = Caffeine.newBuilder()
                .expireAfter(new PerEntryExpiry())
                .maximumSize(maximumSize)
                .ticker(ticker)
                .build();
    }

    @Override
    public Uni<Optional<String>> get(String key) {
        return Uni.createFrom().item(() -> Optional.ofNullable(cache.getIfPresent(key)).map(StoredValue::value));
    }

    @Override
    public Uni<Void> set(String key, String value, long ttlSeconds) {
        return Uni.createFrom().item(() -> {
            cache.put(key, new StoredValue(value, ttlNanos(ttlSeconds)));
            return null;
        });
    }

    @Override
    public Uni<Long> incrWithExpiry(String key, long ttlSeconds) {
        return Uni.createFrom().item(() -> {
            final var updated = cache.asMap().compute(key, (k, existing) -> {
                final var next = (existing == null ? 0L : existing.asCount()) + 1;
                return new StoredValue(Long.toString(next), ttlNanos(ttlSeconds));
            });
            return updated.asCount();
        });
    }

    @Override
    public Uni<Void> delete(String key) {
        return Uni.createFrom().item(() -> {
            cache.invalidate(key);
            return null;
        });
    }

    @Override
    public String name() {
        return NAME;
    }

    long estimatedSize() {
        cache.cleanUp();
        return cache.estimatedSize();
    }

    private static long ttlNanos(long ttlSeconds) {
        return TimeUnit.SECONDS.toNanos(Math.max(1, ttlSeconds));
    }

    private record StoredValue(String value, long ttlNanos) {

        long asCount() {
            try {
                return Long.parseLong(value);
            } catch (NumberFormatException e) {
                throw new IllegalStateException("Value is not an integer counter: " + value, e);
            }
        }
    }

    /**
     * Expiry policy that reads the TTL from the entry; reads do not extend it.
     */
    private static final class PerEntryExpiry implements Expiry<String, StoredValue> {
        @Override
        public long expireAfterCreate(String key, StoredValue value, long currentTime) {
            return value.ttlNanos();
        }

        @Override
        public long expireAfterUpdate(String key, StoredValue value, long currentTime, long currentDuration) {
            return value.ttlNanos();
        }

        @Override
        public long expireAfterRead(String key, StoredValue value, long currentTime, long currentDuration) {
            return currentDuration;
        }
    }
}
