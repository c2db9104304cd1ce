package shorted.core.service.cache;

import java.time.Clock;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.function.Supplier;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import shorted.core.model.cache.CacheEntry;
import shorted.core.model.cache.CachePolicy;
import shorted.core.model.common.UpstreamFailureException;
import shorted.core.port.out.KeyValueStore;
import shorted.core.port.out.Metrics;

/**
 * Cache-aside over the shared key-value store with stale-while-revalidate semantics.
 *
 * <ul>
 *   <li>Fresh hit: the stored value is returned, nothing else happens.</li>
 *   <li>Stale hit: the stored value is returned and a refresh is submitted to the
 *       refresh executor. The refresh is detached from the caller; its failures are
 *       logged and counted only.</li>
 *   <li>Miss (absent, unreadable or past {@code staleUntil}): the producer runs, the
 *       value is written and returned. A failed write is logged, not surfaced.</li>
 *   <li>Store unavailable on read: the producer runs and nothing is written.</li>
 * </ul>
 *
 * <p>Producer failures and timeouts surface as {@link UpstreamFailureException}.
 * Concurrent misses for the same key each run the producer; the last write wins.
 */
@ApplicationScoped
public class StaleWhileRevalidateCache {

    private static final Logger LOG = Logger.getLogger(StaleWhileRevalidateCache.class);

    private final KeyValueStore store;
    private final ObjectMapper objectMapper;
    private final CacheEntryCodec codec;
    private final Clock clock;
    private final Executor refreshExecutor;
    private final Metrics metrics;

    @Inject
    public StaleWhileRevalidateCache(
            KeyValueStore store,
            ObjectMapper objectMapper,
            Clock clock,
            @RefreshExecutor Executor refreshExecutor,
            Metrics metrics) {
        this.store = store;
        this.objectMapper = objectMapper;
        this.codec = new CacheEntryCodec(objectMapper);
        this.clock = clock;
        this.refreshExecutor = refreshExecutor;
        this.metrics = metrics;
    }

    /**
     * Return the cached value for {@code key}, computing it with {@code producer} when needed.
     *
     * @param key the cache key
     * @param policy the freshness policy
     * @param type the value type
     * @param producer computes the value; invoked lazily
     * @param <T> the value type
     * @return the value
     */
    public <T> Uni<T> getOrRefresh(String key, CachePolicy policy, Class<T> type, Supplier<Uni<T>> producer) {
        return getOrRefresh(key, policy, objectMapper.constructType(type), producer);
    }

    /**
     * Variant of {@link #getOrRefresh(String, CachePolicy, Class, Supplier)} for generic value types.
     */
    public <T> Uni<T> getOrRefresh(
            String key, CachePolicy policy, TypeReference<T> type, Supplier<Uni<T>> producer) {
        return getOrRefresh(key, policy, objectMapper.getTypeFactory().constructType(type), producer);
    }

    /**
     * Write a value unconditionally, replacing any existing entry.
     *
     * @param key the cache key
     * @param policy the freshness policy of the new entry
     * @param value the value
     * @return completion signal; fails if the value cannot be serialized or the store write fails
     */
    public Uni<Void> put(String key, CachePolicy policy, Object value) {
        return Uni.createFrom().deferred(() -> {
            final var now = clock.instant();
            final var entry = CacheEntry.written(key, serialize(key, value), now, policy);
            return store.set(key, codec.encode(entry), entry.storeTtlSeconds(now));
        });
    }

    /**
     * Run a producer under the policy's time budget and write its value.
     *
     * @param key the cache key
     * @param policy the freshness policy
     * @param producer computes the value
     * @return completion signal; fails on producer or write failure
     */
    public Uni<Void> populate(String key, CachePolicy policy, Supplier<? extends Uni<?>> producer) {
        return this.<Object>produce(key, policy, producer).flatMap(value -> put(key, policy, value));
    }

    /**
     * Remove an entry.
     *
     * @param key the cache key
     * @return completion signal
     */
    public Uni<Void> invalidate(String key) {
        return store.delete(key);
    }

    private <T> Uni<T> getOrRefresh(String key, CachePolicy policy, JavaType type, Supplier<Uni<T>> producer) {
        return store.get(key)
                .map(Lookup::found)
                .onFailure()
                .recoverWithItem(error -> {
                    LOG.warnv("Cache read failed for {0}, calling producer directly: {1}", key, error.getMessage());
                    return Lookup.UNAVAILABLE;
                })
                .flatMap(lookup -> {
                    if (!lookup.storeAvailable()) {
                        metrics.recordCacheLookup("bypass");
                        return produce(key, policy, producer);
                    }
                    final var entry = lookup.stored().flatMap(raw -> codec.decode(key, raw));
                    if (entry.isPresent()) {
                        final var cached = serveCached(entry.get(), policy, type, producer);
                        if (cached.isPresent()) {
                            return Uni.createFrom().item(cached.get());
                        }
                    }
                    metrics.recordCacheLookup("miss");
                    return produce(key, policy, producer).call(value -> writeQuietly(key, policy, value));
                });
    }

    private <T> Optional<T> serveCached(
            CacheEntry entry, CachePolicy policy, JavaType type, Supplier<Uni<T>> producer) {
        final var freshness = entry.freshnessAt(clock.instant());
        if (freshness == CacheEntry.Freshness.EXPIRED) {
            return Optional.empty();
        }
        final Optional<T> value = deserialize(entry, type);
        if (value.isEmpty()) {
            return Optional.empty();
        }
        if (freshness == CacheEntry.Freshness.STALE) {
            metrics.recordCacheLookup("stale");
            scheduleRefresh(entry.key(), policy, producer);
        } else {
            metrics.recordCacheLookup("fresh");
        }
        return value;
    }

    private void scheduleRefresh(String key, CachePolicy policy, Supplier<? extends Uni<?>> producer) {
        LOG.debugf("Serving stale entry for %s, refreshing in background", key);
        populate(key, policy, producer)
                .runSubscriptionOn(refreshExecutor)
                .subscribe()
                .with(ignored -> LOG.debugf("Background refresh completed for %s", key), error -> {
                    metrics.recordRefreshFailure();
                    LOG.warnv("Background refresh failed for {0}: {1}", key, error.getMessage());
                });
    }

    private <T> Uni<T> produce(String key, CachePolicy policy, Supplier<? extends Uni<? extends T>> producer) {
        final Uni<T> production = Uni.createFrom().deferred(() -> producer.get());
        return production
                .ifNoItem()
                .after(policy.producerTimeout())
                .failWith(() -> UpstreamFailureException.timedOut(key, policy.producerTimeout().toString()))
                .onFailure(error -> !(error instanceof UpstreamFailureException))
                .transform(error -> UpstreamFailureException.failed(key, error));
    }

    private Uni<Void> writeQuietly(String key, CachePolicy policy, Object value) {
        return put(key, policy, value).onFailure().recoverWithItem(error -> {
            LOG.warnv("Cache write failed for {0}: {1}", key, error.getMessage());
            return null;
        });
    }

    private String serialize(String key, Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize cache value for " + key, e);
        }
    }

    private <T> Optional<T> deserialize(CacheEntry entry, JavaType type) {
        try {
            return Optional.ofNullable(objectMapper.readValue(entry.payload(), type));
        } catch (JsonProcessingException e) {
            LOG.debugf("Treating unreadable cached payload for %s as a miss: %s", entry.key(), e.getMessage());
            return Optional.empty();
        }
    }

    private record Lookup(boolean storeAvailable, Optional<String> stored) {

        static final Lookup UNAVAILABLE = new Lookup(false, Optional.empty());

        static Lookup found(Optional<String> stored) {
            return new Lookup(true, stored);
        }
    }
}
