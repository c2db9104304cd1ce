package shorted.core.model.cache;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * A cached value together with its freshness boundaries.
 *
 * <p>An entry is <em>fresh</em> before {@code freshUntil}, <em>stale</em> between
 * {@code freshUntil} and {@code staleUntil}, and treated as absent afterwards.
 *
 * @param key the cache key
 * @param payload the serialized (JSON) value
 * @param freshUntil end of the fresh period
 * @param staleUntil end of the stale period, never before {@code freshUntil}
 */
public record CacheEntry(String key, String payload, Instant freshUntil, Instant staleUntil) {

    public CacheEntry {
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(payload, "payload must not be null");
        Objects.requireNonNull(freshUntil, "freshUntil must not be null");
        Objects.requireNonNull(staleUntil, "staleUntil must not be null");
        if (staleUntil.isBefore(freshUntil)) {
            throw new IllegalArgumentException("staleUntil must not be before freshUntil for key " + key);
        }
    }

    /**
     * Create an entry written at {@code writeTime} under the given policy.
     *
     * @param key the cache key
     * @param payload the serialized value
     * @param writeTime the time of the write
     * @param policy the freshness policy
     * @return the entry
     */
    public static CacheEntry written(String key, String payload, Instant writeTime, CachePolicy policy) {
        return new CacheEntry(
                key, payload, writeTime.plus(policy.ttlFresh()), writeTime.plus(policy.totalLifetime()));
    }

    public Freshness freshnessAt(Instant now) {
        if (now.isBefore(freshUntil)) {
            return Freshness.FRESH;
        }
        if (now.isBefore(staleUntil)) {
            return Freshness.STALE;
        }
        return Freshness.EXPIRED;
    }

    /**
     * Store TTL for this entry: the whole fresh plus stale lifetime, rounded up to seconds.
     *
     * @param writeTime the time of the write
     * @return TTL in seconds, at least 1
     */
    public long storeTtlSeconds(Instant writeTime) {
        final var lifetime = Duration.between(writeTime, staleUntil);
        final var millis = lifetime.toMillis();
        final var seconds = (millis + 999) / 1000;
        return Math.max(1, seconds);
    }

    /** Freshness of an entry at a given instant. */
    public enum Freshness {
        FRESH,
        STALE,
        EXPIRED
    }
}
