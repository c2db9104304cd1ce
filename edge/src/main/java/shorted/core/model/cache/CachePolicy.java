package shorted.core.model.cache;

import java.time.Duration;
import java.util.Objects;

/**
 * Freshness policy for a family of cache keys.
 *
 * @param ttlFresh how long a written value is served without refresh
 * @param ttlStale how long after that a value is still served while refreshing
 * @param producerTimeout upper bound for a single producer call
 */
public record CachePolicy(Duration ttlFresh, Duration ttlStale, Duration producerTimeout) {

    public CachePolicy {
        Objects.requireNonNull(ttlFresh, "ttlFresh must not be null");
        Objects.requireNonNull(ttlStale, "ttlStale must not be null");
        Objects.requireNonNull(producerTimeout, "producerTimeout must not be null");
        if (ttlFresh.isNegative() || ttlStale.isNegative()) {
            throw new IllegalArgumentException("Cache TTLs must not be negative");
        }
        if (producerTimeout.isZero() || producerTimeout.isNegative()) {
            throw new IllegalArgumentException("Producer timeout must be positive");
        }
    }

    /**
     * Policy whose stale window is {@code staleMultiplier} times the fresh window.
     */
    public static CachePolicy of(Duration ttlFresh, int staleMultiplier, Duration producerTimeout) {
        return new CachePolicy(ttlFresh, ttlFresh.multipliedBy(staleMultiplier), producerTimeout);
    }

    public Duration totalLifetime() {
        return ttlFresh.plus(ttlStale);
    }
}
