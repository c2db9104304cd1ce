package shorted.core.service.ratelimit;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import shorted.core.model.identity.Identity;
import shorted.core.model.ratelimit.RateLimitDecision;
import shorted.core.model.ratelimit.RateWindowKey;
import shorted.core.model.ratelimit.RouteClass;
import shorted.core.port.out.KeyValueStore;
import shorted.core.port.out.Metrics;
import shorted.core.port.out.RateLimiter;

/**
 * Sliding window rate limiter backed by the shared key-value store.
 *
 * <p>Approximates a rolling window from two adjacent fixed windows:
 * <pre>
 *   estimate = count(current) + count(previous) * (1 - elapsedFractionOfCurrent)
 * </pre>
 * A request is rejected when {@code estimate >= limit}. Otherwise the current
 * window counter is incremented with one atomic increment-with-expiry
 * ({@code TTL = 2 * window}, so the counter survives as the next window's "previous").
 *
 * <p>The read and the increment are separate round trips, so concurrent requests may
 * briefly overshoot the limit by the number of requests in flight.
 *
 * <p>Store failures fail open: the request is allowed with {@code remaining = limit - 1}.
 */
public final class SlidingWindowRateLimiter implements RateLimiter {

    private static final Logger LOG = Logger.getLogger(SlidingWindowRateLimiter.class);

    private final KeyValueStore store;
    private final Clock clock;
    private final Metrics metrics;

    public SlidingWindowRateLimiter(KeyValueStore store, Clock clock, Metrics metrics) {
        this.store = store;
        this.clock = clock;
        this.metrics = metrics;
    }

    @Override
    public Uni<RateLimitDecision> check(Identity identity, RouteClass routeClass) {
        final var nowMillis = clock.millis();
        final var windowMillis = routeClass.windowSeconds() * 1000L;
        final var limit = routeClass.limitFor(identity);
        final var authenticated = identity.isAuthenticated();

        final var current = new RateWindowKey(
                routeClass.name(), identity, RateWindowKey.bucketOf(nowMillis, routeClass.windowSeconds()));
        final var previous = current.previous();
        final var resetAtMillis = (current.bucket() + 1) * windowMillis;
        final var resetAt = Instant.ofEpochMilli(resetAtMillis);
        final var elapsedFraction = (double) (nowMillis - current.bucket() * windowMillis) / windowMillis;

        return Uni.combine()
                .all()
                .unis(readCounter(current), readCounter(previous))
                .asTuple()
                .flatMap(counts -> {
                    final var estimate = counts.getItem1() + counts.getItem2() * (1.0 - elapsedFraction);
                    if (estimate >= limit) {
                        final var retryAfter = (long) Math.ceil((resetAtMillis - nowMillis) / 1000.0);
                        return Uni.createFrom()
                                .item(RateLimitDecision.rejected(limit, resetAt, retryAfter, authenticated));
                    }
                    final var remaining = Math.max(0, limit - (long) Math.ceil(estimate) - 1);
                    return store.incrWithExpiry(current.toKey(), routeClass.windowSeconds() * 2)
                            .map(count -> RateLimitDecision.allow(remaining, limit, resetAt, authenticated));
                })
                .onFailure()
                .recoverWithItem(error -> {
                    LOG.warnv(
                            "Rate limit check failed for {0} on {1} using {2}, allowing request: {3}",
                            identity.toKeySegment(), routeClass.name(), store.name(), error.getMessage());
                    return RateLimitDecision.allow(limit - 1, limit, resetAt, authenticated);
                })
                .invoke(decision -> metrics.recordRateLimitDecision(
                        routeClass.name(), authenticated, decision.allowed()));
    }

    @Override
    public boolean isEnabled() {
        return true;
    }

    private Uni<Long> readCounter(RateWindowKey key) {
        return store.get(key.toKey()).map(SlidingWindowRateLimiter::parseCount);
    }

    private static long parseCount(Optional<String> value) {
        if (value.isEmpty()) {
            return 0L;
        }
        try {
            return Math.max(0L, Long.parseLong(value.get().trim()));
        } catch (NumberFormatException e) {
            LOG.debugf("Ignoring non-numeric rate window counter: %s", value.get());
            return 0L;
        }
    }
}
