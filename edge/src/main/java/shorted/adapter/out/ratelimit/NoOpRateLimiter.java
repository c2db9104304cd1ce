package shorted.adapter.out.ratelimit;

import io.smallrye.mutiny.Uni;

import shorted.core.model.identity.Identity;
import shorted.core.model.ratelimit.RateLimitDecision;
import shorted.core.model.ratelimit.RouteClass;
import shorted.core.port.out.RateLimiter;

/**
 * A no-op rate limiter that allows all requests.
 *
 * <p>Used when rate limiting is disabled or no shared store is configured.
 */
public final class NoOpRateLimiter implements RateLimiter {

    private static final NoOpRateLimiter INSTANCE = new NoOpRateLimiter();

    private NoOpRateLimiter() {}

    /**
     * Return the singleton instance.
     *
     * @return the no-op rate limiter
     */
    public static NoOpRateLimiter getInstance() {
        return INSTANCE;
    }

    @Override
    public Uni<RateLimitDecision> check(Identity identity, RouteClass routeClass) {
        return Uni.createFrom().item(RateLimitDecision.unlimited());
    }

    @Override
    public boolean isEnabled() {
        return false;
    }
}
