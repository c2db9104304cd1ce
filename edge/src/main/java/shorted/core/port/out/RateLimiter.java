package shorted.core.port.out;

import io.smallrye.mutiny.Uni;

import shorted.core.model.identity.Identity;
import shorted.core.model.ratelimit.RateLimitDecision;
import shorted.core.model.ratelimit.RouteClass;

/**
 * Port interface for rate limiting.
 *
 * <p>Implementations decide and, when allowed, record the request in one step.
 */
public interface RateLimiter {

    /**
     * Decide whether a request may proceed and count it if so.
     *
     * <p>Never fails: a limiter that cannot reach its state allows the request.
     *
     * @param identity the caller
     * @param routeClass the route class of the request
     * @return the decision
     */
    Uni<RateLimitDecision> check(Identity identity, RouteClass routeClass);

    /**
     * Check if rate limiting is enabled.
     *
     * @return true if rate limiting is active
     */
    boolean isEnabled();
}
