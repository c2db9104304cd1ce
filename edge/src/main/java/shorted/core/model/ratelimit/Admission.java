package shorted.core.model.ratelimit;

import shorted.core.model.identity.Identity;

/**
 * Outcome of admitting a request on a rate-limited route.
 *
 * @param routeClass the route class the request was counted against
 * @param identity the caller
 * @param decision the rate limit decision
 */
public record Admission(RouteClass routeClass, Identity identity, RateLimitDecision decision) {

    public boolean allowed() {
        return decision.allowed();
    }
}
