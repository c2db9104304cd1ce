package shorted.core.model.ratelimit;

import shorted.core.model.identity.Identity;

/**
 * A named class of endpoints that share one rate limit budget.
 *
 * <p>Route classes are built once at startup from configuration and never change.
 *
 * @param name the route class name, used in counter keys
 * @param anonymousLimit requests allowed per window for anonymous callers
 * @param authenticatedLimit requests allowed per window for authenticated callers
 * @param windowSeconds the window length in seconds
 */
public record RouteClass(String name, long anonymousLimit, long authenticatedLimit, long windowSeconds) {

    public RouteClass {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Route class name must not be blank");
        }
        if (anonymousLimit <= 0) {
            throw new IllegalArgumentException(
                    "Route class '%s' anonymous limit must be positive, got %d".formatted(name, anonymousLimit));
        }
        if (authenticatedLimit <= 0) {
            throw new IllegalArgumentException("Route class '%s' authenticated limit must be positive, got %d"
                    .formatted(name, authenticatedLimit));
        }
        if (windowSeconds <= 0) {
            throw new IllegalArgumentException(
                    "Route class '%s' window must be positive, got %d".formatted(name, windowSeconds));
        }
    }

    /**
     * Select the limit that applies to the given caller.
     *
     * @param identity the caller identity
     * @return the per-window limit
     */
    public long limitFor(Identity identity) {
        return identity.isAuthenticated() ? authenticatedLimit : anonymousLimit;
    }
}
