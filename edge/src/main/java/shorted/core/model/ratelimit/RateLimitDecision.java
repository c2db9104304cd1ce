package shorted.core.model.ratelimit;

import java.time.Instant;

/**
 * Result of a rate limit check.
 *
 * @param allowed whether the request may proceed
 * @param remaining requests left in the current window (0 when rejected)
 * @param limit the limit that was applied
 * @param resetAt end of the current window
 * @param retryAfterSeconds seconds until a retry may succeed (only meaningful when not allowed)
 * @param authenticated whether the caller was authenticated
 */
public record RateLimitDecision(
        boolean allowed, long remaining, long limit, Instant resetAt, long retryAfterSeconds, boolean authenticated) {

    /**
     * Create an "allowed" decision.
     *
     * @param remaining remaining requests in the window
     * @param limit the applied limit
     * @param resetAt when the window resets
     * @param authenticated whether the caller was authenticated
     * @return an allowed decision
     */
    public static RateLimitDecision allow(long remaining, long limit, Instant resetAt, boolean authenticated) {
        return new RateLimitDecision(true, remaining, limit, resetAt, 0, authenticated);
    }

    /**
     * Create a "rejected" decision.
     *
     * @param limit the applied limit
     * @param resetAt when the window resets
     * @param retryAfterSeconds seconds until a retry may succeed, at least 1
     * @param authenticated whether the caller was authenticated
     * @return a rejected decision
     */
    public static RateLimitDecision rejected(
            long limit, Instant resetAt, long retryAfterSeconds, boolean authenticated) {
        return new RateLimitDecision(false, 0, limit, resetAt, Math.max(1, retryAfterSeconds), authenticated);
    }

    /**
     * Decision used when rate limiting is disabled.
     *
     * @return an unlimited allowed decision
     */
    public static RateLimitDecision unlimited() {
        return new RateLimitDecision(true, Long.MAX_VALUE, Long.MAX_VALUE, Instant.MAX, 0, false);
    }
}
