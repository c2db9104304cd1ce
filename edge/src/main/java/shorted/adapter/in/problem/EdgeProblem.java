package shorted.adapter.in.problem;

import jakarta.ws.rs.core.Response.Status;

import io.quarkiverse.resteasy.problem.HttpProblem;

import shorted.core.model.ratelimit.RateLimitDecision;

/**
 * Factory for RFC 7807 problem responses returned by the edge.
 */
public final class EdgeProblem {

    private EdgeProblem() {}

    // ========== Rate Limiting ==========

    /**
     * Create a 429 Too Many Requests problem for a rejected decision.
     *
     * <p>Anonymous callers are pointed at signing in, since authenticated callers get a
     * higher limit.
     *
     * @param decision the rejecting decision
     * @return rate limit problem
     */
    public static HttpProblem tooManyRequests(RateLimitDecision decision) {
        final var retryAfter = decision.retryAfterSeconds();
        final var message = decision.authenticated()
                ? "You have exceeded the rate limit. Please try again in " + retryAfter + " seconds."
                : "Rate limit exceeded. Sign in for higher limits, or try again in " + retryAfter + " seconds.";
        return HttpProblem.builder()
                .withTitle("Too Many Requests")
                .withStatus(Status.TOO_MANY_REQUESTS)
                .withDetail(message)
                .with("error", "Rate limit exceeded")
                .with("message", message)
                .with("retryAfter", retryAfter)
                .with("limit", decision.limit())
                .with("authenticated", decision.authenticated())
                .build();
    }

    // ========== Upstream Errors ==========

    public static HttpProblem badGateway(String detail) {
        return HttpProblem.builder()
                .withTitle("Bad Gateway")
                .withStatus(Status.BAD_GATEWAY)
                .withDetail(detail)
                .build();
    }

    public static HttpProblem gatewayTimeout(String detail) {
        return HttpProblem.builder()
                .withTitle("Gateway Timeout")
                .withStatus(Status.GATEWAY_TIMEOUT)
                .withDetail(detail)
                .build();
    }

    // ========== Client Errors ==========

    public static HttpProblem badRequest(String detail) {
        return HttpProblem.builder()
                .withTitle("Bad Request")
                .withStatus(Status.BAD_REQUEST)
                .withDetail(detail)
                .build();
    }

    /**
     * Create a 401 problem. Carries an {@code error} member for clients that only read that field.
     *
     * @param detail the error detail message
     * @return unauthorized problem
     */
    public static HttpProblem unauthorized(String detail) {
        return HttpProblem.builder()
                .withTitle("Unauthorized")
                .withStatus(Status.UNAUTHORIZED)
                .withDetail(detail)
                .with("error", "Unauthorized")
                .build();
    }
}
