package shorted.system.filter;

import java.util.Optional;

import jakarta.inject.Inject;
import jakarta.ws.rs.Priorities;
import jakarta.ws.rs.container.ContainerRequestContext;
import jakarta.ws.rs.container.ContainerResponseContext;
import jakarta.ws.rs.core.Cookie;
import jakarta.ws.rs.core.Response;

import io.opentelemetry.api.trace.Span;
import io.smallrye.mutiny.Uni;
import io.vertx.core.http.HttpServerRequest;
import org.jboss.resteasy.reactive.server.ServerRequestFilter;
import org.jboss.resteasy.reactive.server.ServerResponseFilter;

import shorted.adapter.in.problem.EdgeProblem;
import shorted.adapter.out.telemetry.SpanAttributes;
import shorted.config.TelemetryConfig;
import shorted.core.config.IdentityConfig;
import shorted.core.config.RateLimitingConfig;
import shorted.core.model.identity.InboundRequest;
import shorted.core.model.ratelimit.Admission;
import shorted.core.model.ratelimit.RateLimitDecision;
import shorted.core.port.in.AdmissionControl;

/**
 * Gatekeeper for rate-limited routes.
 *
 * <p>Runs before any resource method. Requests on paths without a route class pass
 * straight through; others are classified and counted, and rejected with 429 once the
 * caller's sliding-window estimate reaches the limit. Admitted responses get
 * {@code X-RateLimit-*} headers.
 */
public class RateLimitFilter {

    static final String ADMISSION_ATTR = "shorted.ratelimit.admission";

    private final AdmissionControl admissionControl;
    private final RateLimitingConfig rateLimitingConfig;
    private final IdentityConfig identityConfig;
    private final TelemetryConfig telemetryConfig;

    @Inject
    public RateLimitFilter(
            AdmissionControl admissionControl,
            RateLimitingConfig rateLimitingConfig,
            IdentityConfig identityConfig,
            TelemetryConfig telemetryConfig) {
        this.admissionControl = admissionControl;
        this.rateLimitingConfig = rateLimitingConfig;
        this.identityConfig = identityConfig;
        this.telemetryConfig = telemetryConfig;
    }

    @ServerRequestFilter(priority = Priorities.AUTHENTICATION - 100)
    public Uni<Response> filter(ContainerRequestContext ctx, HttpServerRequest request) {
        final var inbound = toInboundRequest(ctx, request);
        final var path = ctx.getUriInfo().getPath();

        return admissionControl.admit(inbound, path).map(admission -> {
            if (admission.isEmpty()) {
                return null;
            }
            final var result = admission.get();
            ctx.setProperty(ADMISSION_ATTR, result);
            setSpanAttributes(result);
            if (result.allowed()) {
                return null;
            }
            return rejectedResponse(result.decision());
        });
    }

    @ServerResponseFilter
    public void addRateLimitHeaders(ContainerRequestContext req, ContainerResponseContext res) {
        if (!rateLimitingConfig.includeHeaders()) {
            return;
        }
        final var admission = (Admission) req.getProperty(ADMISSION_ATTR);
        if (admission != null && admission.allowed()) {
            final var decision = admission.decision();
            res.getHeaders().putSingle("X-RateLimit-Limit", decision.limit());
            res.getHeaders().putSingle("X-RateLimit-Remaining", decision.remaining());
            res.getHeaders().putSingle("X-RateLimit-Reset", decision.resetAt().toString());
        }
    }

    private Response rejectedResponse(RateLimitDecision decision) {
        final var problem = EdgeProblem.tooManyRequests(decision);
        final var builder = Response.status(Response.Status.TOO_MANY_REQUESTS)
                .type("application/problem+json")
                .header("Retry-After", decision.retryAfterSeconds())
                .entity(problem);
        if (rateLimitingConfig.includeHeaders()) {
            builder.header("X-RateLimit-Limit", decision.limit())
                    .header("X-RateLimit-Remaining", 0)
                    .header("X-RateLimit-Reset", decision.resetAt().toString());
        }
        return builder.build();
    }

    InboundRequest toInboundRequest(ContainerRequestContext ctx, HttpServerRequest request) {
        final var cookie = Optional.ofNullable(ctx.getCookies().get(identityConfig.sessionCookie()))
                .map(Cookie::getValue);
        final var sessionToken =
                cookie.or(() -> Optional.ofNullable(ctx.getHeaderString(identityConfig.sessionHeader())));
        final var peer = request == null || request.remoteAddress() == null
                ? null
                : request.remoteAddress().hostAddress();
        return new InboundRequest(
                sessionToken,
                Optional.ofNullable(ctx.getHeaderString("X-Forwarded-For")),
                Optional.ofNullable(ctx.getHeaderString("Forwarded")),
                Optional.ofNullable(ctx.getHeaderString("X-Real-IP")),
                peer);
    }

    private void setSpanAttributes(Admission admission) {
        if (!telemetryConfig.spanAttributesEnabled()) {
            return;
        }
        final var span = Span.current();
        span.setAttribute(SpanAttributes.RATE_LIMIT_ROUTE_CLASS, admission.routeClass().name());
        span.setAttribute(SpanAttributes.RATE_LIMIT_ALLOWED, admission.allowed());
        span.setAttribute(SpanAttributes.RATE_LIMIT_REMAINING, admission.decision().remaining());
        span.setAttribute(SpanAttributes.CALLER_AUTHENTICATED, admission.identity().isAuthenticated());
    }
}
