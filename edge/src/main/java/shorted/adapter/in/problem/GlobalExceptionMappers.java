package shorted.adapter.in.problem;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.ws.rs.core.Response;

import io.quarkiverse.resteasy.problem.HttpProblem;
import org.jboss.logging.Logger;
import org.jboss.resteasy.reactive.server.ServerExceptionMapper;

import shorted.core.model.common.UpstreamFailureException;

/**
 * Global exception mappers for converting exceptions to RFC 7807 Problem Details.
 */
@ApplicationScoped
public class GlobalExceptionMappers {

    private static final Logger LOG = Logger.getLogger(GlobalExceptionMappers.class);
    private static final String PROBLEM_JSON = "application/problem+json";

    @ServerExceptionMapper
    public Response mapUpstreamFailure(UpstreamFailureException e) {
        if (e.isTimeout()) {
            LOG.warnv("Upstream timed out for {0}", e.getKey());
            return toResponse(EdgeProblem.gatewayTimeout("Upstream did not respond in time"));
        }
        LOG.warnv("Upstream failed for {0}: {1}", e.getKey(), e.getMessage());
        return toResponse(EdgeProblem.badGateway("Upstream request failed"));
    }

    @ServerExceptionMapper
    public Response mapIllegalArgumentException(IllegalArgumentException e) {
        LOG.debugv("Validation error: {0}", e.getMessage());
        return toResponse(EdgeProblem.badRequest(e.getMessage()));
    }

    static Response toResponse(HttpProblem problem) {
        return Response.status(problem.getStatus())
                .type(PROBLEM_JSON)
                .entity(problem)
                .build();
    }
}
