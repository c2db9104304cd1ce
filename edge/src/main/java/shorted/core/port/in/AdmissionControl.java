package shorted.core.port.in;

import java.util.Optional;

import io.smallrye.mutiny.Uni;

import shorted.core.model.identity.InboundRequest;
import shorted.core.model.ratelimit.Admission;

/**
 * Use case for admitting inbound requests.
 */
public interface AdmissionControl {

    /**
     * Classify the caller and apply the rate limit of the route class protecting {@code path}.
     *
     * @param request the identifying parts of the request
     * @param path the request path
     * @return the admission, or empty when the path is not rate limited or limiting is disabled
     */
    Uni<Optional<Admission>> admit(InboundRequest request, String path);
}
