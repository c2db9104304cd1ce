package shorted.core.service.ratelimit;

import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import shorted.core.model.identity.InboundRequest;
import shorted.core.model.ratelimit.Admission;
import shorted.core.port.in.AdmissionControl;
import shorted.core.port.out.RateLimiter;
import shorted.core.service.identity.IdentityClassifier;

/**
 * Gatekeeper logic: route class lookup, caller classification and the rate limit check.
 */
@ApplicationScoped
public class AdmissionService implements AdmissionControl {

    private static final Logger LOG = Logger.getLogger(AdmissionService.class);

    private final RouteClassRegistry routeClasses;
    private final IdentityClassifier identityClassifier;
    private final RateLimiter rateLimiter;

    @Inject
    public AdmissionService(
            RouteClassRegistry routeClasses, IdentityClassifier identityClassifier, RateLimiter rateLimiter) {
        this.routeClasses = routeClasses;
        this.identityClassifier = identityClassifier;
        this.rateLimiter = rateLimiter;
    }

    @Override
    public Uni<Optional<Admission>> admit(InboundRequest request, String path) {
        if (!rateLimiter.isEnabled()) {
            return Uni.createFrom().item(Optional.empty());
        }
        final var routeClass = routeClasses.forPath(path);
        if (routeClass.isEmpty()) {
            return Uni.createFrom().item(Optional.empty());
        }
        return identityClassifier
                .classify(request)
                .flatMap(identity -> rateLimiter
                        .check(identity, routeClass.get())
                        .map(decision -> {
                            if (!decision.allowed()) {
                                LOG.debugf(
                                        "Rate limit exceeded for %s on %s (limit %d)",
                                        identity.toKeySegment(), routeClass.get().name(), decision.limit());
                            }
                            return Optional.of(new Admission(routeClass.get(), identity, decision));
                        }));
    }
}
