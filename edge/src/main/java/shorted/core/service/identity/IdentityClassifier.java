package shorted.core.service.identity;

import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import shorted.core.config.IdentityConfig;
import shorted.core.model.identity.Identity;
import shorted.core.model.identity.InboundRequest;
import shorted.core.port.out.SessionVerifier;

/**
 * Attribute a request to an authenticated user or to a client address.
 *
 * <p>Classification never fails. A missing, invalid or unverifiable session,
 * including verifier errors and timeouts, falls back to the anonymous identity.
 */
@ApplicationScoped
public class IdentityClassifier {

    private static final Logger LOG = Logger.getLogger(IdentityClassifier.class);

    private final SessionVerifier sessionVerifier;
    private final ClientAddressResolver addressResolver;
    private final IdentityConfig config;

    @Inject
    public IdentityClassifier(
            SessionVerifier sessionVerifier, ClientAddressResolver addressResolver, IdentityConfig config) {
        this.sessionVerifier = sessionVerifier;
        this.addressResolver = addressResolver;
        this.config = config;
    }

    /**
     * Classify the caller of a request.
     *
     * @param request the request
     * @return the identity, never a failure
     */
    public Uni<Identity> classify(InboundRequest request) {
        final var token = request.sessionToken();
        if (token.isEmpty()) {
            return Uni.createFrom().item(() -> anonymous(request));
        }
        return sessionVerifier
                .verify(token.get())
                .ifNoItem()
                .after(config.session().timeout())
                .failWith(() -> new IllegalStateException("Session verification timed out"))
                .onFailure()
                .recoverWithItem(error -> {
                    LOG.debugf("Session verification failed, treating caller as anonymous: %s", error.getMessage());
                    return Optional.<String>empty();
                })
                .map(userId -> userId.filter(id -> !id.isBlank())
                        .map(Identity::authenticated)
                        .orElseGet(() -> anonymous(request)));
    }

    private Identity anonymous(InboundRequest request) {
        return Identity.anonymous(addressResolver.resolve(request));
    }
}
