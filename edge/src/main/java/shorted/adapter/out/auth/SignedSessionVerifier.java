package shorted.adapter.out.auth;

import java.nio.charset.StandardCharsets;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;
import org.jose4j.jwa.AlgorithmConstraints;
import org.jose4j.jws.AlgorithmIdentifiers;
import org.jose4j.jwt.MalformedClaimException;
import org.jose4j.jwt.consumer.InvalidJwtException;
import org.jose4j.jwt.consumer.JwtConsumer;
import org.jose4j.jwt.consumer.JwtConsumerBuilder;
import org.jose4j.keys.HmacKey;

import shorted.core.config.IdentityConfig;
import shorted.core.port.out.SessionVerifier;

/**
 * Verifies HMAC-SHA256 signed session tokens with jose4j.
 *
 * <p>A session is valid when the signature verifies, {@code exp} is in the future
 * (within the configured clock skew) and {@code sub}, the user id, is present. When
 * an issuer is configured, {@code iss} must match it.
 *
 * <p>Without a configured secret nothing verifies and every caller is anonymous.
 */
@ApplicationScoped
public class SignedSessionVerifier implements SessionVerifier {

    private static final Logger LOG = Logger.getLogger(SignedSessionVerifier.class);

    /** HS256 requires a key of at least 256 bits. */
    private static final int MIN_SECRET_BYTES = 32;

    private final JwtConsumer consumer;

    @Inject
    public SignedSessionVerifier(IdentityConfig config) {
        this(config.session());
    }

    SignedSessionVerifier(IdentityConfig.SessionConfig session) {
        this.consumer = session.secret()
                .filter(secret -> !secret.isBlank())
                .map(secret -> buildConsumer(secret, session))
                .orElse(null);
        if (consumer == null) {
            LOG.info("No session secret configured; all callers will be rate limited as anonymous");
        }
    }

    @Override
    public Uni<Optional<String>> verify(String token) {
        if (consumer == null || token == null || token.isBlank()) {
            return Uni.createFrom().item(Optional.empty());
        }
        return Uni.createFrom().item(() -> {
            try {
                final var claims = consumer.processToClaims(token);
                return Optional.ofNullable(claims.getSubject()).filter(subject -> !subject.isBlank());
            } catch (InvalidJwtException e) {
                LOG.debugv("Session token rejected: {0}", summarize(e));
                return Optional.<String>empty();
            } catch (MalformedClaimException e) {
                LOG.debugv("Session token has a malformed subject: {0}", e.getMessage());
                return Optional.<String>empty();
            }
        });
    }

    private static JwtConsumer buildConsumer(String secret, IdentityConfig.SessionConfig session) {
        final var keyBytes = secret.getBytes(StandardCharsets.UTF_8);
        if (keyBytes.length < MIN_SECRET_BYTES) {
            throw new IllegalArgumentException(
                    "shorted.identity.session.secret must be at least %d bytes".formatted(MIN_SECRET_BYTES));
        }
        final var builder = new JwtConsumerBuilder()
                .setRequireSubject()
                .setRequireExpirationTime()
                .setAllowedClockSkewInSeconds((int) session.clockSkew().toSeconds())
                .setSkipDefaultAudienceValidation()
                .setJwsAlgorithmConstraints(
                        AlgorithmConstraints.ConstraintType.PERMIT, AlgorithmIdentifiers.HMAC_SHA256)
                .setVerificationKey(new HmacKey(keyBytes));
        session.issuer().ifPresent(builder::setExpectedIssuer);
        return builder.build();
    }

    private static String summarize(InvalidJwtException e) {
        if (e.hasExpired()) {
            return "expired";
        }
        final var details = e.getErrorDetails();
        if (details != null && !details.isEmpty()) {
            return details.get(0).getErrorMessage();
        }
        return e.getMessage();
    }
}
