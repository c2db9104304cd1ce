package shorted.core.port.out;

import java.util.Optional;

import io.smallrye.mutiny.Uni;

/**
 * Port interface for verifying session tokens issued by the authentication provider.
 */
public interface SessionVerifier {

    /**
     * Verify a session token.
     *
     * @param token the raw session token
     * @return the user id of a valid session, or empty if the token does not verify
     */
    Uni<Optional<String>> verify(String token);
}
