package shorted.core.model.identity;

import java.util.Objects;

/**
 * Attribution key used to scope rate limit counters.
 *
 * <p>Authenticated callers are keyed by the user id from their verified session;
 * everyone else is keyed by the client network address.
 *
 * @param kind whether the caller is authenticated
 * @param key the user id or the network address, never blank
 */
public record Identity(IdentityKind kind, String key) {

    /** Address used when neither forwarding headers nor a peer address are available. */
    public static final String UNKNOWN_ADDRESS = "unknown";

    public Identity {
        Objects.requireNonNull(kind, "kind must not be null");
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("Identity key must not be blank");
        }
    }

    /**
     * Create an authenticated identity.
     *
     * @param userId the verified user id
     * @return the identity
     */
    public static Identity authenticated(String userId) {
        return new Identity(IdentityKind.AUTHENTICATED, userId);
    }

    /**
     * Create an anonymous identity, falling back to {@link #UNKNOWN_ADDRESS}.
     *
     * @param address the client address (may be null or blank)
     * @return the identity
     */
    public static Identity anonymous(String address) {
        final var effective = address == null || address.isBlank() ? UNKNOWN_ADDRESS : address.trim();
        return new Identity(IdentityKind.ANONYMOUS, effective);
    }

    public boolean isAuthenticated() {
        return kind == IdentityKind.AUTHENTICATED;
    }

    /**
     * Return the identity as it appears inside store keys, e.g. {@code user:42} or {@code ip:10.0.0.1}.
     *
     * @return the key segment
     */
    public String toKeySegment() {
        return kind.segmentPrefix() + ":" + key;
    }
}
