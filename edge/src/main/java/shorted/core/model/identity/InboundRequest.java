package shorted.core.model.identity;

import java.util.Optional;

/**
 * The parts of an inbound HTTP request that identity classification looks at.
 *
 * <p>Built by the HTTP layer so that classification stays independent of JAX-RS.
 *
 * @param sessionToken the raw session token from the session cookie or header
 * @param xForwardedFor the {@code X-Forwarded-For} header
 * @param forwarded the RFC 7239 {@code Forwarded} header
 * @param xRealIp the {@code X-Real-IP} header
 * @param peerAddress the address of the direct connection peer (may be null)
 */
public record InboundRequest(
        Optional<String> sessionToken,
        Optional<String> xForwardedFor,
        Optional<String> forwarded,
        Optional<String> xRealIp,
        String peerAddress) {

    public InboundRequest {
        sessionToken = blankToEmpty(sessionToken);
        xForwardedFor = blankToEmpty(xForwardedFor);
        forwarded = blankToEmpty(forwarded);
        xRealIp = blankToEmpty(xRealIp);
    }

    /**
     * Create a request with only a peer address, as seen from a direct connection.
     *
     * @param peerAddress the peer address
     * @return the request
     */
    public static InboundRequest direct(String peerAddress) {
        return new InboundRequest(Optional.empty(), Optional.empty(), Optional.empty(), Optional.empty(), peerAddress);
    }

    public InboundRequest withSessionToken(String token) {
        return new InboundRequest(Optional.ofNullable(token), xForwardedFor, forwarded, xRealIp, peerAddress);
    }

    public InboundRequest withForwardedFor(String header) {
        return new InboundRequest(sessionToken, Optional.ofNullable(header), forwarded, xRealIp, peerAddress);
    }

    private static Optional<String> blankToEmpty(Optional<String> value) {
        if (value == null) {
            return Optional.empty();
        }
        return value.filter(v -> !v.isBlank());
    }
}
