package shorted.core.service.identity;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import shorted.core.model.identity.Identity;
import shorted.core.model.identity.InboundRequest;

/**
 * Resolve the originating client address of a request.
 *
 * <p>Sources in priority order:
 * <ol>
 *   <li>X-Forwarded-For (first address in the chain)</li>
 *   <li>RFC 7239 Forwarded header, {@code for=} of the first element</li>
 *   <li>X-Real-IP</li>
 *   <li>the direct peer address</li>
 * </ol>
 *
 * <p>Forwarding headers are skipped when {@link TrustedProxyValidator} does not trust the peer.
 */
@ApplicationScoped
public class ClientAddressResolver {

    private final TrustedProxyValidator trustedProxyValidator;

    @Inject
    public ClientAddressResolver(TrustedProxyValidator trustedProxyValidator) {
        this.trustedProxyValidator = trustedProxyValidator;
    }

    /**
     * Resolve the client address.
     *
     * @param request the request
     * @return the address, or {@link Identity#UNKNOWN_ADDRESS} when nothing is available
     */
    public String resolve(InboundRequest request) {
        if (trustedProxyValidator.shouldTrustForwardingHeaders(request.peerAddress())) {
            final var forwarded = fromForwardingHeaders(request);
            if (forwarded != null) {
                return forwarded;
            }
        }
        final var peer = request.peerAddress();
        return peer == null || peer.isBlank() ? Identity.UNKNOWN_ADDRESS : peer;
    }

    private String fromForwardingHeaders(InboundRequest request) {
        final var xff = request.xForwardedFor()
                .map(h -> h.split(",")[0].trim())
                .filter(v -> !v.isEmpty());
        if (xff.isPresent()) {
            return xff.get();
        }
        final var forwardedFor = request.forwarded().map(ClientAddressResolver::forParameter);
        if (forwardedFor.isPresent() && forwardedFor.get() != null) {
            return forwardedFor.get();
        }
        return request.xRealIp().map(String::trim).orElse(null);
    }

    /**
     * Extract {@code for=} from the first element of a Forwarded header, unquoting
     * and stripping brackets and port from IPv6 forms such as {@code "[2001:db8::1]:4711"}.
     */
    static String forParameter(String header) {
        final var firstElement = header.split(",")[0];
        for (final var pair : firstElement.split(";")) {
            final var kv = pair.trim().split("=", 2);
            if (kv.length != 2 || !kv[0].trim().equalsIgnoreCase("for")) {
                continue;
            }
            var value = kv[1].trim();
            if (value.length() >= 2 && value.startsWith("\"") && value.endsWith("\"")) {
                value = value.substring(1, value.length() - 1);
            }
            if (value.startsWith("[")) {
                final var close = value.indexOf(']');
                value = close > 0 ? value.substring(1, close) : value.substring(1);
            }
            return value.isEmpty() ? null : value;
        }
        return null;
    }
}
