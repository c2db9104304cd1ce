package shorted.core.service.identity;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import shorted.core.config.IdentityConfig;
import shorted.core.model.common.TrustedProxyConfig;

/**
 * Decides whether forwarding headers can be believed for a given peer address.
 *
 * <p>Proxy entries are parsed once at construction; entries that are not IP
 * literals or valid CIDRs are logged and ignored. Hostnames are never resolved.
 */
@ApplicationScoped
public class TrustedProxyValidator {

    private static final Logger LOG = Logger.getLogger(TrustedProxyValidator.class);

    private final boolean enabled;
    private final List<ProxyRange> ranges;

    @Inject
    public TrustedProxyValidator(IdentityConfig config) {
        this(config.trustedProxy());
    }

    TrustedProxyValidator(TrustedProxyConfig config) {
        this.enabled = config.enabled();
        this.ranges = parseRanges(config.proxies().orElse(List.of()));
        if (enabled && ranges.isEmpty()) {
            LOG.warn("Trusted proxy validation is enabled but no valid proxies are configured; "
                    + "forwarding headers will be ignored");
        }
    }

    /**
     * Check if forwarding headers should be trusted for the given peer.
     *
     * @param peerAddress the direct connection's remote IP address
     * @return true if forwarding headers should be trusted
     */
    public boolean shouldTrustForwardingHeaders(String peerAddress) {
        if (!enabled) {
            return true;
        }
        final var peer = toBytes(peerAddress);
        if (peer == null) {
            return false;
        }
        for (final var range : ranges) {
            if (range.contains(peer)) {
                return true;
            }
        }
        return false;
    }

    private static List<ProxyRange> parseRanges(List<String> entries) {
        final var parsed = new ArrayList<ProxyRange>(entries.size());
        for (final var entry : entries) {
            final var range = ProxyRange.parse(entry.trim());
            if (range == null) {
                LOG.warnf("Ignoring invalid trusted proxy entry: %s", entry);
            } else {
                parsed.add(range);
            }
        }
        return List.copyOf(parsed);
    }

    static byte[] toBytes(String address) {
        if (!isIpLiteral(address)) {
            return null;
        }
        try {
            return InetAddress.getByName(address).getAddress();
        } catch (UnknownHostException e) {
            return null;
        }
    }

    private static boolean isIpLiteral(String input) {
        if (input == null || input.isEmpty()) {
            return false;
        }
        if (input.contains(":")) {
            return true;
        }
        for (var i = 0; i < input.length(); i++) {
            final var c = input.charAt(i);
            if (c != '.' && !Character.isDigit(c)) {
                return false;
            }
        }
        return Character.isDigit(input.charAt(0));
    }

    private record ProxyRange(byte[] network, int prefixLength) {

        static ProxyRange parse(String entry) {
            final var slash = entry.indexOf('/');
            final var address = toBytes(slash < 0 ? entry : entry.substring(0, slash));
            if (address == null) {
                return null;
            }
            if (slash < 0) {
                return new ProxyRange(address, address.length * 8);
            }
            try {
                final var prefix = Integer.parseInt(entry.substring(slash + 1));
                if (prefix < 0 || prefix > address.length * 8) {
                    return null;
                }
                return new ProxyRange(address, prefix);
            } catch (NumberFormatException e) {
                return null;
            }
        }

        boolean contains(byte[] candidate) {
            if (candidate.length != network.length) {
                return false;
            }
            final var wholeBytes = prefixLength / 8;
            if (!Arrays.equals(network, 0, wholeBytes, candidate, 0, wholeBytes)) {
                return false;
            }
            final var remainingBits = prefixLength % 8;
            if (remainingBits == 0) {
                return true;
            }
            final var mask = (byte) (0xFF << (8 - remainingBits));
            return (network[wholeBytes] & mask) == (candidate[wholeBytes] & mask);
        }
    }
}
