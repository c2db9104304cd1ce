package shorted.core.service.identity;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

import java.util.Optional;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import shorted.core.model.identity.Identity;
import shorted.core.model.identity.InboundRequest;

@DisplayName("ClientAddressResolver")
class ClientAddressResolverTest {

    private final ClientAddressResolver trusting =
            new ClientAddressResolver(new TrustedProxyValidator(TrustedProxyValidatorTest.proxies(false)));

    private static InboundRequest request(String xff, String forwarded, String realIp, String peer) {
        return new InboundRequest(
                Optional.empty(),
                Optional.ofNullable(xff),
                Optional.ofNullable(forwarded),
                Optional.ofNullable(realIp),
                peer);
    }

    @Nested
    @DisplayName("header priority")
    class PriorityTests {

        @Test
        @DisplayName("uses the first X-Forwarded-For entry")
        void xffFirst() {
            var req = request("203.0.113.1, 10.0.0.2", "for=198.51.100.1", "192.0.2.1", "10.0.0.2");

            assertEquals("203.0.113.1", trusting.resolve(req));
        }

        @Test
        @DisplayName("falls back to Forwarded for=")
        void forwardedSecond() {
            var req = request(null, "for=198.51.100.1;proto=https", "192.0.2.1", "10.0.0.2");

            assertEquals("198.51.100.1", trusting.resolve(req));
        }

        @Test
        @DisplayName("falls back to X-Real-IP")
        void realIpThird() {
            var req = request(null, null, " 192.0.2.1 ", "10.0.0.2");

            assertEquals("192.0.2.1", trusting.resolve(req));
        }

        @Test
        @DisplayName("falls back to the peer, then to unknown")
        void peerThenUnknown() {
            assertEquals("10.0.0.2", trusting.resolve(InboundRequest.direct("10.0.0.2")));
            assertEquals(Identity.UNKNOWN_ADDRESS, trusting.resolve(InboundRequest.direct(null)));
        }
    }

    @Test
    @DisplayName("ignores forwarding headers from an untrusted peer")
    void untrustedPeer() {
        var strict = new ClientAddressResolver(
                new TrustedProxyValidator(TrustedProxyValidatorTest.proxies(true, "10.0.0.0/8")));

        assertEquals("203.0.113.50", strict.resolve(request("1.1.1.1", null, null, "203.0.113.50")));
        assertEquals("1.1.1.1", strict.resolve(request("1.1.1.1", null, null, "10.1.1.1")));
    }

    @Nested
    @DisplayName("Forwarded for= parsing")
    class ForwardedParsingTests {

        @Test
        @DisplayName("unquotes and strips IPv6 brackets and port")
        void ipv6() {
            assertEquals("2001:db8::1", ClientAddressResolver.forParameter("for=\"[2001:db8::1]:4711\""));
        }

        @Test
        @DisplayName("reads only the first element")
        void firstElement() {
            assertEquals("192.0.2.60", ClientAddressResolver.forParameter("for=192.0.2.60, for=198.51.100.17"));
        }

        @Test
        @DisplayName("is case-insensitive on the parameter name")
        void caseInsensitive() {
            assertEquals("192.0.2.43", ClientAddressResolver.forParameter("proto=http;For=192.0.2.43"));
        }

        @Test
        @DisplayName("returns null without a for= parameter")
        void missing() {
            assertNull(ClientAddressResolver.forParameter("proto=https;by=203.0.113.43"));
        }
    }
}
