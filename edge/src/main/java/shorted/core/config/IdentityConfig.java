package shorted.core.config;

import java.time.Duration;
import java.util.Optional;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

import shorted.core.model.common.TrustedProxyConfig;

/**
 * Configuration mapping for caller identification.
 *
 * <p>Configuration prefix: {@code shorted.identity}
 *
 * <h2>Environment Variables</h2>
 * <ul>
 *   <li>{@code SHORTED_IDENTITY_SESSION_SECRET} - HMAC secret shared with the session issuer</li>
 *   <li>{@code SHORTED_IDENTITY_TRUSTED_PROXY_ENABLED} - Only trust forwarding headers from known proxies</li>
 *   <li>{@code SHORTED_IDENTITY_TRUSTED_PROXY_PROXIES} - Comma-separated proxy IPs/CIDRs</li>
 * </ul>
 */
@ConfigMapping(prefix = "shorted.identity")
public interface IdentityConfig {

    /** @return name of the session cookie (default: authjs.session-token) */
    @WithDefault("authjs.session-token")
    String sessionCookie();

    /** @return header consulted when the session cookie is absent (default: X-Session-Token) */
    @WithDefault("X-Session-Token")
    String sessionHeader();

    /** Session token verification. */
    SessionConfig session();

    /** Forwarding header trust. */
    TrustedProxyConfig trustedProxy();

    /**
     * Signed session token settings.
     */
    interface SessionConfig {

        /**
         * HMAC-SHA256 secret of the session issuer.
         *
         * <p>When absent no session verifies and every caller is anonymous.
         */
        Optional<String> secret();

        /** @return expected issuer claim, if any */
        Optional<String> issuer();

        /** @return allowed clock skew when checking expiry (default: 30 seconds) */
        @WithDefault("PT30S")
        Duration clockSkew();

        /** @return upper bound on verification (default: 1 second) */
        @WithDefault("PT1S")
        Duration timeout();
    }
}
