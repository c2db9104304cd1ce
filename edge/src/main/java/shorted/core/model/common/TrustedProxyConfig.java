package shorted.core.model.common;

import java.util.List;
import java.util.Optional;

import io.smallrye.config.WithDefault;

/**
 * Forwarding header trust settings.
 *
 * <p>When enabled, {@code X-Forwarded-For}, {@code Forwarded} and {@code X-Real-IP}
 * are ignored unless the direct peer is a listed proxy IP or inside a listed CIDR.
 */
public interface TrustedProxyConfig {

    /** @return true if proxy validation is enabled (default: false) */
    @WithDefault("false")
    boolean enabled();

    /** @return trusted proxy IPs/CIDRs, e.g. {@code 10.0.0.0/8} */
    Optional<List<String>> proxies();
}
