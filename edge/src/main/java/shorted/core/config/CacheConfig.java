package shorted.core.config;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for the shared data cache and its warmer.
 *
 * <p>Configuration prefix: {@code shorted.cache}
 *
 * <h2>Environment Variables</h2>
 * <ul>
 *   <li>{@code SHORTED_CACHE_WARM_SECRET} - Shared secret of the warm endpoint</li>
 *   <li>{@code SHORTED_CACHE_WARM_SCHEDULED} - Warm on a schedule</li>
 *   <li>{@code SHORTED_CACHE_WARM_EVERY} - Warm interval, e.g. {@code 15m}</li>
 * </ul>
 */
@ConfigMapping(prefix = "shorted.cache")
public interface CacheConfig {

    /**
     * Freshness policies keyed by name ({@code homepage}, {@code about}, {@code tooltip}, {@code search}).
     *
     * <p>Unknown names fall back to the {@code default} policy values.
     */
    Map<String, PolicyConfig> policies();

    /** Cache warming. */
    WarmConfig warm();

    /**
     * A named freshness policy.
     */
    interface PolicyConfig {

        /** @return time a value is served without refresh (default: 5 minutes) */
        @WithDefault("PT5M")
        Duration ttlFresh();

        /** @return stale window as a multiple of the fresh window (default: 10) */
        @WithDefault("10")
        int staleMultiplier();

        /** @return producer time budget (default: 10 seconds) */
        @WithDefault("PT10S")
        Duration producerTimeout();
    }

    /**
     * Cache warm trigger settings.
     */
    interface WarmConfig {

        /**
         * Shared secret required by the warm endpoint.
         *
         * <p>When absent the endpoint is open.
         */
        Optional<String> secret();

        /** @return whether the scheduler warms the cache (default: false) */
        @WithDefault("false")
        boolean scheduled();

        /** @return scheduler interval (default: 15m) */
        @WithDefault("15m")
        String every();
    }
}
