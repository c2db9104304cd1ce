package shorted.core.config;

import java.util.List;
import java.util.Map;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for request admission control.
 *
 * <p>Configuration prefix: {@code shorted.rate-limiting}
 *
 * <h2>Environment Variables</h2>
 * <ul>
 *   <li>{@code SHORTED_RATE_LIMITING_ENABLED} - Enable/disable rate limiting</li>
 *   <li>{@code SHORTED_RATE_LIMITING_ROUTES__API__ANONYMOUS_LIMIT} - Anonymous limit of the {@code api} class</li>
 *   <li>{@code SHORTED_RATE_LIMITING_ROUTES__API__AUTHENTICATED_LIMIT} - Authenticated limit of the {@code api} class</li>
 * </ul>
 */
@ConfigMapping(prefix = "shorted.rate-limiting")
public interface RateLimitingConfig {

    /**
     * Enable or disable rate limiting globally.
     *
     * @return true if rate limiting is enabled (default: true)
     */
    @WithDefault("true")
    boolean enabled();

    /**
     * Include X-RateLimit-* headers in responses.
     *
     * @return true to include headers (default: true)
     */
    @WithDefault("true")
    boolean includeHeaders();

    /**
     * Route classes keyed by name.
     *
     * <p>The name is part of every counter key, so renaming a class resets its counters.
     */
    Map<String, RouteClassConfig> routes();

    /**
     * Limits and protected paths of a single route class.
     */
    interface RouteClassConfig {

        /** @return requests per window for anonymous callers (default: 50) */
        @WithDefault("50")
        long anonymousLimit();

        /** @return requests per window for authenticated callers (default: 500) */
        @WithDefault("500")
        long authenticatedLimit();

        /** @return window length in seconds (default: 60) */
        @WithDefault("60")
        long windowSeconds();

        /**
         * Request path prefixes protected by this class, e.g. {@code /api/search}.
         *
         * <p>The longest matching prefix across all classes wins.
         */
        List<String> paths();
    }
}
