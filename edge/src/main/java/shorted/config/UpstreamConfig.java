package shorted.config;

import java.time.Duration;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for the Shorted data API.
 *
 * <p>Configuration prefix: {@code shorted.upstream}
 */
@ConfigMapping(prefix = "shorted.upstream")
public interface UpstreamConfig {

    /**
     * Base URL of the data API, e.g. {@code http://shorts:9091}.
     *
     * @return base URL (default: http://localhost:9091)
     */
    @WithDefault("http://localhost:9091")
    String baseUrl();

    /** @return HTTP request timeout (default: 10 seconds) */
    @WithDefault("PT10S")
    Duration requestTimeout();
}
