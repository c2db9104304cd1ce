package shorted.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for edge telemetry.
 *
 * <p>Configuration prefix: {@code shorted.telemetry}
 */
@ConfigMapping(prefix = "shorted.telemetry")
public interface TelemetryConfig {

    /** @return true to record Micrometer metrics (default: true) */
    @WithDefault("true")
    boolean metricsEnabled();

    /** @return true to add rate limit attributes to the current span (default: true) */
    @WithDefault("true")
    boolean spanAttributesEnabled();
}
