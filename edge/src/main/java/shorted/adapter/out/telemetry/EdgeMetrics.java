package shorted.adapter.out.telemetry;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;

import shorted.config.TelemetryConfig;
import shorted.core.port.out.Metrics;

/**
 * Micrometer-based implementation of edge metrics.
 *
 * <p>Metrics exposed:
 * <ul>
 *   <li>{@code shorted.ratelimit.decisions.total} - decisions by route class, caller kind and outcome</li>
 *   <li>{@code shorted.cache.lookups.total} - cache lookups by outcome (fresh, stale, miss, bypass)</li>
 *   <li>{@code shorted.cache.refresh.failures.total} - failed background refreshes</li>
 *   <li>{@code shorted.cache.warm.tasks.total} - warm tasks by result</li>
 *   <li>{@code shorted.store.failures.total} - store failures by backend, operation and kind</li>
 * </ul>
 */
@ApplicationScoped
public class EdgeMetrics implements Metrics {

    private final MeterRegistry registry;
    private final boolean enabled;

    @Inject
    public EdgeMetrics(MeterRegistry registry, TelemetryConfig config) {
        this.registry = registry;
        this.enabled = config.metricsEnabled();
    }

    @Override
    public void recordRateLimitDecision(String routeClass, boolean authenticated, boolean allowed) {
        if (!enabled) {
            return;
        }

        Counter.builder("shorted.ratelimit.decisions.total")
                .description("Rate limit decisions")
                .tag("route_class", routeClass)
                .tag("caller", authenticated ? "authenticated" : "anonymous")
                .tag("outcome", allowed ? "allowed" : "rejected")
                .register(registry)
                .increment();
    }

    @Override
    public void recordCacheLookup(String outcome) {
        if (!enabled) {
            return;
        }

        Counter.builder("shorted.cache.lookups.total")
                .description("Cache lookups by outcome")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    @Override
    public void recordRefreshFailure() {
        if (!enabled) {
            return;
        }

        Counter.builder("shorted.cache.refresh.failures.total")
                .description("Failed background cache refreshes")
                .register(registry)
                .increment();
    }

    @Override
    public void recordWarmTask(boolean success) {
        if (!enabled) {
            return;
        }

        Counter.builder("shorted.cache.warm.tasks.total")
                .description("Cache warm tasks by result")
                .tag("result", success ? "success" : "failure")
                .register(registry)
                .increment();
    }

    @Override
    public void recordStoreFailure(String backend, String operation, boolean timeout) {
        if (!enabled) {
            return;
        }

        Counter.builder("shorted.store.failures.total")
                .description("Key-value store operation failures")
                .tag("backend", backend)
                .tag("operation", operation)
                .tag("kind", timeout ? "timeout" : "error")
                .register(registry)
                .increment();
    }
}
