package shorted.adapter.out.ratelimit;

import java.time.Clock;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import shorted.adapter.out.store.NoOpKeyValueStore;
import shorted.core.config.RateLimitingConfig;
import shorted.core.port.out.KeyValueStore;
import shorted.core.port.out.Metrics;
import shorted.core.port.out.RateLimiter;
import shorted.core.service.ratelimit.SlidingWindowRateLimiter;

/**
 * CDI producer for the rate limiter.
 *
 * <p>Produces the sliding window limiter over the shared store, or
 * {@link NoOpRateLimiter} when rate limiting is disabled or no store is configured.
 */
@ApplicationScoped
public class RateLimiterProducer {

    private static final Logger LOG = Logger.getLogger(RateLimiterProducer.class);

    private final RateLimitingConfig config;
    private final KeyValueStore store;
    private final Clock clock;
    private final Metrics metrics;

    @Inject
    public RateLimiterProducer(RateLimitingConfig config, KeyValueStore store, Clock clock, Metrics metrics) {
        this.config = config;
        this.store = store;
        this.clock = clock;
        this.metrics = metrics;
    }

    /**
     * Produces the rate limiter instance for CDI injection.
     *
     * @return the configured rate limiter
     */
    @Produces
    @ApplicationScoped
    public RateLimiter produceRateLimiter() {
        if (!config.enabled()) {
            LOG.info("Rate limiting is disabled, using NoOpRateLimiter");
            return NoOpRateLimiter.getInstance();
        }
        if (NoOpKeyValueStore.NAME.equals(store.name())) {
            LOG.warn("Rate limiting is enabled but no key-value store is configured, using NoOpRateLimiter");
            return NoOpRateLimiter.getInstance();
        }
        LOG.infov("Rate limiting enabled with sliding window over {0} store", store.name());
        return new SlidingWindowRateLimiter(store, clock, metrics);
    }
}
