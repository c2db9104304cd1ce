package shorted.core.service.cache;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.quarkus.scheduler.Scheduled;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import shorted.core.config.CacheConfig;
import shorted.core.port.in.CacheWarming;

/**
 * Periodically warms the default dashboard entries when {@code shorted.cache.warm.scheduled=true}.
 */
@ApplicationScoped
public class CacheWarmScheduler {

    private static final Logger LOG = Logger.getLogger(CacheWarmScheduler.class);

    private final CacheWarming cacheWarming;
    private final CacheConfig config;

    @Inject
    public CacheWarmScheduler(CacheWarming cacheWarming, CacheConfig config) {
        this.cacheWarming = cacheWarming;
        this.config = config;
    }

    @Scheduled(
            every = "${shorted.cache.warm.every:15m}",
            delayed = "30s",
            concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    public Uni<Void> warmOnSchedule() {
        if (!config.warm().scheduled()) {
            return Uni.createFrom().voidItem();
        }
        LOG.debug("Starting scheduled cache warm...");
        return cacheWarming
                .warmDefaults()
                .invoke(report -> {
                    if (report.successCount() < report.total()) {
                        LOG.warnv("Scheduled cache warm incomplete: {0}/{1}", report.successCount(), report.total());
                    }
                })
                .replaceWithVoid();
    }
}
