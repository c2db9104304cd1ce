package shorted.core.service.cache;

import java.time.Clock;
import java.time.Duration;
import java.util.List;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import shorted.core.model.cache.WarmReport;
import shorted.core.model.cache.WarmResult;
import shorted.core.model.cache.WarmTask;
import shorted.core.model.common.UpstreamFailureException;
import shorted.core.port.in.CacheWarming;
import shorted.core.port.out.Metrics;

/**
 * Populates cache entries ahead of demand.
 *
 * <p>Tasks run concurrently and write through {@link StaleWhileRevalidateCache#populate},
 * bypassing the freshness check. A failing task never affects the others. A run starts
 * as soon as {@link #warm} is called and completes even if the returned {@code Uni} is
 * cancelled.
 */
@ApplicationScoped
public class CacheWarmer implements CacheWarming {

    private static final Logger LOG = Logger.getLogger(CacheWarmer.class);

    private final StaleWhileRevalidateCache cache;
    private final DefaultWarmTasks defaultTasks;
    private final Clock clock;
    private final Metrics metrics;

    @Inject
    public CacheWarmer(
            StaleWhileRevalidateCache cache, DefaultWarmTasks defaultTasks, Clock clock, Metrics metrics) {
        this.cache = cache;
        this.defaultTasks = defaultTasks;
        this.clock = clock;
        this.metrics = metrics;
    }

    @Override
    public Uni<WarmReport> warm(List<WarmTask> tasks) {
        final var startedAt = clock.millis();
        if (tasks.isEmpty()) {
            return Uni.createFrom().item(() -> new WarmReport(List.of(), Duration.ZERO, clock.instant()));
        }
        final var runs = tasks.stream().map(this::run).toList();
        final var report = Uni.join()
                .all(runs)
                .andFailFast()
                .map(results -> {
                    final var finished =
                            new WarmReport(results, Duration.ofMillis(clock.millis() - startedAt), clock.instant());
                    LOG.infov(
                            "Cache warmed: {0}/{1} successful in {2}ms",
                            finished.successCount(), finished.total(), finished.duration().toMillis());
                    return finished;
                })
                .memoize()
                .indefinitely();

        // Started here so that a caller going away does not cancel writes already in flight.
        report.subscribe().with(
                ignored -> LOG.debug("Warm run completed"),
                error -> LOG.errorv(error, "Warm run failed unexpectedly"));
        return report;
    }

    @Override
    public Uni<WarmReport> warmDefaults() {
        return warm(defaultTasks.tasks());
    }

    private Uni<WarmResult> run(WarmTask task) {
        return cache.populate(task.key(), task.policy(), task.producer())
                .map(ignored -> WarmResult.ok(task.name()))
                .onFailure()
                .recoverWithItem(error -> {
                    LOG.warnv("Warm task {0} ({1}) failed: {2}", task.name(), task.key(), error.getMessage());
                    return WarmResult.failed(task.name(), describe(error));
                })
                .invoke(result -> metrics.recordWarmTask(result.success()));
    }

    private static String describe(Throwable error) {
        if (error instanceof UpstreamFailureException upstream && !upstream.isTimeout() && error.getCause() != null) {
            return error.getCause().getMessage();
        }
        return error.getMessage();
    }
}
