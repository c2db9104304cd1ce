package shorted.config;

import java.time.Clock;
import java.util.concurrent.Executor;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;

import io.smallrye.mutiny.infrastructure.Infrastructure;

import shorted.core.service.cache.RefreshExecutor;

/**
 * CDI producers for the time source and the background refresh executor.
 */
@ApplicationScoped
public class EdgeProducers {

    @Produces
    @Singleton
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Executor for stale-entry refreshes. Work submitted here outlives the request that triggered it.
     */
    @Produces
    @Singleton
    @RefreshExecutor
    public Executor refreshExecutor() {
        return Infrastructure.getDefaultWorkerPool();
    }
}
