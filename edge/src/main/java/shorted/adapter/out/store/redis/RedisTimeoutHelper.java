package shorted.adapter.out.store.redis;

import java.time.Duration;

import io.smallrye.mutiny.TimeoutException;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import shorted.core.model.common.StoreUnavailableException;
import shorted.core.port.out.Metrics;

/**
 * Bounds Redis operations by a timeout and normalizes their failures.
 *
 * <p>Every failure, whether a timeout, connection error or server error, is
 * logged, counted ({@code shorted.store.failures.total}) and re-raised as
 * {@link StoreUnavailableException}. Callers decide how to degrade.
 */
public class RedisTimeoutHelper {

    private static final Logger LOG = Logger.getLogger(RedisTimeoutHelper.class);

    private final Duration timeout;
    private final Metrics metrics;
    private final String backendName;

    /**
     * Create a new timeout helper.
     *
     * @param timeout the timeout duration for Redis operations
     * @param metrics the metrics instance (may be null)
     * @param backendName the backend name for metrics tagging
     */
    public RedisTimeoutHelper(Duration timeout, Metrics metrics, String backendName) {
        this.timeout = timeout;
        this.metrics = metrics;
        this.backendName = backendName;
    }

    /**
     * Apply the timeout to an operation.
     *
     * @param operation the Redis operation
     * @param operationName name for logging and metrics
     * @param <T> the result type
     * @return a Uni that fails with StoreUnavailableException on timeout or failure
     */
    public <T> Uni<T> bounded(Uni<T> operation, String operationName) {
        return operation
                .ifNoItem()
                .after(timeout)
                .fail()
                .onFailure()
                .transform(error -> {
                    final var timedOut = error instanceof TimeoutException;
                    if (timedOut) {
                        LOG.warnv("Redis operation timeout: {0} after {1}", operationName, timeout);
                    } else {
                        LOG.warnv("Redis operation failure: {0}: {1}", operationName, error.getMessage());
                    }
                    record(operationName, timedOut);
                    return timedOut
                            ? new StoreUnavailableException(
                                    operationName, "Redis " + operationName + " timed out after " + timeout)
                            : new StoreUnavailableException(
                                    operationName, "Redis " + operationName + " failed: " + error.getMessage(), error);
                });
    }

    private void record(String operationName, boolean timedOut) {
        if (metrics != null) {
            metrics.recordStoreFailure(backendName, operationName, timedOut);
        }
    }
}
