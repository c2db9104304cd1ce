package shorted.core.port.out;

/**
 * Port interface for recording edge metrics.
 *
 * <p>Implementations handle the actual metric recording (e.g., Micrometer).
 */
public interface Metrics {

    /**
     * Record a rate limit decision.
     *
     * @param routeClass the route class
     * @param authenticated whether the caller was authenticated
     * @param allowed whether the request was allowed
     */
    void recordRateLimitDecision(String routeClass, boolean authenticated, boolean allowed);

    /**
     * Record a cache lookup.
     *
     * @param outcome {@code fresh}, {@code stale}, {@code miss} or {@code bypass}
     */
    void recordCacheLookup(String outcome);

    /**
     * Record a failed background refresh.
     */
    void recordRefreshFailure();

    /**
     * Record a warm task result.
     *
     * @param success whether the task succeeded
     */
    void recordWarmTask(boolean success);

    /**
     * Record a store operation failure.
     *
     * @param backend the store backend name
     * @param operation the operation name
     * @param timeout whether the failure was a timeout
     */
    void recordStoreFailure(String backend, String operation, boolean timeout);
}
