package shorted.core.model.common;

/**
 * Thrown when a value producer fails or does not answer in time.
 */
public class UpstreamFailureException extends RuntimeException {

    private final String key;
    private final boolean timeout;

    public UpstreamFailureException(String key, String message, Throwable cause, boolean timeout) {
        super(message, cause);
        this.key = key;
        this.timeout = timeout;
    }

    /**
     * Create an exception for a producer that exceeded its time budget.
     *
     * @param key the cache key being produced
     * @param timeoutDescription human readable timeout (e.g. {@code PT10S})
     * @return the exception
     */
    public static UpstreamFailureException timedOut(String key, String timeoutDescription) {
        return new UpstreamFailureException(
                key, "Producer for '%s' timed out after %s".formatted(key, timeoutDescription), null, true);
    }

    /**
     * Create an exception for a producer that failed.
     *
     * @param key the cache key being produced
     * @param cause the producer failure
     * @return the exception
     */
    public static UpstreamFailureException failed(String key, Throwable cause) {
        return new UpstreamFailureException(
                key, "Producer for '%s' failed: %s".formatted(key, cause.getMessage()), cause, false);
    }

    public String getKey() {
        return key;
    }

    public boolean isTimeout() {
        return timeout;
    }
}
