package shorted.core.model.common;

/**
 * Thrown when the shared key-value store cannot serve an operation.
 *
 * <p>Covers connection errors, server errors and operation timeouts. Callers decide
 * how to degrade: the rate limiter fails open, the cache falls back to its producer.
 */
public class StoreUnavailableException extends RuntimeException {

    private final String operation;

    public StoreUnavailableException(String operation, String message) {
        super(message);
        this.operation = operation;
    }

    public StoreUnavailableException(String operation, String message, Throwable cause) {
        super(message, cause);
        this.operation = operation;
    }

    /** Returns the store operation that failed (e.g. {@code get}, {@code incr}). */
    public String getOperation() {
        return operation;
    }
}
