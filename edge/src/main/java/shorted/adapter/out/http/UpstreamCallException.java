package shorted.adapter.out.http;

/**
 * Thrown when the data API answers with an error status or an unreadable body.
 */
public class UpstreamCallException extends RuntimeException {

    private static final int MAX_DETAIL_LENGTH = 200;

    private final String method;
    private final int statusCode;

    public UpstreamCallException(String method, int statusCode, String detail) {
        super(message(method, statusCode, detail));
        this.method = method;
        this.statusCode = statusCode;
    }

    public UpstreamCallException(String method, int statusCode, String detail, Throwable cause) {
        super(message(method, statusCode, detail), cause);
        this.method = method;
        this.statusCode = statusCode;
    }

    public String getMethod() {
        return method;
    }

    public int getStatusCode() {
        return statusCode;
    }

    private static String message(String method, int statusCode, String detail) {
        var trimmed = detail == null ? "" : detail.strip();
        if (trimmed.length() > MAX_DETAIL_LENGTH) {
            trimmed = trimmed.substring(0, MAX_DETAIL_LENGTH) + "...";
        }
        return "%s returned HTTP %d%s".formatted(method, statusCode, trimmed.isEmpty() ? "" : ": " + trimmed);
    }
}
