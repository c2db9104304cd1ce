package shorted.adapter.out.telemetry;

/**
 * Constants for span attributes used in distributed tracing.
 *
 * <p>HTTP attributes follow OpenTelemetry semantic conventions; edge-specific
 * attributes use the {@code shorted.} namespace.
 *
 * @see <a href="https://opentelemetry.io/docs/specs/semconv/">OpenTelemetry Semantic Conventions</a>
 */
public final class SpanAttributes {

    private SpanAttributes() {}

    /** HTTP method (GET, POST, etc.). */
    public static final String HTTP_METHOD = "http.method";

    /** Full URL of the HTTP request. */
    public static final String HTTP_URL = "http.url";

    /** HTTP response status code. */
    public static final String HTTP_STATUS_CODE = "http.status_code";

    /** Upstream RPC method name. */
    public static final String RPC_METHOD = "rpc.method";

    /** Set when the caller gave up on an upstream call before it completed. */
    public static final String UPSTREAM_CANCELLED = "shorted.upstream.cancelled";

    /** Route class the request was counted against. */
    public static final String RATE_LIMIT_ROUTE_CLASS = "shorted.ratelimit.route_class";

    /** Whether the request was admitted. */
    public static final String RATE_LIMIT_ALLOWED = "shorted.ratelimit.allowed";

    /** Requests left in the window. */
    public static final String RATE_LIMIT_REMAINING = "shorted.ratelimit.remaining";

    /** Whether the caller was authenticated. */
    public static final String CALLER_AUTHENTICATED = "shorted.caller.authenticated";
}
