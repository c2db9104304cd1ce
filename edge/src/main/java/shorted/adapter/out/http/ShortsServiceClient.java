package shorted.adapter.out.http;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.smallrye.mutiny.Uni;
import io.vertx.core.json.JsonObject;
import io.vertx.mutiny.core.Vertx;
import io.vertx.mutiny.core.buffer.Buffer;
import io.vertx.mutiny.ext.web.client.HttpResponse;
import io.vertx.mutiny.ext.web.client.WebClient;
import org.jboss.logging.Logger;

import shorted.adapter.out.telemetry.SpanAttributes;
import shorted.config.UpstreamConfig;
import shorted.core.port.out.ShortsDataSource;

/**
 * HTTP adapter for the Shorted data API using Vert.x WebClient.
 *
 * <p>Calls are Connect unary RPCs: a JSON {@code POST} to
 * {@code {base-url}/shorts.v1alpha1.ShortedStocksService/{Method}}. Non-2xx
 * responses fail with {@link UpstreamCallException}.
 */
@ApplicationScoped
public class ShortsServiceClient implements ShortsDataSource {

    private static final Logger LOG = Logger.getLogger(ShortsServiceClient.class);

    static final String SERVICE_PATH = "/shorts.v1alpha1.ShortedStocksService/";

    private final Vertx vertx;
    private final UpstreamConfig config;
    private final ObjectMapper objectMapper;
    private final Tracer tracer;
    private WebClient webClient;

    @Inject
    public ShortsServiceClient(Vertx vertx, UpstreamConfig config, ObjectMapper objectMapper, Tracer tracer) {
        this.vertx = vertx;
        this.config = config;
        this.objectMapper = objectMapper;
        this.tracer = tracer;
    }

    @PostConstruct
    void init() {
        this.webClient = WebClient.create(vertx);
    }

    @PreDestroy
    void close() {
        if (webClient != null) {
            webClient.close();
        }
    }

    @Override
    public Uni<JsonNode> topShorts(String period, int limit, int offset) {
        final var body = objectMapper.createObjectNode()
                .put("period", period)
                .put("limit", limit)
                .put("offset", offset);
        return call("GetTopShorts", body);
    }

    @Override
    public Uni<JsonNode> industryTreeMap(String period, int limit, String viewMode) {
        final var body = objectMapper.createObjectNode()
                .put("period", period)
                .put("limit", limit)
                .put("viewMode", viewMode);
        return call("GetIndustryTreeMap", body);
    }

    @Override
    public Uni<JsonNode> stockDetails(String productCode) {
        return call("GetStockDetails", objectMapper.createObjectNode().put("productCode", productCode));
    }

    @Override
    public Uni<JsonNode> stockData(String productCode, String period) {
        final var body = objectMapper.createObjectNode()
                .put("productCode", productCode)
                .put("period", period);
        return call("GetStockData", body);
    }

    @Override
    public Uni<JsonNode> searchStocks(String query, int limit) {
        final var body = objectMapper.createObjectNode()
                .put("query", query)
                .put("limit", limit);
        return call("SearchStocks", body);
    }

    Uni<JsonNode> call(String method, ObjectNode body) {
        final var url = methodUrl(method);
        final var span = tracer.spanBuilder("POST " + method)
                .setSpanKind(SpanKind.CLIENT)
                .setAttribute(SpanAttributes.HTTP_METHOD, "POST")
                .setAttribute(SpanAttributes.HTTP_URL, url)
                .setAttribute(SpanAttributes.RPC_METHOD, method)
                .startSpan();

        return webClient
                .postAbs(url)
                .putHeader("Content-Type", "application/json")
                .putHeader("Connect-Protocol-Version", "1")
                .timeout(config.requestTimeout().toMillis())
                .sendJsonObject(new JsonObject(body.toString()))
                .map(response -> parse(method, response))
                .invoke(ignored -> span.end())
                .onFailure()
                .invoke(error -> {
                    LOG.debugv("Upstream call {0} failed: {1}", method, error.getMessage());
                    span.setStatus(StatusCode.ERROR, error.getMessage());
                    span.recordException(error);
                    span.end();
                })
                .onCancellation()
                .invoke(() -> {
                    LOG.debugv("Upstream call {0} cancelled", method);
                    span.setAttribute(SpanAttributes.UPSTREAM_CANCELLED, true);
                    span.end();
                });
    }

    String methodUrl(String method) {
        var base = config.baseUrl();
        while (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return base + SERVICE_PATH + method;
    }

    private JsonNode parse(String method, HttpResponse<Buffer> response) {
        if (response.statusCode() < 200 || response.statusCode() >= 300) {
            throw new UpstreamCallException(method, response.statusCode(), response.bodyAsString());
        }
        final var payload = response.bodyAsString();
        if (payload == null || payload.isBlank()) {
            return objectMapper.createObjectNode();
        }
        try {
            return objectMapper.readTree(payload);
        } catch (JsonProcessingException e) {
            throw new UpstreamCallException(method, response.statusCode(), "unparseable response body", e);
        }
    }
}
