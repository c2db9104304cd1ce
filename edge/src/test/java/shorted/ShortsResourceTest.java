package shorted;

import static io.restassured.RestAssured.given;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.notNullValue;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.concurrent.atomic.AtomicInteger;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.quarkus.test.InjectMock;
import io.quarkus.test.junit.QuarkusTest;
import io.restassured.specification.RequestSpecification;
import io.smallrye.mutiny.Uni;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import shorted.core.port.out.ShortsDataSource;

/**
 * Dashboard endpoints. Cached entries outlive a single test, so every test asks for
 * parameters no other test uses.
 */
@QuarkusTest
@DisplayName("Shorts Resource Tests")
class ShortsResourceTest {

    private static final AtomicInteger CLIENTS = new AtomicInteger();

    @InjectMock
    ShortsDataSource dataSource;

    // One address per request keeps these tests clear of the rate limit.
    private static RequestSpecification client() {
        return given().header("X-Forwarded-For", "203.0.113." + (CLIENTS.incrementAndGet() % 250));
    }

    private static ObjectNode series(String... productCodes) {
        final var body = JsonNodeFactory.instance.objectNode();
        final var timeSeries = body.putArray("timeSeries");
        for (final var code : productCodes) {
            final var entry = timeSeries.addObject();
            entry.put("productCode", code);
            entry.putArray("points").addObject().put("timestamp", "2024-05-01T00:00:00Z");
        }
        return body;
    }

    @Nested
    @DisplayName("Top shorts")
    class TopShorts {

        @Test
        @DisplayName("Should return the upstream response")
        void shouldReturnUpstreamResponse() {
            when(dataSource.topShorts("6m", 7, 0)).thenReturn(Uni.createFrom().item(series("CBA", "BHP")));

            client().queryParam("period", "6m")
                    .queryParam("limit", 7)
                    .when()
                    .get("/api/shorts/top")
                    .then()
                    .statusCode(200)
                    .body("timeSeries.size()", equalTo(2))
                    .body("timeSeries[0].productCode", equalTo("CBA"));
        }

        @Test
        @DisplayName("Should serve repeated requests from the cache")
        void shouldServeFromCache() {
            when(dataSource.topShorts("1y", 8, 0)).thenReturn(Uni.createFrom().item(series("WES")));

            for (int i = 0; i < 2; i++) {
                client().queryParam("period", "1y")
                        .queryParam("limit", 8)
                        .when()
                        .get("/api/shorts/top")
                        .then()
                        .statusCode(200)
                        .body("timeSeries[0].productCode", equalTo("WES"));
            }

            verify(dataSource, times(1)).topShorts("1y", 8, 0);
        }

        @Test
        @DisplayName("Should reject a limit above the maximum")
        void shouldRejectLargeLimit() {
            client().queryParam("limit", 500)
                    .when()
                    .get("/api/shorts/top")
                    .then()
                    .statusCode(400)
                    .contentType(containsString("application/problem+json"))
                    .body("detail", containsString("limit"));
        }

        @Test
        @DisplayName("Should reject a negative offset")
        void shouldRejectNegativeOffset() {
            client().queryParam("offset", -1).when().get("/api/shorts/top").then().statusCode(400);
        }

        @Test
        @DisplayName("Should map an upstream failure to 502")
        void shouldMapUpstreamFailure() {
            when(dataSource.topShorts("max", 9, 0))
                    .thenReturn(Uni.createFrom().failure(new IllegalStateException("connection refused")));

            client().queryParam("period", "max")
                    .queryParam("limit", 9)
                    .when()
                    .get("/api/shorts/top")
                    .then()
                    .statusCode(502)
                    .body("title", equalTo("Bad Gateway"));
        }
    }

    @Nested
    @DisplayName("Parameter validation")
    class ParameterValidation {

        @Test
        @DisplayName("Should reject a period outside the known codes")
        void shouldRejectUnknownPeriod() {
            client().queryParam("period", "3m:10:X")
                    .queryParam("viewMode", "CURRENT_CHANGE")
                    .when()
                    .get("/api/shorts/treemap")
                    .then()
                    .statusCode(400)
                    .body("detail", containsString("period"));

            verify(dataSource, never()).industryTreeMap(anyString(), anyInt(), anyString());
        }

        @Test
        @DisplayName("Should reject a view mode outside the tree map views")
        void shouldRejectUnknownViewMode() {
            client().queryParam("period", "3m")
                    .queryParam("viewMode", "X:10:Y")
                    .when()
                    .get("/api/shorts/treemap")
                    .then()
                    .statusCode(400)
                    .body("detail", containsString("viewMode"));

            verify(dataSource, never()).industryTreeMap(anyString(), anyInt(), anyString());
        }

        @Test
        @DisplayName("Should reject an unknown period for top shorts")
        void shouldRejectUnknownTopShortsPeriod() {
            client().queryParam("period", "forever").when().get("/api/shorts/top").then().statusCode(400);
        }

        @Test
        @DisplayName("Should reject a malformed stock code")
        void shouldRejectMalformedCode() {
            client().when().get("/api/stocks/TOOLONGCODE/tooltip").then().statusCode(400);

            verify(dataSource, never()).stockDetails(anyString());
        }
    }

    @Test
    @DisplayName("Should pass tree map parameters upstream")
    void shouldReturnTreeMap() {
        final var body = JsonNodeFactory.instance.objectNode();
        body.putArray("industries").addObject().put("industry", "Materials");
        when(dataSource.industryTreeMap("1m", 4, "PERCENTAGE_CHANGE")).thenReturn(Uni.createFrom().item(body));

        client().queryParam("period", "1m")
                .queryParam("limit", 4)
                .queryParam("viewMode", "PERCENTAGE_CHANGE")
                .when()
                .get("/api/shorts/treemap")
                .then()
                .statusCode(200)
                .body("industries[0].industry", equalTo("Materials"));
    }

    @Test
    @DisplayName("Should combine details and data into a tooltip")
    void shouldReturnTooltip() {
        final var details = JsonNodeFactory.instance.objectNode().put("companyName", "Zip Co");
        final var data = series("ZIP");
        when(dataSource.stockDetails("ZIP")).thenReturn(Uni.createFrom().item(details));
        when(dataSource.stockData(eq("ZIP"), anyString())).thenReturn(Uni.createFrom().item(data));

        client().when()
                .get("/api/stocks/zip/tooltip")
                .then()
                .statusCode(200)
                .body("details.companyName", equalTo("Zip Co"))
                .body("data.timeSeries[0].productCode", equalTo("ZIP"));
    }

    @Nested
    @DisplayName("About page")
    class About {

        @Test
        @DisplayName("Should serve statistics derived from the top shorts sample")
        void shouldServeStatistics() {
            when(dataSource.topShorts(anyString(), anyInt(), anyInt()))
                    .thenReturn(Uni.createFrom().item(series("AAA", "BBB", "CCC")));

            client().when()
                    .get("/api/about/statistics")
                    .then()
                    .statusCode(200)
                    .body("companyCount", notNullValue())
                    .body("industryCount", notNullValue());
        }

        @Test
        @DisplayName("Should reject a zero limit for top stocks")
        void shouldRejectZeroLimit() {
            client().queryParam("limit", 0).when().get("/api/about/top-stocks").then().statusCode(400);
        }
    }
}
