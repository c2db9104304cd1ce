package shorted.core.port.out;

import com.fasterxml.jackson.databind.JsonNode;
import io.smallrye.mutiny.Uni;

/**
 * Port interface for the Shorted data API.
 *
 * <p>Responses are returned as JSON trees; the edge caches them as-is.
 */
public interface ShortsDataSource {

    /**
     * Most shorted stocks over a period.
     *
     * @param period period code ({@code 1m}, {@code 3m}, {@code 6m}, {@code 1y}, {@code max})
     * @param limit page size
     * @param offset page offset
     * @return the response, with a {@code timeSeries} array
     */
    Uni<JsonNode> topShorts(String period, int limit, int offset);

    /**
     * Industry tree map of short positions.
     *
     * @param period period code
     * @param limit stocks per industry
     * @param viewMode {@code CURRENT_CHANGE} or {@code PERCENTAGE_CHANGE}
     * @return the response
     */
    Uni<JsonNode> industryTreeMap(String period, int limit, String viewMode);

    /**
     * Company details of a stock.
     *
     * @param productCode the ASX code
     * @return the response
     */
    Uni<JsonNode> stockDetails(String productCode);

    /**
     * Short position time series of a stock.
     *
     * @param productCode the ASX code
     * @param period period code
     * @return the response
     */
    Uni<JsonNode> stockData(String productCode, String period);

    /**
     * Stocks matching a code or company name.
     *
     * @param query the search text
     * @param limit maximum results
     * @return the response
     */
    Uni<JsonNode> searchStocks(String query, int limit);
}
