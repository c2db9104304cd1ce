package shorted.core.port.in;

import com.fasterxml.jackson.databind.JsonNode;
import io.smallrye.mutiny.Uni;

import shorted.core.model.shorts.AboutStatistics;

/**
 * Use case for the cached dashboard data.
 *
 * <p>Every query is served through the shared stale-while-revalidate cache.
 */
public interface DashboardQueries {

    Uni<JsonNode> topShorts(String period, int limit, int offset);

    Uni<JsonNode> treeMap(String period, int limit, String viewMode);

    /**
     * Tooltip data of a stock: company details plus its recent short position series.
     *
     * @param productCode the ASX code
     * @return an object with {@code details} and {@code data} members
     */
    Uni<JsonNode> stockTooltip(String productCode);

    Uni<AboutStatistics> aboutStatistics();

    Uni<JsonNode> aboutTopStocks(int limit);

    Uni<JsonNode> searchStocks(String query, int limit);
}
