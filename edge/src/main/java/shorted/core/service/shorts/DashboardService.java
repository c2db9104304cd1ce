package shorted.core.service.shorts;

import java.util.Locale;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import io.smallrye.mutiny.Uni;

import shorted.core.model.cache.CacheKeys;
import shorted.core.model.shorts.AboutStatistics;
import shorted.core.port.in.DashboardQueries;
import shorted.core.port.out.ShortsDataSource;
import shorted.core.service.cache.CachePolicies;
import shorted.core.service.cache.StaleWhileRevalidateCache;

/**
 * Dashboard queries served through the shared cache.
 */
@ApplicationScoped
public class DashboardService implements DashboardQueries {

    static final String TOOLTIP_PERIOD = "1m";

    private final StaleWhileRevalidateCache cache;
    private final CachePolicies policies;
    private final ShortsDataSource dataSource;

    @Inject
    public DashboardService(StaleWhileRevalidateCache cache, CachePolicies policies, ShortsDataSource dataSource) {
        this.cache = cache;
        this.policies = policies;
        this.dataSource = dataSource;
    }

    @Override
    public Uni<JsonNode> topShorts(String period, int limit, int offset) {
        return cache.getOrRefresh(
                CacheKeys.topShorts(period, limit, offset),
                policies.homepage(),
                JsonNode.class,
                () -> dataSource.topShorts(period, limit, offset));
    }

    @Override
    public Uni<JsonNode> treeMap(String period, int limit, String viewMode) {
        return cache.getOrRefresh(
                CacheKeys.treeMap(period, limit, viewMode),
                policies.homepage(),
                JsonNode.class,
                () -> dataSource.industryTreeMap(period, limit, viewMode));
    }

    @Override
    public Uni<JsonNode> stockTooltip(String productCode) {
        final var code = productCode.toUpperCase(Locale.ROOT);
        return cache.getOrRefresh(CacheKeys.stockTooltip(code), policies.tooltip(), JsonNode.class, () -> Uni.combine()
                .all()
                .unis(dataSource.stockDetails(code), dataSource.stockData(code, TOOLTIP_PERIOD))
                .asTuple()
                .map(parts -> {
                    final var tooltip = JsonNodeFactory.instance.objectNode();
                    tooltip.set("details", parts.getItem1());
                    tooltip.set("data", parts.getItem2());
                    return (JsonNode) tooltip;
                }));
    }

    @Override
    public Uni<AboutStatistics> aboutStatistics() {
        return cache.getOrRefresh(
                CacheKeys.aboutStatistics(),
                policies.about(),
                AboutStatistics.class,
                () -> AboutStatisticsCalculator.fetch(dataSource));
    }

    @Override
    public Uni<JsonNode> aboutTopStocks(int limit) {
        return cache.getOrRefresh(
                CacheKeys.aboutTopStocks(limit),
                policies.about(),
                JsonNode.class,
                () -> dataSource.topShorts(AboutStatisticsCalculator.PERIOD, limit, 0));
    }

    @Override
    public Uni<JsonNode> searchStocks(String query, int limit) {
        return cache.getOrRefresh(
                CacheKeys.searchStocks(query, limit),
                policies.search(),
                JsonNode.class,
                () -> dataSource.searchStocks(query.trim(), limit));
    }
}
