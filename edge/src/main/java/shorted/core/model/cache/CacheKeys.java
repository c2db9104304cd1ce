package shorted.core.model.cache;

import java.util.Locale;

/**
 * Well-known cache keys of the dashboard data.
 *
 * <p>Keys for the same logical query must be identical across replicas, so every
 * parameter that changes the result is part of the key.
 */
public final class CacheKeys {

    private CacheKeys() {}

    public static String aboutStatistics() {
        return "cache:about:statistics";
    }

    public static String aboutTopStocks(int limit) {
        return "cache:about:top-stocks:" + limit;
    }

    public static String topShorts(String period, int limit, int offset) {
        return "cache:homepage:top-shorts:%s:%d:%d".formatted(period, limit, offset);
    }

    public static String treeMap(String period, int limit, String viewMode) {
        return "cache:homepage:treemap:%s:%d:%s".formatted(period, limit, viewMode);
    }

    public static String stockTooltip(String productCode) {
        return "tooltip:stock:" + productCode.toUpperCase(Locale.ROOT);
    }

    public static String searchStocks(String query, int limit) {
        return "cache:search:stocks:%s:%d".formatted(query.trim().toLowerCase(Locale.ROOT), limit);
    }
}
