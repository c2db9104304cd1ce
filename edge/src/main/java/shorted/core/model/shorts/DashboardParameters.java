package shorted.core.model.shorts;

import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Accepted values of the dashboard query parameters.
 *
 * <p>Parameters become cache key segments, so anything outside these sets is rejected
 * before a key is built.
 */
public final class DashboardParameters {

    public static final Set<String> PERIODS = Set.of("1m", "3m", "6m", "1y", "2y", "5y", "max");
    public static final Set<String> VIEW_MODES = Set.of("CURRENT_CHANGE", "PERCENTAGE_CHANGE");
    public static final int MAX_LIMIT = 100;
    public static final int MAX_OFFSET = 1000;
    public static final int MAX_QUERY_LENGTH = 64;

    private static final Pattern PRODUCT_CODE = Pattern.compile("[A-Za-z0-9]{1,6}");

    private DashboardParameters() {}

    /**
     * @throws IllegalArgumentException if {@code period} is not a known period code
     */
    public static String requirePeriod(String period) {
        if (period == null || !PERIODS.contains(period)) {
            throw new IllegalArgumentException("period must be one of " + String.join(", ", sorted(PERIODS)));
        }
        return period;
    }

    /**
     * @throws IllegalArgumentException if {@code viewMode} is not a known tree map view mode
     */
    public static String requireViewMode(String viewMode) {
        if (viewMode == null || !VIEW_MODES.contains(viewMode)) {
            throw new IllegalArgumentException("viewMode must be one of " + String.join(", ", sorted(VIEW_MODES)));
        }
        return viewMode;
    }

    public static int requireLimit(int limit) {
        if (limit < 1 || limit > MAX_LIMIT) {
            throw new IllegalArgumentException("limit must be between 1 and " + MAX_LIMIT);
        }
        return limit;
    }

    public static int requireOffset(int offset) {
        if (offset < 0 || offset > MAX_OFFSET) {
            throw new IllegalArgumentException("offset must be between 0 and " + MAX_OFFSET);
        }
        return offset;
    }

    /**
     * Validate an ASX product code and return it upper-cased.
     *
     * @throws IllegalArgumentException if the code is not 1 to 6 letters or digits
     */
    public static String requireProductCode(String code) {
        if (code == null || !PRODUCT_CODE.matcher(code).matches()) {
            throw new IllegalArgumentException("stock code must be 1 to 6 letters or digits");
        }
        return code.toUpperCase(Locale.ROOT);
    }

    /**
     * @throws IllegalArgumentException if the trimmed query is longer than {@link #MAX_QUERY_LENGTH}
     */
    public static String requireSearchQuery(String query) {
        final var trimmed = query.trim();
        if (trimmed.length() > MAX_QUERY_LENGTH) {
            throw new IllegalArgumentException("q must be at most " + MAX_QUERY_LENGTH + " characters");
        }
        return trimmed;
    }

    private static Iterable<String> sorted(Set<String> values) {
        return values.stream().sorted().toList();
    }
}
