package shorted.core.model.shorts;

import java.time.Instant;

/**
 * Headline figures of the about page.
 *
 * @param companyCount distinct companies with reported short positions
 * @param industryCount estimated number of industries covered
 * @param latestUpdateDate most recent data point, or null when there is no data
 */
public record AboutStatistics(int companyCount, int industryCount, Instant latestUpdateDate) {

    private static final int MIN_INDUSTRIES = 25;
    private static final int MAX_INDUSTRIES = 35;
    private static final int COMPANIES_PER_INDUSTRY = 15;

    /**
     * Estimate the industry count from the company count, clamped to the known ASX range.
     *
     * @param companyCount the company count
     * @return the estimate
     */
    public static int estimateIndustries(int companyCount) {
        return Math.min(MAX_INDUSTRIES, Math.max(MIN_INDUSTRIES, companyCount / COMPANIES_PER_INDUSTRY));
    }
}
