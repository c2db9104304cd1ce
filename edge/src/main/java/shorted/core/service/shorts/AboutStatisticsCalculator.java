package shorted.core.service.shorts;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.HashSet;

import com.fasterxml.jackson.databind.JsonNode;
import io.smallrye.mutiny.Uni;

import shorted.core.model.shorts.AboutStatistics;
import shorted.core.port.out.ShortsDataSource;

/**
 * Derives the about page figures from a top-shorts response.
 */
public final class AboutStatisticsCalculator {

    static final String PERIOD = "3m";
    static final int SAMPLE_SIZE = 100;

    private AboutStatisticsCalculator() {}

    /**
     * Fetch a top-shorts sample and compute the statistics from it.
     *
     * @param dataSource the data API
     * @return the statistics
     */
    public static Uni<AboutStatistics> fetch(ShortsDataSource dataSource) {
        return dataSource.topShorts(PERIOD, SAMPLE_SIZE, 0).map(AboutStatisticsCalculator::fromTopShorts);
    }

    /**
     * Compute statistics from a response with a {@code timeSeries} array.
     *
     * @param response the top-shorts response
     * @return the statistics
     * @throws IllegalArgumentException if the response has no {@code timeSeries} array
     */
    public static AboutStatistics fromTopShorts(JsonNode response) {
        final var timeSeries = response == null ? null : response.get("timeSeries");
        if (timeSeries == null || !timeSeries.isArray()) {
            throw new IllegalArgumentException("Top shorts response has no timeSeries");
        }
        final var companies = new HashSet<String>();
        Instant latest = null;
        for (final var series : timeSeries) {
            final var productCode = series.path("productCode").asText("");
            if (!productCode.isEmpty()) {
                companies.add(productCode);
            }
            final var points = series.path("points");
            if (points.isArray() && points.size() > 0) {
                final var timestamp = parseTimestamp(points.get(points.size() - 1).get("timestamp"));
                if (timestamp != null && (latest == null || timestamp.isAfter(latest))) {
                    latest = timestamp;
                }
            }
        }
        return new AboutStatistics(
                companies.size(), AboutStatistics.estimateIndustries(companies.size()), latest);
    }

    // Protobuf JSON renders Timestamp as an RFC 3339 string; older encoders emit {seconds, nanos}.
    private static Instant parseTimestamp(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isTextual()) {
            try {
                return Instant.parse(node.asText());
            } catch (DateTimeParseException e) {
                return null;
            }
        }
        if (node.has("seconds")) {
            return Instant.ofEpochSecond(node.path("seconds").asLong(), node.path("nanos").asLong());
        }
        return null;
    }
}
