package shorted.adapter.in.dto;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

import shorted.core.model.cache.WarmReport;

/**
 * Response body of the warm-cache endpoint.
 *
 * @param success always true; individual task failures are reported in {@code results}
 * @param message summary such as {@code Cache warmed: 6/7 successful}
 * @param results per-task outcome keyed by task name, in task order
 * @param duration elapsed time, e.g. {@code 412ms}
 * @param timestamp when the warm run finished
 */
public record WarmCacheResponse(
        boolean success, String message, Map<String, WarmTaskResultDto> results, String duration, Instant timestamp) {

    public static WarmCacheResponse fromModel(WarmReport report) {
        final var results = new LinkedHashMap<String, WarmTaskResultDto>();
        report.results().forEach(result -> results.put(result.name(), WarmTaskResultDto.fromModel(result)));
        return new WarmCacheResponse(
                true,
                "Cache warmed: " + report.successCount() + "/" + report.total() + " successful",
                results,
                report.duration().toMillis() + "ms",
                report.timestamp());
    }
}
