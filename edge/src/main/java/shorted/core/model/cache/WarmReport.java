package shorted.core.model.cache;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Summary of a warm run.
 *
 * @param results one result per task, in task order
 * @param duration wall-clock time of the run
 * @param timestamp when the run finished
 */
public record WarmReport(List<WarmResult> results, Duration duration, Instant timestamp) {

    public WarmReport {
        results = List.copyOf(results);
    }

    public long successCount() {
        return results.stream().filter(WarmResult::success).count();
    }

    public int total() {
        return results.size();
    }
}
