package shorted.core.port.in;

import java.util.List;

import io.smallrye.mutiny.Uni;

import shorted.core.model.cache.WarmReport;
import shorted.core.model.cache.WarmTask;

/**
 * Use case for populating the cache ahead of demand.
 */
public interface CacheWarming {

    /**
     * Run the given tasks, each in isolation.
     *
     * <p>The returned {@code Uni} never fails; task failures are reported in the result.
     *
     * @param tasks the tasks
     * @return one result per task, in task order
     */
    Uni<WarmReport> warm(List<WarmTask> tasks);

    /**
     * Run the standard set of dashboard warm tasks.
     *
     * @return the report
     */
    Uni<WarmReport> warmDefaults();
}
