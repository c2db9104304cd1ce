package shorted.core.service.cache;

import java.util.ArrayList;
import java.util.List;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import shorted.core.model.cache.CacheKeys;
import shorted.core.model.cache.WarmTask;
import shorted.core.port.out.ShortsDataSource;
import shorted.core.service.shorts.AboutStatisticsCalculator;

/**
 * The dashboard entries worth keeping warm: homepage lists and tree map, and the about page.
 */
@ApplicationScoped
public class DefaultWarmTasks {

    static final List<String> TOP_SHORTS_PERIODS = List.of("1m", "3m", "6m", "1y");
    static final int TOP_SHORTS_LIMIT = 50;
    static final String TREEMAP_PERIOD = "3m";
    static final int TREEMAP_LIMIT = 10;
    static final String TREEMAP_VIEW_MODE = "CURRENT_CHANGE";
    static final int ABOUT_TOP_STOCKS_LIMIT = 5;

    private final ShortsDataSource dataSource;
    private final CachePolicies policies;

    @Inject
    public DefaultWarmTasks(ShortsDataSource dataSource, CachePolicies policies) {
        this.dataSource = dataSource;
        this.policies = policies;
    }

    /**
     * @return the tasks, in reporting order
     */
    public List<WarmTask> tasks() {
        final var tasks = new ArrayList<WarmTask>();
        for (final var period : TOP_SHORTS_PERIODS) {
            tasks.add(new WarmTask(
                    "top-shorts-" + period,
                    CacheKeys.topShorts(period, TOP_SHORTS_LIMIT, 0),
                    policies.homepage(),
                    () -> dataSource.topShorts(period, TOP_SHORTS_LIMIT, 0)));
        }
        tasks.add(new WarmTask(
                "treemap-" + TREEMAP_PERIOD,
                CacheKeys.treeMap(TREEMAP_PERIOD, TREEMAP_LIMIT, TREEMAP_VIEW_MODE),
                policies.homepage(),
                () -> dataSource.industryTreeMap(TREEMAP_PERIOD, TREEMAP_LIMIT, TREEMAP_VIEW_MODE)));
        tasks.add(new WarmTask(
                "about-statistics",
                CacheKeys.aboutStatistics(),
                policies.about(),
                () -> AboutStatisticsCalculator.fetch(dataSource)));
        tasks.add(new WarmTask(
                "about-top-stocks",
                CacheKeys.aboutTopStocks(ABOUT_TOP_STOCKS_LIMIT),
                policies.about(),
                () -> dataSource.topShorts("3m", ABOUT_TOP_STOCKS_LIMIT, 0)));
        return List.copyOf(tasks);
    }
}
