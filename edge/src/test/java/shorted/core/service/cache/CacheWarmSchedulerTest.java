package shorted.core.service.cache;

import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import io.smallrye.mutiny.Uni;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import shorted.core.config.CacheConfig;
import shorted.core.model.cache.WarmReport;
import shorted.core.model.cache.WarmResult;
import shorted.core.port.in.CacheWarming;

@DisplayName("CacheWarmScheduler")
class CacheWarmSchedulerTest {

    private CacheWarming cacheWarming;
    private CacheConfig.WarmConfig warmConfig;
    private CacheWarmScheduler scheduler;

    @BeforeEach
    void setUp() {
        cacheWarming = mock(CacheWarming.class);
        warmConfig = mock(CacheConfig.WarmConfig.class);
        final var config = mock(CacheConfig.class);
        when(config.warm()).thenReturn(warmConfig);
        scheduler = new CacheWarmScheduler(cacheWarming, config);
    }

    @Test
    @DisplayName("does nothing unless scheduling is switched on")
    void disabled() {
        when(warmConfig.scheduled()).thenReturn(false);

        scheduler.warmOnSchedule().await().atMost(Duration.ofSeconds(1));

        verify(cacheWarming, never()).warmDefaults();
    }

    @Test
    @DisplayName("warms the defaults and completes even when tasks fail")
    void enabled() {
        when(warmConfig.scheduled()).thenReturn(true);
        final var report = new WarmReport(
                List.of(WarmResult.ok("treemap-3m"), WarmResult.failed("about-statistics", "timed out")),
                Duration.ofMillis(20),
                Instant.parse("2024-06-01T10:00:00Z"));
        when(cacheWarming.warmDefaults()).thenReturn(Uni.createFrom().item(report));

        scheduler.warmOnSchedule().await().atMost(Duration.ofSeconds(1));

        verify(cacheWarming).warmDefaults();
    }
}
