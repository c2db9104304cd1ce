package shorted.adapter.out.store;

import java.util.Comparator;
import java.util.List;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;

import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import org.jboss.logging.Logger;

import shorted.adapter.out.store.memory.InMemoryKeyValueStoreProvider;
import shorted.adapter.out.store.redis.RedisKeyValueStoreProvider;
import shorted.config.StoreConfig;
import shorted.core.port.out.KeyValueStore;
import shorted.core.port.out.Metrics;
import shorted.spi.KeyValueStoreProvider;

/**
 * CDI producer for the shared key-value store.
 *
 * <p>Selects the provider named by {@code shorted.store.backend}:
 * <ul>
 *   <li>{@code redis} (priority 10) - used when a Redis data source is configured</li>
 *   <li>{@code memory} (priority 0) - always available</li>
 *   <li>{@code none} - the no-op store; caching and rate limiting are effectively off</li>
 * </ul>
 *
 * <p>If the named provider is unavailable, the highest-priority available provider is used.
 */
@ApplicationScoped
public class KeyValueStoreProviderLoader {

    private static final Logger LOG = Logger.getLogger(KeyValueStoreProviderLoader.class);

    private final StoreConfig config;
    private final Instance<ReactiveRedisDataSource> redisDataSource;
    private final Metrics metrics;

    @Inject
    public KeyValueStoreProviderLoader(
            StoreConfig config, Instance<ReactiveRedisDataSource> redisDataSource, Metrics metrics) {
        this.config = config;
        this.redisDataSource = redisDataSource;
        this.metrics = metrics;
    }

    /**
     * Produces the key-value store for CDI injection.
     *
     * @return the configured store
     */
    @Produces
    @ApplicationScoped
    public KeyValueStore produceKeyValueStore() {
        final var backend = config.backend().trim().toLowerCase();
        if (NoOpKeyValueStore.NAME.equals(backend)) {
            LOG.info("Key-value store disabled, using NoOpKeyValueStore");
            return NoOpKeyValueStore.getInstance();
        }

        final var provider = select(backend, providers(backend));
        LOG.infov("Using key-value store provider: {0} (key prefix \"{1}\")", provider.name(), config.keyPrefix());
        return provider.createStore();
    }

    static KeyValueStoreProvider select(String backend, List<KeyValueStoreProvider> providers) {
        final var named = providers.stream()
                .filter(p -> p.name().equals(backend))
                .findFirst();
        if (named.isPresent() && named.get().isAvailable()) {
            return named.get();
        }

        final var fallback = providers.stream()
                .filter(KeyValueStoreProvider::isAvailable)
                .max(Comparator.comparingInt(KeyValueStoreProvider::priority))
                .orElseThrow(() -> new IllegalStateException("No key-value store provider is available"));
        if (named.isEmpty()) {
            LOG.warnv("Unknown key-value store backend \"{0}\", falling back to {1}", backend, fallback.name());
        } else {
            LOG.warnv("Key-value store backend \"{0}\" is not available, falling back to {1}", backend, fallback.name());
        }
        return fallback;
    }

    private List<KeyValueStoreProvider> providers(String backend) {
        // The Redis client is only created when Redis was asked for.
        final var redis = RedisKeyValueStoreProvider.NAME.equals(backend) ? resolveRedis() : null;
        return List.of(
                RedisKeyValueStoreProvider.configured(
                        redis, config.keyPrefix(), config.redis().operationTimeout(), metrics),
                InMemoryKeyValueStoreProvider.configured(config.memory().maximumSize()));
    }

    private ReactiveRedisDataSource resolveRedis() {
        if (!redisDataSource.isResolvable()) {
            return null;
        }
        return redisDataSource.get();
    }
}
