package shorted.core.model.cache;

import java.util.Objects;
import java.util.function.Supplier;

import io.smallrye.mutiny.Uni;

/**
 * A cache key to populate ahead of demand.
 *
 * @param name label reported in warm results (e.g. {@code top-shorts-3m})
 * @param key the cache key to write
 * @param policy the freshness policy of the written entry
 * @param producer computes the value
 */
public record WarmTask(String name, String key, CachePolicy policy, Supplier<Uni<?>> producer) {

    public WarmTask {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(policy, "policy must not be null");
        Objects.requireNonNull(producer, "producer must not be null");
    }
}
