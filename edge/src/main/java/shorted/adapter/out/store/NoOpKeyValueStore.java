package shorted.adapter.out.store;

import java.util.Optional;

import io.smallrye.mutiny.Uni;

import shorted.core.port.out.KeyValueStore;

/**
 * A store that holds nothing: reads always miss, writes are dropped.
 *
 * <p>Used when {@code shorted.store.backend=none}.
 */
public final class NoOpKeyValueStore implements KeyValueStore {

    public static final String NAME = "none";

    private static final NoOpKeyValueStore INSTANCE = new NoOpKeyValueStore();

    private NoOpKeyValueStore() {}

    /**
     * Return the singleton instance.
     *
     * @return the no-op store
     */
    public static NoOpKeyValueStore getInstance() {
        return INSTANCE;
    }

    @Override
    public Uni<Optional<String>> get(String key) {
        return Uni.createFrom().item(Optional.empty());
    }

    @Override
    public Uni<Void> set(String key, String value, long ttlSeconds) {
        return Uni.createFrom().voidItem();
    }

    @Override
    public Uni<Long> incrWithExpiry(String key, long ttlSeconds) {
        return Uni.createFrom().item(1L);
    }

    @Override
    public Uni<Void> delete(String key) {
        return Uni.createFrom().voidItem();
    }

    @Override
    public String name() {
        return NAME;
    }
}
