package shorted.adapter.out.store.memory;

import shorted.core.port.out.KeyValueStore;
import shorted.spi.KeyValueStoreProvider;

/**
 * In-memory store provider. Always available; used as the fallback backend.
 */
public final class InMemoryKeyValueStoreProvider implements KeyValueStoreProvider {

    private static final int PRIORITY = 0;

    private final long maximumSize;

    private InMemoryKeyValueStoreProvider(long maximumSize) {
        this.maximumSize = maximumSize;
    }

    public static InMemoryKeyValueStoreProvider configured(long maximumSize) {
        return new InMemoryKeyValueStoreProvider(maximumSize);
    }

    @Override
    public int priority() {
        return PRIORITY;
    }

    @Override
    public String name() {
        return InMemoryKeyValueStore.NAME;
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    @Override
    public KeyValueStore createStore() {
        return new InMemoryKeyValueStore(maximumSize);
    }
}
