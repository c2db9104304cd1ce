package shorted.adapter.out.store.memory;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import shorted.core.port.out.KeyValueStore;
import shorted.core.port.out.KeyValueStoreContractTest;

@DisplayName("InMemoryKeyValueStore")
class InMemoryKeyValueStoreTest extends KeyValueStoreContractTest {

    private final AtomicLong nanos = new AtomicLong();

    @Override
    protected KeyValueStore createStore() {
        return new InMemoryKeyValueStore(1_000, nanos::get);
    }

    private void advance(Duration duration) {
        nanos.addAndGet(duration.toNanos());
    }

    @Nested
    @DisplayName("expiry")
    class ExpiryTests {

        @Test
        @DisplayName("values expire after their TTL")
        void valueExpires() {
            store.set("k", "v", 10).await().atMost(TIMEOUT);

            advance(Duration.ofSeconds(9));
            assertEquals(Optional.of("v"), store.get("k").await().atMost(TIMEOUT));

            advance(Duration.ofSeconds(2));
            assertTrue(store.get("k").await().atMost(TIMEOUT).isEmpty());
        }

        @Test
        @DisplayName("reads do not extend the TTL")
        void readsDoNotExtend() {
            store.set("k", "v", 10).await().atMost(TIMEOUT);
            for (int i = 0; i < 6; i++) {
                advance(Duration.ofSeconds(2));
                store.get("k").await().atMost(TIMEOUT);
            }

            assertTrue(store.get("k").await().atMost(TIMEOUT).isEmpty());
        }

        @Test
        @DisplayName("a counter restarts once its window has expired")
        void counterRestarts() {
            store.incrWithExpiry("c", 120).await().atMost(TIMEOUT);
            store.incrWithExpiry("c", 120).await().atMost(TIMEOUT);

            advance(Duration.ofSeconds(121));

            assertEquals(1L, store.incrWithExpiry("c", 120).await().atMost(TIMEOUT));
        }
    }

    @Test
    @DisplayName("incrementing a non-numeric value fails")
    void incrementNonNumeric() {
        store.set("k", "text", 60).await().atMost(TIMEOUT);

        assertThrows(IllegalStateException.class, () -> store.incrWithExpiry("k", 60).await().atMost(TIMEOUT));
    }

    @Test
    @DisplayName("size is bounded")
    void bounded() {
        var small = new InMemoryKeyValueStore(10, nanos::get);
        for (int i = 0; i < 100; i++) {
            small.set("k" + i, "v", 60).await().atMost(TIMEOUT);
        }

        assertTrue(small.estimatedSize() <= 10, "size was " + small.estimatedSize());
    }
}
