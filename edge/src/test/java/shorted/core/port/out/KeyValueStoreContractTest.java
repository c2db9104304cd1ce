package shorted.core.port.out;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import io.smallrye.mutiny.Uni;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Contract tests for KeyValueStore implementations.
 *
 * <p>Extend this class and implement {@link #createStore()} to check a backend
 * against the behaviour the rate limiter and the response cache rely on.
 */
public abstract class KeyValueStoreContractTest {

    protected static final Duration TIMEOUT = Duration.ofSeconds(5);

    /**
     * Create a store backed by a clean test backend.
     */
    protected abstract KeyValueStore createStore();

    protected KeyValueStore store;

    @BeforeEach
    void setUpContract() {
        store = createStore();
    }

    protected static String uniqueKey() {
        return "contract:" + UUID.randomUUID();
    }

    @Nested
    @DisplayName("get() and set()")
    class GetSetTests {

        @Test
        @DisplayName("set() then get() returns the same value")
        void roundTrip() {
            var key = uniqueKey();
            var value = "{\"payload\":\"[1,2,3]\",\"freshUntil\":1}";

            store.set(key, value, 60).await().atMost(TIMEOUT);

            assertEquals(Optional.of(value), store.get(key).await().atMost(TIMEOUT));
        }

        @Test
        @DisplayName("get() of an absent key is empty")
        void absent() {
            assertTrue(store.get(uniqueKey()).await().atMost(TIMEOUT).isEmpty());
        }

        @Test
        @DisplayName("set() replaces an existing value")
        void overwrite() {
            var key = uniqueKey();
            store.set(key, "a", 60).await().atMost(TIMEOUT);
            store.set(key, "b", 60).await().atMost(TIMEOUT);

            assertEquals(Optional.of("b"), store.get(key).await().atMost(TIMEOUT));
        }

        @Test
        @DisplayName("delete() removes the key")
        void delete() {
            var key = uniqueKey();
            store.set(key, "a", 60).await().atMost(TIMEOUT);

            store.delete(key).await().atMost(TIMEOUT);

            assertTrue(store.get(key).await().atMost(TIMEOUT).isEmpty());
        }
    }

    @Nested
    @DisplayName("incrWithExpiry()")
    class IncrementTests {

        @Test
        @DisplayName("starts at 1 and counts up")
        void countsUp() {
            var key = uniqueKey();

            assertEquals(1L, store.incrWithExpiry(key, 60).await().atMost(TIMEOUT));
            assertEquals(2L, store.incrWithExpiry(key, 60).await().atMost(TIMEOUT));
            assertEquals(Optional.of("2"), store.get(key).await().atMost(TIMEOUT));
        }

        @Test
        @DisplayName("concurrent increments are not lost")
        void concurrentIncrements() {
            var key = uniqueKey();
            List<Uni<Long>> increments = new ArrayList<>();
            for (int i = 0; i < 50; i++) {
                increments.add(store.incrWithExpiry(key, 60));
            }

            var results = Uni.join().all(increments).andFailFast().await().atMost(TIMEOUT);

            assertEquals(50, results.stream().distinct().count());
            assertEquals(Optional.of("50"), store.get(key).await().atMost(TIMEOUT));
        }
    }
}
