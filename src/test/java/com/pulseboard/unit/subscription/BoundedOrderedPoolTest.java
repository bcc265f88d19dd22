package com.pulseboard.unit.subscription;

import static org.assertj.core.api.Assertions.assertThat;

import com.pulseboard.domain.enums.SubscriptionTier;
import com.pulseboard.subscription.BoundedOrderedPool;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for {@link BoundedOrderedPool}.
 *
 * <p>Covers oldest-first eviction on register and on capacity shrink, idempotent
 * registration, no backfill on capacity growth, and allow-list filtering.
 */
class BoundedOrderedPoolTest {

    private BoundedOrderedPool pool;

    @BeforeEach
    void setUp() {
        pool = new BoundedOrderedPool(SubscriptionTier.FAST, 3);
    }

    @Nested
    @DisplayName("register")
    class Register {

        @Test
        @DisplayName("appends keys in registration order while under capacity")
        void appendsInOrder() {
            assertThat(pool.register("a")).isEmpty();
            assertThat(pool.register("b")).isEmpty();

            assertThat(pool.getKeys()).containsExactly("a", "b");
            assertThat(pool.size()).isEqualTo(2);
        }

        @Test
        @DisplayName("evicts the oldest key when capacity is exceeded")
        void evictsOldest() {
            pool.register("a");
            pool.register("b");
            pool.register("c");

            List<String> evicted = pool.register("d");

            assertThat(evicted).containsExactly("a");
            assertThat(pool.getKeys()).containsExactly("b", "c", "d");
        }

        @Test
        @DisplayName("re-registering a member is a no-op and does not refresh its age")
        void reRegisterDoesNotRefresh() {
            pool.register("a");
            pool.register("b");
            pool.register("c");

            assertThat(pool.register("a")).isEmpty();
            assertThat(pool.register("d")).containsExactly("a");
            assertThat(pool.getKeys()).containsExactly("b", "c", "d");
        }

        @Test
        @DisplayName("zero capacity evicts the key that was just registered")
        void zeroCapacityEvictsNewKey() {
            BoundedOrderedPool empty = new BoundedOrderedPool(SubscriptionTier.SLOW, 0);

            assertThat(empty.register("x")).containsExactly("x");
            assertThat(empty.size()).isZero();
        }
    }

    @Nested
    @DisplayName("setCapacity")
    class SetCapacity {

        @Test
        @DisplayName("shrinking evicts oldest first and keeps survivor order")
        void shrinkEvictsOldest() {
            pool.setCapacity(5);
            for (String key : List.of("a", "b", "c", "d", "e")) {
                pool.register(key);
            }

            List<String> evicted = pool.setCapacity(2);

            assertThat(evicted).containsExactly("a", "b", "c");
            assertThat(pool.getKeys()).containsExactly("d", "e");
            assertThat(pool.getCapacity()).isEqualTo(2);
        }

        @Test
        @DisplayName("growing never adds keys back")
        void growDoesNotBackfill() {
            pool.register("a");
            pool.register("b");
            pool.setCapacity(1);

            assertThat(pool.setCapacity(10)).isEmpty();
            assertThat(pool.getKeys()).containsExactly("b");
        }

        @Test
        @DisplayName("negative capacity is treated as zero")
        void negativeCapacityClampsToZero() {
            pool.register("a");

            assertThat(pool.setCapacity(-4)).containsExactly("a");
            assertThat(pool.getCapacity()).isZero();
        }
    }

    @Nested
    @DisplayName("filterTo")
    class FilterTo {

        @Test
        @DisplayName("removes every non-allowed member regardless of age, oldest first")
        void removesNonAllowed() {
            pool.register("a");
            pool.register("b");
            pool.register("c");

            List<String> evicted = pool.filterTo(Set.of("c", "a", "zz"));

            assertThat(evicted).containsExactly("b");
            assertThat(pool.getKeys()).containsExactly("a", "c");
            assertThat(pool.contains("zz")).isFalse();
        }

        @Test
        @DisplayName("empty allow-list removes everything")
        void emptyAllowListRemovesAll() {
            pool.register("a");
            pool.register("b");

            assertThat(pool.filterTo(Set.of())).containsExactly("a", "b");
            assertThat(pool.size()).isZero();
        }
    }

    @Test
    @DisplayName("remove drops a key silently and frees its slot")
    void removeFreesSlot() {
        pool.register("a");
        pool.register("b");
        pool.register("c");

        assertThat(pool.remove("b")).isTrue();
        assertThat(pool.remove("b")).isFalse();
        assertThat(pool.register("d")).isEmpty();
        assertThat(pool.getKeys()).containsExactly("a", "c", "d");
    }

    @Test
    @DisplayName("clear empties the pool and resets capacity")
    void clearResets() {
        pool.register("a");

        pool.clear(7);

        assertThat(pool.size()).isZero();
        assertThat(pool.getCapacity()).isEqualTo(7);
    }
}
