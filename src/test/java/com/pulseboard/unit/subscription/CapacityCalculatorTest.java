package com.pulseboard.unit.subscription;

import static org.assertj.core.api.Assertions.assertThat;

import com.pulseboard.domain.enums.SubscriptionTier;
import com.pulseboard.domain.model.LockRequest;
import com.pulseboard.subscription.BoundedOrderedPool;
import com.pulseboard.subscription.CapacityCalculator;
import com.pulseboard.subscription.PaneCountRegistry;
import com.pulseboard.subscription.SubscriptionCapacity;
import com.pulseboard.subscription.SubscriptionLockController;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class CapacityCalculatorTest {

    private final CapacityCalculator capacityCalculator = new CapacityCalculator(6);

    private PaneCountRegistry panes;
    private SubscriptionLockController lock;

    @BeforeEach
    void setUp() {
        panes = new PaneCountRegistry();
        lock = new SubscriptionLockController();
    }

    @Test
    @DisplayName("no panes: fast and normal equal the buffer margin, slow is zero")
    void emptyRegistry() {
        assertThat(capacityCalculator.calculate(panes, lock)).isEqualTo(new SubscriptionCapacity(6, 0, 6));
    }

    @Test
    @DisplayName("fast adds the buffer to visible rows; slow is rendered rows without buffer")
    void unlockedCapacities() {
        panes.putVisibleCount("trending", 5);
        panes.putVisibleCount("new", 5);
        panes.putRenderedCount("trending", 30);
        panes.putRenderedCount("new", 30);

        assertThat(capacityCalculator.calculate(panes, lock)).isEqualTo(new SubscriptionCapacity(16, 60, 16));
    }

    @Test
    @DisplayName("while locked fast equals the allow-list size and normal is still reported")
    void lockedCapacities() {
        panes.putVisibleCount("trending", 50);
        lock.engage(LockRequest.allow("k3", "k7"), new BoundedOrderedPool(SubscriptionTier.FAST, 56));

        SubscriptionCapacity capacity = capacityCalculator.calculate(panes, lock);

        assertThat(capacity.fast()).isEqualTo(2);
        assertThat(capacity.normal()).isEqualTo(56);
    }
}
