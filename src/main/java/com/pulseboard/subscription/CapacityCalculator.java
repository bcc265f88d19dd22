package com.pulseboard.subscription;

/**
 * Derives pool capacities from the pane registry and the lock state.
 *
 * <ul>
 *   <li>normal = sum(visible) + buffer margin</li>
 *   <li>fast = lock engaged ? allow-list size : normal</li>
 *   <li>slow = sum(rendered), no margin</li>
 * </ul>
 */
public class CapacityCalculator {

    private final int bufferMargin;

    public CapacityCalculator(int bufferMargin) {
        this.bufferMargin = Math.max(0, bufferMargin);
    }

    public SubscriptionCapacity calculate(PaneCountRegistry panes, SubscriptionLockController lock) {
        long normal = (long) panes.getTotalVisible() + bufferMargin;
        int normalCapacity = (int) Math.min(normal, Integer.MAX_VALUE);
        int fast = lock.isActive() ? lock.getAllowedKeys().size() : normalCapacity;
        return new SubscriptionCapacity(fast, panes.getTotalRendered(), normalCapacity);
    }

    public int getBufferMargin() {
        return bufferMargin;
    }
}
