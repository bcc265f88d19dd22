package com.pulseboard.subscription;

/**
 * Capacities derived from pane counts and lock state.
 *
 * @param fast capacity enforced on the fast pool
 * @param slow capacity enforced on the slow pool
 * @param normal unlocked fast capacity, reported even while the lock is engaged
 */
public record SubscriptionCapacity(int fast, int slow, int normal) {}
