package com.pulseboard.domain.model;

import java.util.List;

/**
 * Keys removed from the fast and slow pools by a single admission-controller call,
 * each list in removal order (oldest first).
 *
 * <p>One batch is emitted per mutating call even when both lists are empty, so
 * listeners that count calls see every operation.
 */
public record EvictionBatch(List<String> fast, List<String> slow) {

    private static final EvictionBatch EMPTY = new EvictionBatch(List.of(), List.of());

    public EvictionBatch {
        fast = fast != null ? List.copyOf(fast) : List.of();
        slow = slow != null ? List.copyOf(slow) : List.of();
    }

    public static EvictionBatch empty() {
        return EMPTY;
    }

    public static EvictionBatch ofFast(List<String> fast) {
        return new EvictionBatch(fast, List.of());
    }

    public boolean isEmpty() {
        return fast.isEmpty() && slow.isEmpty();
    }

    public int size() {
        return fast.size() + slow.size();
    }
}
