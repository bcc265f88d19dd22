package com.pulseboard.domain.model;

import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

/**
 * Read-only snapshot of the admission controller.
 *
 * <p>{@code limits.fast} is the capacity currently enforced on the fast pool, which
 * equals the allow-list size while the lock is engaged. {@code limits.normal} is the
 * unlocked fast capacity regardless of lock state, i.e. the value a release restores.
 *
 * <p>Key lists are oldest first. Pane count maps are keyed by pane id.
 */
@Value
@Builder
public class SubscriptionMetrics {

    Counts counts;
    Limits limits;
    boolean lockActive;
    List<String> allowedKeys;
    List<String> fastKeys;
    List<String> slowKeys;
    Map<String, Integer> visiblePaneCounts;
    Map<String, Integer> renderedPaneCounts;

    @Value
    public static class Counts {
        int fast;
        int slow;
    }

    @Value
    public static class Limits {
        int fast;
        int slow;
        int normal;
    }
}
