package com.pulseboard.subscription;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Visible and rendered row counts per pane.
 *
 * <p>Visible rows are the rows inside a pane's scroll viewport; rendered rows are the
 * visible rows plus the rows the table keeps mounted around them. Records are upserted by
 * pane id and only disappear on {@link #clear()}. Counts are always non-negative.
 *
 * <p>Not thread-safe; guarded by {@link SubscriptionAdmissionController}.
 */
public class PaneCountRegistry {

    private final Map<String, Integer> visibleCounts = new LinkedHashMap<>();
    private final Map<String, Integer> renderedCounts = new LinkedHashMap<>();

    /** Upserts the visible-row count and returns the stored (clamped) value. */
    public int putVisibleCount(String paneId, double count) {
        int clamped = clamp(count);
        visibleCounts.put(String.valueOf(paneId), clamped);
        return clamped;
    }

    /** Upserts the rendered-row count and returns the stored (clamped) value. */
    public int putRenderedCount(String paneId, double count) {
        int clamped = clamp(count);
        renderedCounts.put(String.valueOf(paneId), clamped);
        return clamped;
    }

    public int getTotalVisible() {
        return sum(visibleCounts);
    }

    public int getTotalRendered() {
        return sum(renderedCounts);
    }

    public Map<String, Integer> getVisibleCounts() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(visibleCounts));
    }

    public Map<String, Integer> getRenderedCounts() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(renderedCounts));
    }

    public void clear() {
        visibleCounts.clear();
        renderedCounts.clear();
    }

    /** Negative, NaN and infinite counts become 0; fractional counts are floored. */
    static int clamp(double count) {
        if (!Double.isFinite(count) || count <= 0) {
            return 0;
        }
        return count >= Integer.MAX_VALUE ? Integer.MAX_VALUE : (int) Math.floor(count);
    }

    private static int sum(Map<String, Integer> counts) {
        long total = 0;
        for (int count : counts.values()) {
            total += count;
        }
        return (int) Math.min(total, Integer.MAX_VALUE);
    }
}
