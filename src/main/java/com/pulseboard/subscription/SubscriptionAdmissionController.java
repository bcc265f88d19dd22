package com.pulseboard.subscription;

import com.pulseboard.config.SubscriptionConfig;
import com.pulseboard.domain.enums.SubscriptionTier;
import com.pulseboard.domain.model.EvictionBatch;
import com.pulseboard.domain.model.LockRequest;
import com.pulseboard.domain.model.LockStateChange;
import com.pulseboard.domain.model.SubscriptionMetrics;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Decides which keys may hold a live-update channel, split into a fast and a slow tier.
 *
 * <p>Capacities follow the on-screen state reported by the panes:
 * <ul>
 *   <li>fast = sum of visible rows across panes + buffer margin (or the allow-list size while locked)</li>
 *   <li>slow = sum of rendered rows across panes</li>
 * </ul>
 * Whenever a pool is over capacity its oldest keys (by first registration) are evicted.
 * Capacity increases never re-admit anything; only the register calls add keys.
 *
 * <p>The subscription lock is engaged while the detail view is open: every fast key
 * outside the allow-list is evicted and the fast capacity is pinned to the allow-list
 * size. Releasing restores the normal capacity without backfilling.
 *
 * <p>Every register, pane-count, engage and release call emits exactly one
 * {@link EvictionBatch} (possibly empty) to the eviction listeners before it returns. The
 * wire layer listens to those batches to unsubscribe evicted keys; this class never talks
 * to the transport itself.
 *
 * <p>One instance is shared by the whole process. Every public method is synchronized on
 * it, and listeners run inside that boundary in registration order.
 */
@Component
public class SubscriptionAdmissionController {

    private static final Logger log = LoggerFactory.getLogger(SubscriptionAdmissionController.class);

    private final CapacityCalculator capacityCalculator;
    private final PaneCountRegistry paneCountRegistry = new PaneCountRegistry();
    private final BoundedOrderedPool fastPool = new BoundedOrderedPool(SubscriptionTier.FAST, 0);
    private final BoundedOrderedPool slowPool = new BoundedOrderedPool(SubscriptionTier.SLOW, 0);
    private final SubscriptionLockController lockController = new SubscriptionLockController();

    private final ListenerRegistry<EvictionBatch> evictionListeners = new ListenerRegistry<>("subscription-evictions");
    private final ListenerRegistry<LockStateChange> lockListeners = new ListenerRegistry<>("subscription-lock");
    private final ListenerRegistry<SubscriptionMetrics> metricsListeners =
            new ListenerRegistry<>("subscription-metrics");

    private SubscriptionCapacity capacity;
    private MetricsFingerprint lastFingerprint;

    public SubscriptionAdmissionController(SubscriptionConfig subscriptionConfig) {
        this.capacityCalculator = new CapacityCalculator(subscriptionConfig.getBufferMargin());
        resetState();
        lastFingerprint = currentFingerprint();
    }

    // ---- Pane counts ----

    public EvictionBatch updatePaneVisibleCount(String paneId, int count) {
        return updatePaneVisibleCount(paneId, (double) count);
    }

    /** Upserts a pane's visible-row count; negative and non-finite counts are stored as 0. */
    public synchronized EvictionBatch updatePaneVisibleCount(String paneId, double count) {
        paneCountRegistry.putVisibleCount(paneId, count);
        return emit(recomputeCapacity());
    }

    public EvictionBatch updatePaneRenderedCount(String paneId, int count) {
        return updatePaneRenderedCount(paneId, (double) count);
    }

    /** Upserts a pane's rendered-row count; negative and non-finite counts are stored as 0. */
    public synchronized EvictionBatch updatePaneRenderedCount(String paneId, double count) {
        paneCountRegistry.putRenderedCount(paneId, count);
        return emit(recomputeCapacity());
    }

    // ---- Registration ----

    /**
     * Admits {@code key} to the fast tier as its newest member.
     *
     * <p>A key already in the fast tier keeps its original age. A key held by the slow tier
     * is moved up without being reported as evicted. While the lock is engaged, a key
     * outside the allow-list is rejected and reported as evicted by this call; a slow key
     * rejected that way leaves the slow tier as well.
     */
    public synchronized EvictionBatch registerFastSubscription(String key) {
        if (isBlank(key) || fastPool.contains(key)) {
            return emit(EvictionBatch.empty());
        }
        boolean upgraded = slowPool.remove(key);
        if (!lockController.admits(key)) {
            log.debug("Fast subscription {} rejected: not in lock allow-list", key);
            return emit(EvictionBatch.ofFast(List.of(key)));
        }
        if (upgraded) {
            log.debug("Subscription {} moved from SLOW to FAST", key);
        }
        return emit(EvictionBatch.ofFast(fastPool.register(key)));
    }

    /**
     * Admits {@code key} to the slow tier as its newest member. No-op for keys already in
     * either tier; a fast key is never implicitly downgraded.
     */
    public synchronized EvictionBatch registerSlowSubscription(String key) {
        if (isBlank(key) || fastPool.contains(key) || slowPool.contains(key)) {
            return emit(EvictionBatch.empty());
        }
        return emit(new EvictionBatch(List.of(), slowPool.register(key)));
    }

    /**
     * Drops {@code key} from the fast tier. The caller owns the wire unsubscribe, so no
     * eviction batch is emitted.
     *
     * @return true if the key was subscribed
     */
    public synchronized boolean deregisterFastSubscription(String key) {
        boolean removed = key != null && fastPool.remove(key);
        if (removed) {
            notifyMetricsIfChanged();
        }
        return removed;
    }

    /** Slow-tier counterpart of {@link #deregisterFastSubscription(String)}. */
    public synchronized boolean deregisterSlowSubscription(String key) {
        boolean removed = key != null && slowPool.remove(key);
        if (removed) {
            notifyMetricsIfChanged();
        }
        return removed;
    }

    // ---- Lock ----

    /** Engages the lock with no exceptions: every fast subscription is evicted. */
    public EvictionBatch engageSubscriptionLock() {
        return engageSubscriptionLock(LockRequest.denyAll());
    }

    public EvictionBatch engageSubscriptionLock(Collection<String> allowedKeys) {
        return engageSubscriptionLock(LockRequest.allow(allowedKeys));
    }

    /**
     * Engages (or re-engages) the lock. Fast keys outside the allow-list are evicted oldest
     * first; allowed keys that are not subscribed yet are not added.
     */
    public synchronized EvictionBatch engageSubscriptionLock(LockRequest request) {
        LockRequest lockRequest = request != null ? request : LockRequest.denyAll();
        boolean wasActive = lockController.isActive();

        List<String> evicted = new ArrayList<>(lockController.engage(lockRequest, fastPool));
        EvictionBatch recomputed = recomputeCapacity();
        evicted.addAll(recomputed.fast());

        EvictionBatch batch = new EvictionBatch(evicted, recomputed.slow());
        evictionListeners.publish(batch);
        if (!wasActive || !lockRequest.isDenyAll()) {
            lockListeners.publish(new LockStateChange(true, List.copyOf(lockController.getAllowedKeys())));
        }
        notifyMetricsIfChanged();
        return batch;
    }

    /**
     * Releases the lock and restores the normal fast capacity. Nothing is re-admitted.
     * When the lock is not engaged this only emits an empty batch.
     */
    public synchronized EvictionBatch releaseSubscriptionLock() {
        if (!lockController.isActive()) {
            return emit(EvictionBatch.empty());
        }
        List<String> evicted = new ArrayList<>(lockController.release(fastPool, capacity.normal()));
        EvictionBatch recomputed = recomputeCapacity();
        evicted.addAll(recomputed.fast());

        EvictionBatch batch = new EvictionBatch(evicted, recomputed.slow());
        evictionListeners.publish(batch);
        lockListeners.publish(new LockStateChange(false, List.copyOf(lockController.getAllowedKeys())));
        notifyMetricsIfChanged();
        return batch;
    }

    public synchronized boolean isSubscriptionLockActive() {
        return lockController.isActive();
    }

    /** Allow-list of the engaged lock in first-seen order; empty while unlocked. */
    public synchronized List<String> getSubscriptionLockAllowedKeys() {
        return List.copyOf(lockController.getAllowedKeys());
    }

    // ---- Listeners ----

    /** Registers a listener for every eviction batch, delivered synchronously. */
    public ListenerHandle onSubscriptionEvictions(Consumer<EvictionBatch> listener) {
        return evictionListeners.subscribe(listener);
    }

    public ListenerHandle onSubscriptionLockChange(Consumer<LockStateChange> listener) {
        return lockListeners.subscribe(listener);
    }

    /**
     * Registers a listener for metrics snapshots. The listener receives the current snapshot
     * immediately, then a new one whenever the lock flag, a pool size or a limit changes.
     */
    public synchronized ListenerHandle onSubscriptionMetricsChange(Consumer<SubscriptionMetrics> listener) {
        ListenerHandle handle = metricsListeners.subscribe(listener);
        try {
            listener.accept(buildMetrics());
        } catch (RuntimeException e) {
            log.warn("Metrics listener failed on initial snapshot: {}", e.getMessage(), e);
        }
        return handle;
    }

    /**
     * Removes the listener registered under {@code handle}, whichever registration method
     * produced it.
     *
     * @return true if a listener was removed
     */
    public boolean unsubscribe(ListenerHandle handle) {
        return evictionListeners.unsubscribe(handle)
                || lockListeners.unsubscribe(handle)
                || metricsListeners.unsubscribe(handle);
    }

    // ---- Metrics ----

    public synchronized SubscriptionMetrics getSubscriptionMetrics() {
        return buildMetrics();
    }

    public synchronized int getFastCount() {
        return fastPool.size();
    }

    public synchronized int getSlowCount() {
        return slowPool.size();
    }

    public synchronized SubscriptionCapacity getCurrentLimits() {
        return capacity;
    }

    public synchronized boolean isSubscribed(String key, SubscriptionTier tier) {
        return (tier == SubscriptionTier.FAST ? fastPool : slowPool).contains(key);
    }

    // ---- Reset ----

    /**
     * Clears pane counts, both pools and the lock. Registered listeners are kept;
     * metrics listeners receive the reset snapshot.
     */
    public synchronized void reset() {
        resetState();
        log.info("Subscription state reset (fast limit {}, slow limit {})", capacity.fast(), capacity.slow());
        notifyMetricsIfChanged();
    }

    private void resetState() {
        paneCountRegistry.clear();
        lockController.reset();
        capacity = capacityCalculator.calculate(paneCountRegistry, lockController);
        fastPool.clear(capacity.fast());
        slowPool.clear(capacity.slow());
        lastFingerprint = null;
    }

    private EvictionBatch recomputeCapacity() {
        SubscriptionCapacity next = capacityCalculator.calculate(paneCountRegistry, lockController);
        if (!next.equals(capacity)) {
            log.debug(
                    "Subscription limits changed: fast {} -> {}, slow {} -> {}, normal {} -> {}",
                    capacity.fast(),
                    next.fast(),
                    capacity.slow(),
                    next.slow(),
                    capacity.normal(),
                    next.normal());
        }
        capacity = next;
        List<String> fastEvicted = fastPool.setCapacity(next.fast());
        List<String> slowEvicted = slowPool.setCapacity(next.slow());
        return new EvictionBatch(fastEvicted, slowEvicted);
    }

    private EvictionBatch emit(EvictionBatch batch) {
        evictionListeners.publish(batch);
        notifyMetricsIfChanged();
        return batch;
    }

    private void notifyMetricsIfChanged() {
        MetricsFingerprint fingerprint = currentFingerprint();
        if (fingerprint.equals(lastFingerprint)) {
            return;
        }
        lastFingerprint = fingerprint;
        if (metricsListeners.size() > 0) {
            metricsListeners.publish(buildMetrics());
        }
    }

    private MetricsFingerprint currentFingerprint() {
        return new MetricsFingerprint(lockController.isActive(), fastPool.size(), slowPool.size(), capacity);
    }

    private SubscriptionMetrics buildMetrics() {
        return SubscriptionMetrics.builder()
                .counts(new SubscriptionMetrics.Counts(fastPool.size(), slowPool.size()))
                .limits(new SubscriptionMetrics.Limits(capacity.fast(), capacity.slow(), capacity.normal()))
                .lockActive(lockController.isActive())
                .allowedKeys(List.copyOf(lockController.getAllowedKeys()))
                .fastKeys(fastPool.getKeys())
                .slowKeys(slowPool.getKeys())
                .visiblePaneCounts(paneCountRegistry.getVisibleCounts())
                .renderedPaneCounts(paneCountRegistry.getRenderedCounts())
                .build();
    }

    private static boolean isBlank(String key) {
        return key == null || key.isBlank();
    }

    private record MetricsFingerprint(boolean lockActive, int fastCount, int slowCount, SubscriptionCapacity limits) {}
}
