package com.pulseboard.subscription;

import com.pulseboard.domain.model.LockRequest;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Two-state machine (unlocked / locked) that narrows the fast pool to an allow-list.
 *
 * <p>Engaging removes every fast member outside the allow-list regardless of age and pins
 * the fast capacity to the allow-list size. Allowed keys that are not already subscribed
 * are not added. Releasing restores the normal capacity and adds nothing back. Engaging
 * while already locked replaces the allow-list through the same path.
 *
 * <p>Not thread-safe; guarded by {@link SubscriptionAdmissionController}.
 */
public class SubscriptionLockController {

    private static final Logger log = LoggerFactory.getLogger(SubscriptionLockController.class);

    private boolean active;
    private Set<String> allowedKeys = Collections.emptySet();

    /**
     * Engages (or re-engages) the lock on {@code fastPool}.
     *
     * @return fast keys evicted, oldest first
     */
    public List<String> engage(LockRequest request, BoundedOrderedPool fastPool) {
        boolean wasActive = active;
        active = true;
        allowedKeys = request.getAllowedKeys();

        // Filter before pinning: the pinned capacity must not push out allowed keys by age.
        List<String> evicted = fastPool.filterTo(allowedKeys);
        fastPool.setCapacity(allowedKeys.size());

        log.info(
                "Subscription lock {} (allowed: {}, evicted {} fast keys, fast size {})",
                wasActive ? "re-engaged" : "engaged",
                allowedKeys,
                evicted.size(),
                fastPool.size());
        return evicted;
    }

    /**
     * Releases the lock and restores {@code normalCapacity} on the fast pool. No-op when
     * already unlocked.
     *
     * <p>The restored capacity is normally at least the allow-list size, so nothing is
     * evicted. An allow-list larger than the normal capacity is trimmed oldest first.
     *
     * @return fast keys evicted, oldest first
     */
    public List<String> release(BoundedOrderedPool fastPool, int normalCapacity) {
        if (!active) {
            return Collections.emptyList();
        }
        active = false;
        allowedKeys = Collections.emptySet();
        List<String> evicted = fastPool.setCapacity(normalCapacity);
        log.info("Subscription lock released (fast capacity {}, fast size {})", normalCapacity, fastPool.size());
        return evicted;
    }

    /** True if {@code key} may hold a fast subscription under the current lock state. */
    public boolean admits(String key) {
        return !active || allowedKeys.contains(key);
    }

    public boolean isActive() {
        return active;
    }

    public Set<String> getAllowedKeys() {
        return allowedKeys;
    }

    public void reset() {
        active = false;
        allowedKeys = Collections.emptySet();
    }
}
