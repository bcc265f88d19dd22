package com.pulseboard.subscription;

import com.pulseboard.domain.enums.SubscriptionTier;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Insertion-ordered set of subscription keys with a mutable capacity.
 *
 * <p>After every mutating call the pool holds at most {@code capacity} keys. When it is
 * over capacity the oldest keys (earliest first registration) are evicted first and the
 * relative order of the survivors is preserved. Re-registering a member does not refresh
 * its age. Growing the capacity never adds keys back.
 *
 * <p>Every mutator that can evict returns the evicted keys, oldest first. Not thread-safe;
 * guarded by {@link SubscriptionAdmissionController}.
 */
public class BoundedOrderedPool {

    private static final Logger log = LoggerFactory.getLogger(BoundedOrderedPool.class);

    private final SubscriptionTier tier;
    private final LinkedHashSet<String> members = new LinkedHashSet<>();
    private int capacity;

    public BoundedOrderedPool(SubscriptionTier tier, int capacity) {
        this.tier = tier;
        this.capacity = Math.max(0, capacity);
    }

    /**
     * Appends {@code key} as the newest member unless already present, then trims.
     *
     * @return keys evicted by this call (may include {@code key} itself when capacity is 0)
     */
    public List<String> register(String key) {
        if (!members.add(key)) {
            return Collections.emptyList();
        }
        return trim();
    }

    /**
     * Removes {@code key} without reporting it as evicted.
     *
     * @return true if the key was a member
     */
    public boolean remove(String key) {
        return members.remove(key);
    }

    /** Sets the capacity and evicts oldest members if the pool is now over it. */
    public List<String> setCapacity(int newCapacity) {
        int clamped = Math.max(0, newCapacity);
        if (clamped != capacity) {
            log.debug("{} pool capacity {} -> {} (size {})", tier, capacity, clamped, members.size());
        }
        capacity = clamped;
        return trim();
    }

    /**
     * Removes every member not in {@code allowed}, oldest first. Allowed keys that are not
     * members are not added.
     */
    public List<String> filterTo(Set<String> allowed) {
        List<String> evicted = new ArrayList<>();
        Iterator<String> it = members.iterator();
        while (it.hasNext()) {
            String key = it.next();
            if (!allowed.contains(key)) {
                it.remove();
                evicted.add(key);
            }
        }
        logEvictions("filter", evicted);
        return evicted;
    }

    /** Empties the pool and resets its capacity. */
    public void clear(int newCapacity) {
        members.clear();
        capacity = Math.max(0, newCapacity);
    }

    public boolean contains(String key) {
        return members.contains(key);
    }

    public int size() {
        return members.size();
    }

    public int getCapacity() {
        return capacity;
    }

    public SubscriptionTier getTier() {
        return tier;
    }

    /** Members oldest first. */
    public List<String> getKeys() {
        return List.copyOf(members);
    }

    private List<String> trim() {
        if (members.size() <= capacity) {
            return Collections.emptyList();
        }
        List<String> evicted = new ArrayList<>(members.size() - capacity);
        Iterator<String> it = members.iterator();
        while (members.size() > capacity && it.hasNext()) {
            evicted.add(it.next());
            it.remove();
        }
        logEvictions("trim", evicted);
        return evicted;
    }

    private void logEvictions(String cause, List<String> evicted) {
        if (!evicted.isEmpty() && log.isDebugEnabled()) {
            log.debug("{} pool evicted {} keys on {} (size {}, capacity {}): {}",
                    tier, evicted.size(), cause, members.size(), capacity, evicted);
        }
    }
}
