package com.pulseboard.subscription;

import com.pulseboard.config.SubscriptionConfig;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Holds the default base limit for subscriptions on rows that are currently off screen.
 *
 * <p>The inactive-row rotation subscribes every invisible row while their number stays at
 * or below this base, and only a fraction of the remainder above it. The admission
 * controller does not read this value.
 */
@Component
public class DefaultInactiveBaseLimitStore {

    private static final Logger log = LoggerFactory.getLogger(DefaultInactiveBaseLimitStore.class);

    private final ListenerRegistry<Integer> listeners = new ListenerRegistry<>("inactive-base-limit");
    private int baseLimit;

    public DefaultInactiveBaseLimitStore(SubscriptionConfig subscriptionConfig) {
        this.baseLimit = Math.max(0, subscriptionConfig.getDefaultInactiveBaseLimit());
    }

    public synchronized int get() {
        return baseLimit;
    }

    /**
     * Sets the base limit; negative values are stored as 0. Listeners are notified only
     * when the stored value actually changes.
     *
     * @return the value held before this call and the value stored by it
     */
    public synchronized LimitUpdate set(int limit) {
        int previous = baseLimit;
        int safe = Math.max(0, limit);
        if (safe != previous) {
            log.info("Default inactive base limit changed: {} -> {}", previous, safe);
            baseLimit = safe;
            listeners.publish(safe);
        }
        return new LimitUpdate(previous, safe);
    }

    public ListenerHandle onChange(Consumer<Integer> listener) {
        return listeners.subscribe(listener);
    }

    public boolean unsubscribe(ListenerHandle handle) {
        return listeners.unsubscribe(handle);
    }

    /** Outcome of a {@link #set(int)} call, read under the same lock as the write. */
    public record LimitUpdate(int previous, int stored) {

        public boolean changed() {
            return previous != stored;
        }
    }
}
