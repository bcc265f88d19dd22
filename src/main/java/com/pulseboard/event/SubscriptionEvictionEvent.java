package com.pulseboard.event;

import com.pulseboard.domain.model.EvictionBatch;
import java.time.LocalDateTime;
import org.springframework.context.ApplicationEvent;

/**
 * Published when an admission-controller call evicted at least one key.
 *
 * <p>Key listeners:
 * <ul>
 *   <li>The wire-subscription sender: unsubscribes the evicted keys on the stream</li>
 *   <li>SubscriptionMetricsService: counts evictions per tier</li>
 * </ul>
 *
 * <p>Empty batches are not republished as events; listeners that need every call should
 * register directly on the controller.
 */
public class SubscriptionEvictionEvent extends ApplicationEvent {

    private final EvictionBatch batch;
    private final LocalDateTime occurredAt;

    public SubscriptionEvictionEvent(Object source, EvictionBatch batch) {
        super(source);
        this.batch = batch;
        this.occurredAt = LocalDateTime.now();
    }

    public EvictionBatch getBatch() {
        return batch;
    }

    public LocalDateTime getOccurredAt() {
        return occurredAt;
    }
}
