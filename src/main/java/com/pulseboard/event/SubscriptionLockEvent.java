package com.pulseboard.event;

import com.pulseboard.domain.model.LockStateChange;
import java.time.LocalDateTime;
import org.springframework.context.ApplicationEvent;

/**
 * Published when the subscription lock is engaged, re-engaged with a new allow-list, or
 * released.
 */
public class SubscriptionLockEvent extends ApplicationEvent {

    private final LockStateChange lockState;
    private final LocalDateTime occurredAt;

    public SubscriptionLockEvent(Object source, LockStateChange lockState) {
        super(source);
        this.lockState = lockState;
        this.occurredAt = LocalDateTime.now();
    }

    public LockStateChange getLockState() {
        return lockState;
    }

    public boolean isActive() {
        return lockState.active();
    }

    public LocalDateTime getOccurredAt() {
        return occurredAt;
    }
}
