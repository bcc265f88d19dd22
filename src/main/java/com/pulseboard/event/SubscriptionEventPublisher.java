package com.pulseboard.event;

import com.pulseboard.domain.model.EvictionBatch;
import com.pulseboard.domain.model.LockStateChange;
import com.pulseboard.subscription.ListenerHandle;
import com.pulseboard.subscription.SubscriptionAdmissionController;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * Bridges admission-controller notifications onto Spring's {@link ApplicationEventPublisher}.
 *
 * <p>Non-empty eviction batches become {@link SubscriptionEvictionEvent}s and lock
 * transitions become {@link SubscriptionLockEvent}s, so other beans can react with a plain
 * {@code @EventListener}. Delivery stays synchronous: events are published inside the
 * controller call that produced them.
 */
@Component
public class SubscriptionEventPublisher {

    private final SubscriptionAdmissionController subscriptionAdmissionController;
    private final ApplicationEventPublisher applicationEventPublisher;

    private ListenerHandle evictionHandle;
    private ListenerHandle lockHandle;

    public SubscriptionEventPublisher(
            SubscriptionAdmissionController subscriptionAdmissionController,
            ApplicationEventPublisher applicationEventPublisher) {
        this.subscriptionAdmissionController = subscriptionAdmissionController;
        this.applicationEventPublisher = applicationEventPublisher;
    }

    @PostConstruct
    public void register() {
        evictionHandle = subscriptionAdmissionController.onSubscriptionEvictions(this::publishEvictions);
        lockHandle = subscriptionAdmissionController.onSubscriptionLockChange(this::publishLockChange);
    }

    @PreDestroy
    public void unregister() {
        subscriptionAdmissionController.unsubscribe(evictionHandle);
        subscriptionAdmissionController.unsubscribe(lockHandle);
    }

    void publishEvictions(EvictionBatch batch) {
        if (!batch.isEmpty()) {
            applicationEventPublisher.publishEvent(new SubscriptionEvictionEvent(this, batch));
        }
    }

    void publishLockChange(LockStateChange lockState) {
        applicationEventPublisher.publishEvent(new SubscriptionLockEvent(this, lockState));
    }
}
