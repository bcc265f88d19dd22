package com.pulseboard.unit.event;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import com.pulseboard.config.SubscriptionConfig;
import com.pulseboard.event.SubscriptionEventPublisher;
import com.pulseboard.event.SubscriptionEvictionEvent;
import com.pulseboard.event.SubscriptionLockEvent;
import com.pulseboard.subscription.SubscriptionAdmissionController;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEvent;
import org.springframework.context.ApplicationEventPublisher;

@ExtendWith(MockitoExtension.class)
class SubscriptionEventPublisherTest {

    @Mock
    private ApplicationEventPublisher applicationEventPublisher;

    private SubscriptionAdmissionController controller;
    private SubscriptionEventPublisher subscriptionEventPublisher;

    @BeforeEach
    void setUp() {
        controller = new SubscriptionAdmissionController(new SubscriptionConfig());
        subscriptionEventPublisher = new SubscriptionEventPublisher(controller, applicationEventPublisher);
        subscriptionEventPublisher.register();
    }

    @Test
    @DisplayName("empty batches are not republished")
    void skipsEmptyBatches() {
        controller.registerFastSubscription("k1");
        controller.releaseSubscriptionLock();

        verify(applicationEventPublisher, never()).publishEvent(any(ApplicationEvent.class));
    }

    @Test
    @DisplayName("non-empty batches and lock changes become Spring events")
    void publishesEvictionsAndLockChanges() {
        controller.registerFastSubscription("k1");
        controller.registerFastSubscription("k2");

        controller.engageSubscriptionLock(List.of("k2"));

        ArgumentCaptor<ApplicationEvent> captor = ArgumentCaptor.forClass(ApplicationEvent.class);
        verify(applicationEventPublisher, times(2)).publishEvent(captor.capture());

        List<ApplicationEvent> events = captor.getAllValues();
        assertThat(events.get(0)).isInstanceOf(SubscriptionEvictionEvent.class);
        assertThat(((SubscriptionEvictionEvent) events.get(0)).getBatch().fast()).containsExactly("k1");
        assertThat(events.get(1)).isInstanceOf(SubscriptionLockEvent.class);
        assertThat(((SubscriptionLockEvent) events.get(1)).isActive()).isTrue();
        assertThat(((SubscriptionLockEvent) events.get(1)).getLockState().allowedKeys())
                .containsExactly("k2");
    }

    @Test
    @DisplayName("unregister detaches from the controller")
    void unregisterDetaches() {
        subscriptionEventPublisher.unregister();

        controller.engageSubscriptionLock();

        verify(applicationEventPublisher, never()).publishEvent(any(ApplicationEvent.class));
    }
}
