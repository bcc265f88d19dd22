package com.pulseboard.observability;

import com.pulseboard.event.SubscriptionEvictionEvent;
import com.pulseboard.event.SubscriptionLockEvent;
import com.pulseboard.subscription.SubscriptionAdmissionController;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

/**
 * Registers Micrometer meters for live-update subscription admission.
 *
 * <ul>
 *   <li><b>subscriptions.fast.count / subscriptions.slow.count</b> (gauge): current pool sizes</li>
 *   <li><b>subscriptions.fast.limit / subscriptions.slow.limit</b> (gauge): enforced capacities</li>
 *   <li><b>subscriptions.normal.limit</b> (gauge): unlocked fast capacity</li>
 *   <li><b>subscriptions.lock.active</b> (gauge 0/1): whether the detail-view lock is engaged</li>
 *   <li><b>subscriptions.evicted</b> (counter, tag tier): keys evicted per tier</li>
 *   <li><b>subscriptions.lock.transitions</b> (counter, tag state): lock engages and releases</li>
 * </ul>
 *
 * <p>Gauges are lazily evaluated by Micrometer during scrape. Counters are incremented from
 * the Spring events bridged by {@link com.pulseboard.event.SubscriptionEventPublisher}.
 */
@Service
public class SubscriptionMetricsService {

    private static final Logger log = LoggerFactory.getLogger(SubscriptionMetricsService.class);

    private final Counter fastEvictedCounter;
    private final Counter slowEvictedCounter;
    private final Counter lockEngagedCounter;
    private final Counter lockReleasedCounter;

    public SubscriptionMetricsService(
            MeterRegistry meterRegistry, SubscriptionAdmissionController subscriptionAdmissionController) {
        this.fastEvictedCounter = Counter.builder("subscriptions.evicted")
                .description("Keys evicted from a subscription tier")
                .tag("tier", "fast")
                .register(meterRegistry);

        this.slowEvictedCounter = Counter.builder("subscriptions.evicted")
                .description("Keys evicted from a subscription tier")
                .tag("tier", "slow")
                .register(meterRegistry);

        this.lockEngagedCounter = Counter.builder("subscriptions.lock.transitions")
                .description("Subscription lock transitions")
                .tag("state", "engaged")
                .register(meterRegistry);

        this.lockReleasedCounter = Counter.builder("subscriptions.lock.transitions")
                .description("Subscription lock transitions")
                .tag("state", "released")
                .register(meterRegistry);

        Gauge.builder(
                        "subscriptions.fast.count",
                        subscriptionAdmissionController,
                        SubscriptionAdmissionController::getFastCount)
                .description("Keys currently holding a fast subscription")
                .register(meterRegistry);

        Gauge.builder(
                        "subscriptions.slow.count",
                        subscriptionAdmissionController,
                        SubscriptionAdmissionController::getSlowCount)
                .description("Keys currently holding a slow subscription")
                .register(meterRegistry);

        Gauge.builder("subscriptions.fast.limit", subscriptionAdmissionController, c -> c.getCurrentLimits()
                        .fast())
                .register(meterRegistry);

        Gauge.builder("subscriptions.slow.limit", subscriptionAdmissionController, c -> c.getCurrentLimits()
                        .slow())
                .register(meterRegistry);

        Gauge.builder("subscriptions.normal.limit", subscriptionAdmissionController, c -> c.getCurrentLimits()
                        .normal())
                .register(meterRegistry);

        Gauge.builder(
                        "subscriptions.lock.active",
                        subscriptionAdmissionController,
                        c -> c.isSubscriptionLockActive() ? 1.0 : 0.0)
                .register(meterRegistry);
    }

    @EventListener
    public void onEvictions(SubscriptionEvictionEvent event) {
        int fast = event.getBatch().fast().size();
        int slow = event.getBatch().slow().size();
        if (fast > 0) {
            fastEvictedCounter.increment(fast);
        }
        if (slow > 0) {
            slowEvictedCounter.increment(slow);
        }
        log.debug("Recorded {} fast and {} slow evictions", fast, slow);
    }

    @EventListener
    public void onLockChange(SubscriptionLockEvent event) {
        if (event.isActive()) {
            lockEngagedCounter.increment();
        } else {
            lockReleasedCounter.increment();
        }
    }
}
