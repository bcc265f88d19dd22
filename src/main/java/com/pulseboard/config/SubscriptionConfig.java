package com.pulseboard.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration properties for live-update subscription admission.
 *
 * <p>Binds to the {@code pulseboard.subscription.*} prefix in application.properties.
 * The buffer margin is added to the summed visible-row count of all panes to form the
 * unlocked fast-tier capacity (3 rows above + 3 rows below the viewport by default), so
 * small scroll jitter does not churn fast subscriptions.
 */
@Configuration
@ConfigurationProperties(prefix = "pulseboard.subscription")
@Getter
@Setter
public class SubscriptionConfig {

    /** Rows added to the visible-row sum when computing the unlocked fast capacity. */
    private int bufferMargin = 6;

    /**
     * Initial base limit for invisible-row subscriptions. Consumed by the inactive-row
     * rotation, not by the admission controller.
     */
    private int defaultInactiveBaseLimit = 100;
}
