package com.pulseboard.config;

import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import org.springframework.context.annotation.Configuration;

/**
 * Micrometer metrics configuration for Pulseboard.
 *
 * <p>Registers common tags applied to all metrics so that dimensions are consistent
 * across custom and auto-configured meters. The subscription meters themselves live in
 * {@link com.pulseboard.observability.SubscriptionMetricsService}.
 */
@Configuration
public class MetricsConfig {

    private final MeterRegistry meterRegistry;

    public MetricsConfig(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    @PostConstruct
    void configureCommonTags() {
        meterRegistry.config().commonTags("application", "pulseboard");
    }
}
