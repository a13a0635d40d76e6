package com.trackinglog.engine.metrics;

import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.boot.actuate.autoconfigure.metrics.MeterRegistryCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Metrics configuration for the delivery ledger.
 */
@Configuration
public class MetricsConfiguration {

    @Bean
    public MeterRegistryCustomizer<MeterRegistry> metricsCommonTags() {
        return registry -> registry.config()
            .commonTags("application", "delivery-tracking-ledger");
    }

    @Bean
    public LedgerMetrics ledgerMetrics(MeterRegistry meterRegistry) {
        return new LedgerMetrics(meterRegistry);
    }
}
