package com.fintech.marketsync.persistence;

import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Reports the durable writer state on /actuator/health. A disabled writer is
 * reported as degraded rather than down: live reads are served from the cache.
 */
@Component("durableStore")
public class DurableStoreHealthIndicator implements HealthIndicator {

    private final DurableCandleWriter writer;

    public DurableStoreHealthIndicator(DurableCandleWriter writer) {
        this.writer = writer;
    }

    @Override
    public Health health() {
        WriterStats stats = writer.stats();
        Health.Builder builder = stats.enabled() ? Health.up() : Health.status("DEGRADED");
        return builder
            .withDetail("successCount", stats.successCount())
            .withDetail("failureCount", stats.failureCount())
            .withDetail("successRate", stats.successRate())
            .withDetail("lastFailureTime", stats.lastFailureTime() != null ? stats.lastFailureTime().toString() : "never")
            .build();
    }
}
