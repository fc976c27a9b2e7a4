package com.repolens.core.health;

import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Actuator health indicator for the file-read pool. DOWN once the pool is shut
 * down, DEGRADED while every worker is busy and reads are queueing.
 */
@Component("scanPoolHealthIndicator")
public class ScanPoolHealthIndicator implements HealthIndicator {

    private final HealthCheckService healthCheckService;

    public ScanPoolHealthIndicator(HealthCheckService healthCheckService) {
        this.healthCheckService = healthCheckService;
    }

    @Override
    public Health health() {
        HealthStatus status = healthCheckService.checkScanPool();
        var builder = switch (status.status()) {
            case UP -> Health.up();
            case DOWN -> Health.down();
            case DEGRADED -> Health.status("DEGRADED");
        };
        builder.withDetail("detail", status.detail());
        status.metadata().forEach(builder::withDetail);
        return builder.build();
    }
}
