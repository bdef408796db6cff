package com.sentinel.core.health;

import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Actuator health indicator for audit chain integrity.
 * Re-verifies the chain tip on every probe.
 */
@Component
public class LedgerHealthIndicator implements HealthIndicator {

    private final HealthCheckService healthCheckService;

    public LedgerHealthIndicator(HealthCheckService healthCheckService) {
        this.healthCheckService = healthCheckService;
    }

    @Override
    public Health health() {
        HealthStatus ledger = healthCheckService.checkLedger();
        var builder = ledger.status() == HealthStatus.Status.UP ? Health.up() : Health.down();
        builder.withDetail("detail", ledger.detail());
        ledger.metadata().forEach(builder::withDetail);
        return builder.build();
    }
}
