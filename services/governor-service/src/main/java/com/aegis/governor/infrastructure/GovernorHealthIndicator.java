package com.aegis.governor.infrastructure;

import com.aegis.governance.degradation.DegradationLevel;
import com.aegis.governance.engine.GovernanceEngine;
import com.aegis.governance.engine.SystemStatus;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.boot.actuate.health.Status;
import org.springframework.stereotype.Component;

/**
 * Reports the governor's system status under {@code /actuator/health/governor}.
 *
 * <p>UP when nothing is in fallback or degraded, DEGRADED while incidents are being handled, and
 * OUT_OF_SERVICE once degradation reaches EMERGENCY.
 */
@Component("governor")
public class GovernorHealthIndicator implements HealthIndicator {

    public static final Status DEGRADED = new Status("DEGRADED", "Governed services are running on fallbacks");

    private final GovernanceEngine engine;

    public GovernorHealthIndicator(GovernanceEngine engine) {
        this.engine = engine;
    }

    @Override
    public Health health() {
        SystemStatus status = engine.getSystemStatus();
        Health.Builder builder;
        if (status.degradationLevel().isAtLeast(DegradationLevel.EMERGENCY)) {
            builder = Health.outOfService();
        } else if (status.isNominal()) {
            builder = Health.up();
        } else {
            builder = Health.status(DEGRADED);
        }
        return builder
                .withDetail("degradationLevel", status.degradationLevel())
                .withDetail("activeFallbacks", status.activeFallbacks())
                .withDetail("currentTiers", status.currentTiers())
                .withDetail("circuitBreakers", status.circuitBreakers())
                .withDetail("dependencyHealth", status.dependencyHealth())
                .withDetail("openIncidents", status.openIncidents())
                .build();
    }
}
