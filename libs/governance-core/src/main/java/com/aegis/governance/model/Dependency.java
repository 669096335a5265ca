package com.aegis.governance.model;

import java.time.Duration;

/**
 * A downstream dependency watched by the governor.
 *
 * @param id                    unique id (e.g. "db-1")
 * @param name                  display name
 * @param type                  dependency kind
 * @param endpoint              address probed by the health check
 * @param slaTargetPercent      availability target, e.g. 99.9
 * @param timeout               request timeout; probe latency beyond it downgrades HEALTHY to DEGRADED
 * @param retryBudget           retries callers may spend against this dependency
 * @param circuitBreakerEnabled whether a circuit breaker gates this dependency
 * @param status                last observed health status
 */
public record Dependency(
        String id,
        String name,
        DependencyType type,
        String endpoint,
        double slaTargetPercent,
        Duration timeout,
        int retryBudget,
        boolean circuitBreakerEnabled,
        HealthStatus status
) {

    public Dependency {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id must not be null or blank");
        }
        if (type == null) {
            throw new IllegalArgumentException("type must not be null");
        }
        if (slaTargetPercent < 0 || slaTargetPercent > 100) {
            throw new IllegalArgumentException("slaTargetPercent must be between 0 and 100");
        }
        if (retryBudget < 0) {
            throw new IllegalArgumentException("retryBudget must not be negative");
        }
        if (name == null || name.isBlank()) {
            name = id;
        }
        if (timeout == null || timeout.isNegative() || timeout.isZero()) {
            timeout = Duration.ofSeconds(5);
        }
        if (status == null) {
            status = HealthStatus.UNKNOWN;
        }
    }

    /** A breaker-enabled dependency with default SLA (99.9%), 5s timeout and 3 retries. */
    public static Dependency of(String id, DependencyType type, String endpoint) {
        return new Dependency(id, id, type, endpoint, 99.9, Duration.ofSeconds(5), 3, true, HealthStatus.UNKNOWN);
    }

    public Dependency withStatus(HealthStatus newStatus) {
        return new Dependency(id, name, type, endpoint, slaTargetPercent, timeout, retryBudget,
                circuitBreakerEnabled, newStatus);
    }
}
