package com.aegis.governance.model;

/**
 * Observed health of a dependency.
 */
public enum HealthStatus {

    /** Responding within SLA. */
    HEALTHY,

    /** Responding, but slower than its timeout or partially failing. */
    DEGRADED,

    /** Failing requests. */
    UNHEALTHY,

    /** Down, or failing in a way that threatens the governed service. */
    CRITICAL,

    /** Never probed, unregistered, or probe unavailable. */
    UNKNOWN,

    /** Coming back after a failure; traffic is being ramped. */
    RECOVERING;

    /** True for statuses that count as a passing health check. */
    public boolean isPassing() {
        return this == HEALTHY || this == RECOVERING;
    }
}
