package com.aegis.governance.model;

import java.time.Instant;

/**
 * Point-in-time health observation of one dependency.
 *
 * @param dependencyId the observed dependency
 * @param timestamp    when the observation was made
 * @param status       observed status
 * @param latencyMs    probe latency in milliseconds
 * @param error        error text, null when the probe succeeded
 */
public record HealthCheck(
        String dependencyId,
        Instant timestamp,
        HealthStatus status,
        long latencyMs,
        String error
) {

    /** An UNKNOWN observation carrying an explanation instead of a probe result. */
    public static HealthCheck unknown(String dependencyId, Instant timestamp, String reason) {
        return new HealthCheck(dependencyId, timestamp, HealthStatus.UNKNOWN, 0, reason);
    }

    public boolean isPassing() {
        return status.isPassing();
    }
}
