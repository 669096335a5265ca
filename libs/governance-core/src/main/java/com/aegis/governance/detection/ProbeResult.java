package com.aegis.governance.detection;

import com.aegis.governance.model.HealthStatus;

/**
 * Raw result of a single health probe, as reported by the telemetry collaborator.
 *
 * @param status    status the probe observed
 * @param latencyMs time the probe took
 * @param error     error text, null on success
 */
public record ProbeResult(HealthStatus status, long latencyMs, String error) {

    public ProbeResult {
        if (status == null) {
            throw new IllegalArgumentException("status must not be null");
        }
        if (latencyMs < 0) {
            throw new IllegalArgumentException("latencyMs must not be negative");
        }
    }

    public static ProbeResult healthy(long latencyMs) {
        return new ProbeResult(HealthStatus.HEALTHY, latencyMs, null);
    }

    public static ProbeResult unhealthy(String error, long latencyMs) {
        return new ProbeResult(HealthStatus.UNHEALTHY, latencyMs, error);
    }
}
