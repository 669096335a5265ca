package com.aegis.governance.model;

/**
 * Telemetry sample captured when a failure is detected.
 *
 * @param errorRate  fraction of failed requests (0.0 - 1.0)
 * @param latencyMs  observed latency in milliseconds
 * @param queueDepth pending work items
 */
public record MetricsSnapshot(double errorRate, long latencyMs, long queueDepth) {

    public MetricsSnapshot {
        if (errorRate < 0 || errorRate > 1) {
            throw new IllegalArgumentException("errorRate must be between 0 and 1");
        }
        if (latencyMs < 0) {
            throw new IllegalArgumentException("latencyMs must not be negative");
        }
        if (queueDepth < 0) {
            throw new IllegalArgumentException("queueDepth must not be negative");
        }
    }

    public static MetricsSnapshot empty() {
        return new MetricsSnapshot(0, 0, 0);
    }
}
