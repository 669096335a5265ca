package com.aegis.governance.detection;

import java.time.Duration;

/**
 * Critical thresholds used to classify telemetry samples, plus probe and history limits.
 *
 * @param criticalLatencyMs   latency above which a sample is HIGH_LATENCY
 * @param criticalErrorRate   error rate above which a sample is ERROR_SPIKE
 * @param criticalQueueDepth  queue depth above which a sample is CAPACITY_EXCEEDED
 * @param historyCapacity     health checks kept per dependency
 * @param probeTimeout        maximum time to wait for a probe
 */
public record DetectionThresholds(
        long criticalLatencyMs,
        double criticalErrorRate,
        long criticalQueueDepth,
        int historyCapacity,
        Duration probeTimeout
) {

    public static final long DEFAULT_CRITICAL_LATENCY_MS = 2000;
    public static final double DEFAULT_CRITICAL_ERROR_RATE = 0.05;
    public static final long DEFAULT_CRITICAL_QUEUE_DEPTH = 1000;
    public static final int DEFAULT_HISTORY_CAPACITY = 100;
    public static final Duration DEFAULT_PROBE_TIMEOUT = Duration.ofSeconds(5);

    public DetectionThresholds {
        if (criticalLatencyMs <= 0) {
            throw new IllegalArgumentException("criticalLatencyMs must be positive");
        }
        if (criticalErrorRate <= 0 || criticalErrorRate > 1) {
            throw new IllegalArgumentException("criticalErrorRate must be in (0, 1]");
        }
        if (criticalQueueDepth <= 0) {
            throw new IllegalArgumentException("criticalQueueDepth must be positive");
        }
        if (historyCapacity <= 0) {
            throw new IllegalArgumentException("historyCapacity must be positive");
        }
        if (probeTimeout == null || probeTimeout.isZero() || probeTimeout.isNegative()) {
            throw new IllegalArgumentException("probeTimeout must be positive");
        }
    }

    public static DetectionThresholds defaults() {
        return new DetectionThresholds(DEFAULT_CRITICAL_LATENCY_MS, DEFAULT_CRITICAL_ERROR_RATE,
                DEFAULT_CRITICAL_QUEUE_DEPTH, DEFAULT_HISTORY_CAPACITY, DEFAULT_PROBE_TIMEOUT);
    }
}
