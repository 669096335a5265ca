package com.aegis.governance.recovery;

/**
 * Measurements a recovery validation is judged on.
 *
 * @param consecutiveHealthPasses passing health checks in a row
 * @param latencyP99Ms            99th percentile latency
 * @param errorRate               fraction of failed requests
 * @param throughputRps           requests per second served
 */
public record RecoveryMetrics(int consecutiveHealthPasses, double latencyP99Ms, double errorRate,
                              double throughputRps) {}
