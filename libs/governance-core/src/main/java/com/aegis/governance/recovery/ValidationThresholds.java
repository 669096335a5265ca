package com.aegis.governance.recovery;

/**
 * Pass criteria for recovery validation and the rollback trigger for the restoration ramp.
 *
 * @param minHealthPasses   consecutive passing health checks required
 * @param maxLatencyP99Ms   highest acceptable p99 latency
 * @param maxErrorRate      highest acceptable error rate
 * @param minThroughputRps  lowest acceptable throughput
 * @param rollbackErrorRate error rate above which a ramp is rolled back
 */
public record ValidationThresholds(
        int minHealthPasses,
        double maxLatencyP99Ms,
        double maxErrorRate,
        double minThroughputRps,
        double rollbackErrorRate
) {

    public ValidationThresholds {
        if (minHealthPasses < 1) {
            throw new IllegalArgumentException("minHealthPasses must be >= 1");
        }
        if (maxLatencyP99Ms <= 0) {
            throw new IllegalArgumentException("maxLatencyP99Ms must be positive");
        }
        if (maxErrorRate < 0 || maxErrorRate > 1) {
            throw new IllegalArgumentException("maxErrorRate must be between 0 and 1");
        }
        if (minThroughputRps < 0) {
            throw new IllegalArgumentException("minThroughputRps must not be negative");
        }
        if (rollbackErrorRate < 0 || rollbackErrorRate > 1) {
            throw new IllegalArgumentException("rollbackErrorRate must be between 0 and 1");
        }
    }

    /** 3 passes, p99 500 ms, 1% errors, 100 rps; roll back above 5% errors. */
    public static ValidationThresholds defaults() {
        return new ValidationThresholds(3, 500, 0.01, 100, 0.05);
    }

    public ValidationThresholds withMinHealthPasses(int passes) {
        return new ValidationThresholds(passes, maxLatencyP99Ms, maxErrorRate, minThroughputRps, rollbackErrorRate);
    }
}
