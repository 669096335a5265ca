package com.aegis.governance.recovery;

/**
 * Outcome of one validation check.
 *
 * @param name       check name
 * @param passed     whether the check passed
 * @param actual     measured value
 * @param threshold  required value
 * @param comparator how {@code actual} is compared to {@code threshold}: "&gt;=" or "&lt;="
 */
public record ValidationCheck(String name, boolean passed, double actual, double threshold, String comparator) {

    public static final String HEALTH_PASSES = "consecutive_health_passes";
    public static final String LATENCY_P99 = "latency_p99_ms";
    public static final String ERROR_RATE = "error_rate";
    public static final String THROUGHPUT = "throughput_rps";

    static ValidationCheck atLeast(String name, double actual, double threshold) {
        return new ValidationCheck(name, actual >= threshold, actual, threshold, ">=");
    }

    static ValidationCheck atMost(String name, double actual, double threshold) {
        return new ValidationCheck(name, actual <= threshold, actual, threshold, "<=");
    }

    /** e.g. {@code "error_rate: 0.02 (required <= 0.01) FAILED"}. */
    public String describe() {
        return name + ": " + actual + " (required " + comparator + " " + threshold + ") " + (passed ? "PASSED" : "FAILED");
    }
}
