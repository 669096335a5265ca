package com.aegis.governance.model;

/**
 * Classified kind of a detected failure. Per-kind constants live in {@link FailureProfiles}.
 */
public enum FailureKind {
    HIGH_LATENCY,
    ERROR_SPIKE,
    CAPACITY_EXCEEDED,
    DEPENDENCY_DOWN,
    TIMEOUT,
    RATE_LIMITED,
    NETWORK_PARTITION,
    DATA_CORRUPTION,
    CONFIG_ERROR
}
