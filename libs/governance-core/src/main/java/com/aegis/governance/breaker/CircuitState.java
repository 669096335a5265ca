package com.aegis.governance.breaker;

/**
 * Circuit breaker states.
 * <pre>
 * CLOSED    --failures >= failureThreshold-->  OPEN
 * OPEN      --timeout elapsed, next check--->  HALF_OPEN
 * HALF_OPEN --successes >= successThreshold->  CLOSED
 * HALF_OPEN --any failure------------------->  OPEN
 * </pre>
 */
public enum CircuitState {

    /** Requests pass; failures are counted. */
    CLOSED,

    /** Requests are rejected until the open timeout elapses. */
    OPEN,

    /** Probe requests pass to test whether the dependency recovered. */
    HALF_OPEN
}
