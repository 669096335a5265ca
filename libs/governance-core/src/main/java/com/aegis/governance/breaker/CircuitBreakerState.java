package com.aegis.governance.breaker;

import java.time.Instant;

/**
 * Consistent snapshot of a circuit breaker, taken under its lock.
 *
 * @param dependencyId     gated dependency
 * @param state            current state
 * @param failureCount     failures since the last state change
 * @param successCount     successes since the last state change
 * @param failureThreshold configured failure threshold
 * @param successThreshold configured success threshold
 * @param lastFailureAt    time of the most recent failure, null if none
 * @param openedAt         time the circuit last opened, null if never
 */
public record CircuitBreakerState(
        String dependencyId,
        CircuitState state,
        int failureCount,
        int successCount,
        int failureThreshold,
        int successThreshold,
        Instant lastFailureAt,
        Instant openedAt
) {}
