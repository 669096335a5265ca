package com.aegis.governance.breaker;

import java.time.Duration;

/**
 * Thresholds of one circuit breaker.
 *
 * @param failureThreshold failures in CLOSED that open the circuit
 * @param successThreshold successes in HALF_OPEN that close it again
 * @param openTimeout      time the circuit stays OPEN before a probe is allowed
 */
public record CircuitBreakerConfig(int failureThreshold, int successThreshold, Duration openTimeout) {

    public CircuitBreakerConfig {
        if (failureThreshold < 1) {
            throw new IllegalArgumentException("failureThreshold must be >= 1");
        }
        if (successThreshold < 1) {
            throw new IllegalArgumentException("successThreshold must be >= 1");
        }
        if (openTimeout == null || openTimeout.isNegative()) {
            throw new IllegalArgumentException("openTimeout must not be null or negative");
        }
    }

    /** 5 failures to open, 3 successes to close, 60 seconds open. */
    public static CircuitBreakerConfig defaults() {
        return new CircuitBreakerConfig(5, 3, Duration.ofSeconds(60));
    }
}
