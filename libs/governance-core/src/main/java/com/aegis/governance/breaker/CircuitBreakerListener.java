package com.aegis.governance.breaker;

/** Receives circuit breaker state changes. Called while the breaker's lock is held; keep it short. */
@FunctionalInterface
public interface CircuitBreakerListener {

    CircuitBreakerListener NONE = (dependencyId, from, to) -> { };

    void onStateChange(String dependencyId, CircuitState from, CircuitState to);
}
