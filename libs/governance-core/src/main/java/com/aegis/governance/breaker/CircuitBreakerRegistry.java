package com.aegis.governance.breaker;

import java.time.Clock;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Circuit breakers keyed by dependency id. Owned by the governance engine; every breaker it
 * creates reports to the same listener.
 */
public final class CircuitBreakerRegistry {

    private final Map<String, CircuitBreaker> breakers = new ConcurrentHashMap<>();
    private final Clock clock;
    private final CircuitBreakerListener listener;

    public CircuitBreakerRegistry(Clock clock, CircuitBreakerListener listener) {
        if (clock == null) {
            throw new IllegalArgumentException("clock must not be null");
        }
        this.clock = clock;
        this.listener = listener == null ? CircuitBreakerListener.NONE : listener;
    }

    /**
     * Returns the breaker for the dependency, creating it with {@code config} if absent. An
     * existing breaker keeps its state and configuration.
     */
    public CircuitBreaker register(String dependencyId, CircuitBreakerConfig config) {
        return breakers.computeIfAbsent(dependencyId, id -> new CircuitBreaker(id, config, clock, listener));
    }

    public Optional<CircuitBreaker> get(String dependencyId) {
        return dependencyId == null ? Optional.empty() : Optional.ofNullable(breakers.get(dependencyId));
    }

    public Collection<CircuitBreaker> all() {
        return List.copyOf(breakers.values());
    }

    /** Current state of every breaker, sorted by dependency id. */
    public Map<String, CircuitState> states() {
        Map<String, CircuitState> states = new TreeMap<>();
        breakers.forEach((id, breaker) -> states.put(id, breaker.state()));
        return states;
    }
}
