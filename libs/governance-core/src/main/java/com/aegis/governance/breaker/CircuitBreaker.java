package com.aegis.governance.breaker;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Three-state admission gate for one dependency.
 * <p>
 * All state lives behind a single lock, so a failing request and a recovering probe cannot lose
 * each other's updates. Counters reset on every state change. A success while CLOSED only bumps
 * the success counter; failures accumulated in CLOSED are cleared by a state change and nothing
 * else.
 * <p>
 * There is no timer: {@link #shouldAllowRequest()} checks whether the open timeout has elapsed
 * and performs the OPEN to HALF_OPEN transition itself.
 */
public final class CircuitBreaker {

    private static final Logger log = LoggerFactory.getLogger(CircuitBreaker.class);

    private final String dependencyId;
    private final CircuitBreakerConfig config;
    private final Clock clock;
    private final CircuitBreakerListener listener;
    private final ReentrantLock lock = new ReentrantLock();

    private CircuitState state = CircuitState.CLOSED;
    private int failureCount;
    private int successCount;
    private Instant lastFailureAt;
    private Instant openedAt;

    public CircuitBreaker(String dependencyId, CircuitBreakerConfig config, Clock clock,
                          CircuitBreakerListener listener) {
        if (dependencyId == null || dependencyId.isBlank()) {
            throw new IllegalArgumentException("dependencyId must not be null or blank");
        }
        if (config == null) {
            throw new IllegalArgumentException("config must not be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock must not be null");
        }
        this.dependencyId = dependencyId;
        this.config = config;
        this.clock = clock;
        this.listener = listener == null ? CircuitBreakerListener.NONE : listener;
    }

    public CircuitBreaker(String dependencyId, CircuitBreakerConfig config, Clock clock) {
        this(dependencyId, config, clock, CircuitBreakerListener.NONE);
    }

    /**
     * Decides whether a request may go to the dependency. Moves OPEN to HALF_OPEN once the open
     * timeout has elapsed.
     */
    public boolean shouldAllowRequest() {
        lock.lock();
        try {
            return switch (state) {
                case CLOSED, HALF_OPEN -> true;
                case OPEN -> {
                    Duration elapsed = Duration.between(openedAt, clock.instant());
                    if (elapsed.compareTo(config.openTimeout()) >= 0) {
                        transitionTo(CircuitState.HALF_OPEN);
                        yield true;
                    }
                    yield false;
                }
            };
        } finally {
            lock.unlock();
        }
    }

    /** Records a successful call. Returns the state after the call. */
    public CircuitState recordSuccess() {
        lock.lock();
        try {
            switch (state) {
                case CLOSED -> successCount++;
                case HALF_OPEN -> {
                    successCount++;
                    if (successCount >= config.successThreshold()) {
                        transitionTo(CircuitState.CLOSED);
                    }
                }
                case OPEN -> log.debug("Ignoring success for {} while circuit is OPEN", dependencyId);
            }
            return state;
        } finally {
            lock.unlock();
        }
    }

    /** Records a failed call. Returns the state after the call. */
    public CircuitState recordFailure() {
        lock.lock();
        try {
            lastFailureAt = clock.instant();
            switch (state) {
                case CLOSED -> {
                    failureCount++;
                    if (failureCount >= config.failureThreshold()) {
                        transitionTo(CircuitState.OPEN);
                    }
                }
                case HALF_OPEN -> transitionTo(CircuitState.OPEN);
                case OPEN -> log.debug("Failure for {} while circuit is already OPEN", dependencyId);
            }
            return state;
        } finally {
            lock.unlock();
        }
    }

    /** Current state without evaluating the open timeout. */
    public CircuitState state() {
        lock.lock();
        try {
            return state;
        } finally {
            lock.unlock();
        }
    }

    public CircuitBreakerState snapshot() {
        lock.lock();
        try {
            return new CircuitBreakerState(dependencyId, state, failureCount, successCount,
                    config.failureThreshold(), config.successThreshold(), lastFailureAt, openedAt);
        } finally {
            lock.unlock();
        }
    }

    public String dependencyId() {
        return dependencyId;
    }

    public CircuitBreakerConfig config() {
        return config;
    }

    private void transitionTo(CircuitState next) {
        CircuitState previous = state;
        state = next;
        failureCount = 0;
        successCount = 0;
        if (next == CircuitState.OPEN) {
            openedAt = clock.instant();
        }
        log.info("Circuit for {} {} -> {}", dependencyId, previous, next);
        listener.onStateChange(dependencyId, previous, next);
    }
}
