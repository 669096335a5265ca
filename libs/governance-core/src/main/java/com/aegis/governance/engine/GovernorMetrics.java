package com.aegis.governance.engine;

import com.aegis.governance.breaker.CircuitState;
import com.aegis.governance.degradation.DegradationLevel;
import com.aegis.governance.fallback.FallbackOutcome;
import com.aegis.governance.model.FailureEvent;
import com.aegis.observability.MetricFactory;

/**
 * Meters recorded by the governance engine.
 */
final class GovernorMetrics {

    static final String FAILURES_DETECTED = "aegis.failures.detected";
    static final String FALLBACK_REQUESTS = "aegis.fallback.requests";
    static final String CIRCUIT_TRANSITIONS = "aegis.circuit.transitions";
    static final String RECOVERY_VALIDATIONS = "aegis.recovery.validations";
    static final String DEGRADATION_LEVEL = "aegis.degradation.level";
    static final String AUDIT_SINK_FAILURES = "aegis.audit.sink.failures";

    private final MetricFactory factory;

    GovernorMetrics(MetricFactory factory) {
        this.factory = factory;
        factory.gauge(DEGRADATION_LEVEL, "Active degradation level (0 = NORMAL)");
    }

    void failureDetected(FailureEvent event) {
        factory.counter(FAILURES_DETECTED, "Failures classified by the detector",
                "kind", event.kind().name(), "severity", event.severity().name()).increment();
    }

    void fallbackOutcome(String service, FallbackOutcome outcome) {
        factory.counter(FALLBACK_REQUESTS, "Fallback and restore requests by outcome",
                "service", service, "outcome", outcome.name()).increment();
    }

    void circuitTransition(String dependencyId, CircuitState to) {
        factory.counter(CIRCUIT_TRANSITIONS, "Circuit breaker state changes",
                "dependency", dependencyId, "to", to.name()).increment();
    }

    void validation(boolean passed) {
        factory.counter(RECOVERY_VALIDATIONS, "Recovery validation runs",
                "result", passed ? "passed" : "failed").increment();
    }

    void degradationLevel(DegradationLevel level) {
        factory.gauge(DEGRADATION_LEVEL, "Active degradation level (0 = NORMAL)").set(level.ordinal());
    }

    void auditSinkFailure() {
        factory.counter(AUDIT_SINK_FAILURES, "Audit entries the sink failed to store").increment();
    }
}
