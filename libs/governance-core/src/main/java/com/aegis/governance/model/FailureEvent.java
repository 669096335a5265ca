package com.aegis.governance.model;

import com.aegis.events.Severity;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * A detected failure of one dependency.
 *
 * @param id                         unique event id
 * @param dependencyId               failing dependency
 * @param kind                       classified failure kind
 * @param severity                   classified severity
 * @param detectedAt                 detection timestamp
 * @param resolvedAt                 resolution timestamp, null while open
 * @param metrics                    telemetry captured at detection
 * @param escalation                 escalation category; defaults to the kind's category
 * @param requiresManualIntervention true if this failure may never be resolved automatically;
 *                                   always true when the escalation category demands it
 */
public record FailureEvent(
        String id,
        String dependencyId,
        FailureKind kind,
        Severity severity,
        Instant detectedAt,
        Instant resolvedAt,
        MetricsSnapshot metrics,
        EscalationType escalation,
        boolean requiresManualIntervention
) {

    public FailureEvent {
        if (dependencyId == null || dependencyId.isBlank()) {
            throw new IllegalArgumentException("dependencyId must not be null or blank");
        }
        if (kind == null) {
            throw new IllegalArgumentException("kind must not be null");
        }
        if (detectedAt == null) {
            throw new IllegalArgumentException("detectedAt must not be null");
        }
        if (id == null || id.isBlank()) {
            id = UUID.randomUUID().toString();
        }
        if (severity == null) {
            severity = FailureProfiles.of(kind).defaultSeverity();
        }
        if (metrics == null) {
            metrics = MetricsSnapshot.empty();
        }
        if (escalation == null) {
            escalation = FailureProfiles.of(kind).escalation();
        }
        requiresManualIntervention = requiresManualIntervention || escalation.requiresManualIntervention();
    }

    /**
     * A new open event. The manual-intervention flag is derived from the kind's escalation type.
     */
    public static FailureEvent detected(String dependencyId, FailureKind kind, Severity severity,
                                        Instant detectedAt, MetricsSnapshot metrics) {
        return escalated(dependencyId, kind, severity, null, detectedAt, metrics);
    }

    /**
     * A new open event escalated under an explicit category, such as a legal threat raised against
     * a dependency's data. A null category falls back to the kind's own.
     */
    public static FailureEvent escalated(String dependencyId, FailureKind kind, Severity severity,
                                         EscalationType escalation, Instant detectedAt, MetricsSnapshot metrics) {
        return new FailureEvent(UUID.randomUUID().toString(), dependencyId, kind, severity, detectedAt,
                null, metrics, escalation, false);
    }

    public boolean isResolved() {
        return resolvedAt != null;
    }

    public Optional<Instant> resolution() {
        return Optional.ofNullable(resolvedAt);
    }

    public FailureEvent resolve(Instant at) {
        return new FailureEvent(id, dependencyId, kind, severity, detectedAt, at, metrics, escalation,
                requiresManualIntervention);
    }
}
