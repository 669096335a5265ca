package com.aegis.governance.model;

import com.aegis.events.Severity;

import java.time.Duration;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Lookup table from {@link FailureKind} to its {@link FailureProfile}. Every kind has an entry.
 */
public final class FailureProfiles {

    private static final Map<FailureKind, FailureProfile> PROFILES = build();

    private FailureProfiles() {
        // utility class
    }

    public static FailureProfile of(FailureKind kind) {
        return PROFILES.get(kind);
    }

    public static Map<FailureKind, FailureProfile> all() {
        return PROFILES;
    }

    private static Map<FailureKind, FailureProfile> build() {
        Map<FailureKind, FailureProfile> table = new EnumMap<>(FailureKind.class);
        table.put(FailureKind.HIGH_LATENCY, new FailureProfile(Severity.HIGH, EscalationType.TECHNICAL,
                Duration.ofMinutes(30), "Latency above the critical threshold"));
        table.put(FailureKind.ERROR_SPIKE, new FailureProfile(Severity.CRITICAL, EscalationType.TECHNICAL,
                Duration.ofMinutes(60), "Error rate above the critical threshold"));
        table.put(FailureKind.CAPACITY_EXCEEDED, new FailureProfile(Severity.HIGH, EscalationType.CAPACITY,
                Duration.ofMinutes(45), "Queue depth above the critical threshold"));
        table.put(FailureKind.DEPENDENCY_DOWN, new FailureProfile(Severity.CRITICAL, EscalationType.TECHNICAL,
                Duration.ofHours(2), "Dependency not reachable"));
        table.put(FailureKind.TIMEOUT, new FailureProfile(Severity.HIGH, EscalationType.TECHNICAL,
                Duration.ofMinutes(30), "Requests exceeding their timeout"));
        table.put(FailureKind.RATE_LIMITED, new FailureProfile(Severity.MEDIUM, EscalationType.CAPACITY,
                Duration.ofMinutes(15), "Dependency is throttling requests"));
        table.put(FailureKind.NETWORK_PARTITION, new FailureProfile(Severity.CRITICAL, EscalationType.TECHNICAL,
                Duration.ofHours(1), "Network partition between service and dependency"));
        table.put(FailureKind.DATA_CORRUPTION, new FailureProfile(Severity.CRITICAL, EscalationType.DATA_CORRUPTION,
                Duration.ofHours(4), "Dependency returned corrupt data"));
        table.put(FailureKind.CONFIG_ERROR, new FailureProfile(Severity.HIGH, EscalationType.TECHNICAL,
                Duration.ofMinutes(30), "Invalid configuration detected"));
        return Collections.unmodifiableMap(table);
    }
}
