package com.aegis.governance.model;

import com.aegis.events.Severity;

import java.time.Duration;

/**
 * Constants attached to a {@link FailureKind}.
 *
 * @param defaultSeverity    severity used when the detector does not classify one itself
 * @param escalation         escalation category
 * @param expectedResolution typical time to resolve, used to size recovery plans
 * @param description        operator-facing summary
 */
public record FailureProfile(
        Severity defaultSeverity,
        EscalationType escalation,
        Duration expectedResolution,
        String description
) {

    public boolean requiresManualIntervention() {
        return escalation.requiresManualIntervention();
    }
}
