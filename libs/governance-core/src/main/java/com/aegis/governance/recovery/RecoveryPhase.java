package com.aegis.governance.recovery;

import java.util.Optional;

/** Lifecycle of a recovery plan, in order. A plan only ever moves to the next phase. */
public enum RecoveryPhase {
    DETECTION,
    ISOLATION,
    FALLBACK_ACTIVE,
    DIAGNOSIS,
    REMEDIATION,
    VALIDATION,
    GRADUAL_RESTORE,
    FULL_RESTORE,
    POST_MORTEM;

    /** The following phase, or empty for {@link #POST_MORTEM}. */
    public Optional<RecoveryPhase> next() {
        RecoveryPhase[] phases = values();
        return ordinal() + 1 < phases.length ? Optional.of(phases[ordinal() + 1]) : Optional.empty();
    }
}
