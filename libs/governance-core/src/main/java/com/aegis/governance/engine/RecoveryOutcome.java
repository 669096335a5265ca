package com.aegis.governance.engine;

/** Outcome of {@link GovernanceEngine#initiateRecovery} and {@link GovernanceEngine#reportRestorationProgress}. */
public enum RecoveryOutcome {

    /** Validation passed; primary restored and the traffic ramp may start. */
    RECOVERING,

    /** At least one check failed; nothing was restored. */
    VALIDATION_FAILED,

    /** Validation passed but the service does not recover automatically and nobody approved. */
    AWAITING_MANUAL_RESTORE,

    /** The failure must be resolved by a named approver. */
    MANUAL_INTERVENTION_REQUIRED,

    /** Ramp step reported and within tolerance. */
    IN_PROGRESS,

    /** Ramp error rate too high; the plan was aborted and the service sent back to fallback. */
    ROLLED_BACK,

    /** Final ramp step passed; the plan is complete and the failure resolved. */
    COMPLETED,

    /** Restoration progress reported for a plan that has not started its ramp. */
    RESTORE_NOT_STARTED,

    /** Recovery requested for a plan already ramping. */
    RESTORE_IN_PROGRESS,

    /** No plan with that id. */
    PLAN_NOT_FOUND,

    /** The plan was aborted or completed. */
    PLAN_NOT_ACTIVE
}
