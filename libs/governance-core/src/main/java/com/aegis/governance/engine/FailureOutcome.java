package com.aegis.governance.engine;

/** Outcome of {@link GovernanceEngine#handleFailure}. */
public enum FailureOutcome {

    /** A failure was classified and the governance chain ran. */
    HANDLED,

    /** The sample was within thresholds; the breaker recorded a success. */
    NO_FAILURE_DETECTED,

    /** The dependency is not registered, or not owned by any service. */
    NOT_CONFIGURED
}
