package com.aegis.governance.fallback;

/** Outcome of a fallback or restore request. */
public enum FallbackOutcome {

    /** The service moved to a new tier. */
    TRANSITIONED,

    /** The service moved back to tier 0. */
    RESTORED,

    /** Restore requested while already on tier 0. */
    ALREADY_PRIMARY,

    /** Automatic failover requested on the last tier; needs manual intervention. */
    ALREADY_AT_LOWEST_TIER,

    /** The proposed automatic move touches an approval-gated tier. */
    APPROVAL_REQUIRED,

    /** The service does not allow automatic failover. */
    AUTO_FAILOVER_DISABLED,

    /** Fewer failure events than the service's failure threshold so far. */
    THRESHOLD_NOT_REACHED,

    /** The explicit target is not in the chain. */
    UNKNOWN_TIER,

    /** The explicit target is the current tier. */
    NO_CHANGE,

    /** The service has no fallback configuration. */
    NOT_CONFIGURED;

    /** True if the tier pointer moved. */
    public boolean moved() {
        return this == TRANSITIONED || this == RESTORED;
    }
}
