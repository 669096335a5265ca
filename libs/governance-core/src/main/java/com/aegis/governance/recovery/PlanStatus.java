package com.aegis.governance.recovery;

/** Whether a recovery plan is still being worked. */
public enum PlanStatus {
    ACTIVE,
    COMPLETED,
    ABORTED
}
