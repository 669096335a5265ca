package com.aegis.events;

/** Every governance action that produces an audit entry. */
public enum AuditAction {

    // ---- Setup ----
    SERVICE_SETUP,

    // ---- Detection ----
    HEALTH_CHECK_RECORDED,
    FAILURE_DETECTED,
    FAILURE_HANDLED,
    FAILURE_REJECTED,

    // ---- Circuit breaker ----
    CIRCUIT_STATE_CHANGED,

    // ---- Fallback ----
    FALLBACK_TRANSITIONED,
    FALLBACK_BLOCKED,
    FALLBACK_RESTORED,
    FALLBACK_REFUSED,

    // ---- Degradation ----
    DEGRADATION_CHANGED,

    // ---- Recovery ----
    RECOVERY_PLAN_CREATED,
    RECOVERY_VALIDATED,
    RECOVERY_VALIDATION_FAILED,
    RECOVERY_REFUSED,
    RECOVERY_ABORTED,
    RECOVERY_PROGRESSED,
    RECOVERY_COMPLETED,

    // ---- Notification ----
    NOTIFICATION_SENT
}
