package com.aegis.governance.model;

/**
 * Category an incident is escalated under. Some categories must always be routed to a human.
 */
public enum EscalationType {
    TECHNICAL,
    CAPACITY,
    SECURITY,
    CUSTOMER_IMPACT,
    LEGAL_THREAT,
    SAFETY_CONCERN,
    DATA_CORRUPTION;

    /** Legal threats, safety concerns and data corruption are never resolved automatically. */
    public boolean requiresManualIntervention() {
        return switch (this) {
            case LEGAL_THREAT, SAFETY_CONCERN, DATA_CORRUPTION -> true;
            case TECHNICAL, CAPACITY, SECURITY, CUSTOMER_IMPACT -> false;
        };
    }
}
