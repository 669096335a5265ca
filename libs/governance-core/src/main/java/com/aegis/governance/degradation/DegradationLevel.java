package com.aegis.governance.degradation;

/**
 * System-wide degradation level, ordered from full service to none. The feature rules for each
 * level are held by a {@link DegradationPolicy}.
 */
public enum DegradationLevel {
    NORMAL,
    DEGRADED_L1,
    DEGRADED_L2,
    DEGRADED_L3,
    EMERGENCY,
    OFFLINE;

    public boolean isAtLeast(DegradationLevel other) {
        return compareTo(other) >= 0;
    }
}
