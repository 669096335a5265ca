package com.aegis.events;

/**
 * Severity of a failure, notification or audit-worthy action, ordered from least to most severe.
 */
public enum Severity {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    /** Returns true if this severity is at least as severe as {@code other}. */
    public boolean isAtLeast(Severity other) {
        return compareTo(other) >= 0;
    }
}
