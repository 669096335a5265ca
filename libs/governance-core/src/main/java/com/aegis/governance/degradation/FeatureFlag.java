package com.aegis.governance.degradation;

/** Resolved availability of one feature. */
public enum FeatureFlag {
    ENABLED,
    CANARY,
    DEGRADED,
    DISABLED;

    /** Share of traffic the feature serves. */
    public int trafficPercent() {
        return switch (this) {
            case ENABLED -> 100;
            case DEGRADED -> 50;
            case CANARY -> 10;
            case DISABLED -> 0;
        };
    }

    public boolean isAvailable() {
        return trafficPercent() > 0;
    }
}
