package com.aegis.governance.fallback;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Default descriptor for each {@link TierKind}.
 */
public final class TierProfiles {

    /**
     * @param qualityPercent    response quality relative to primary
     * @param latencyMultiplier latency relative to primary
     * @param approvalGated     whether automatic moves out of the tier need approval
     */
    public record TierProfile(int qualityPercent, double latencyMultiplier, boolean approvalGated) {}

    private static final Map<TierKind, TierProfile> PROFILES;

    static {
        Map<TierKind, TierProfile> table = new EnumMap<>(TierKind.class);
        table.put(TierKind.PRIMARY, new TierProfile(100, 1.0, false));
        table.put(TierKind.SECONDARY, new TierProfile(90, 1.2, false));
        table.put(TierKind.CACHE, new TierProfile(80, 0.5, false));
        table.put(TierKind.DEGRADED, new TierProfile(50, 1.0, true));
        table.put(TierKind.STATIC_FALLBACK, new TierProfile(20, 0.1, true));
        PROFILES = Collections.unmodifiableMap(table);
    }

    private TierProfiles() {
        // utility class
    }

    public static TierProfile of(TierKind kind) {
        return PROFILES.get(kind);
    }
}
