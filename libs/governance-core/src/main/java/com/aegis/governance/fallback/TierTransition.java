package com.aegis.governance.fallback;

import java.time.Instant;

/**
 * A move of one service between two tiers.
 *
 * @param service        the service
 * @param fromTier       tier left
 * @param toTier         tier entered
 * @param triggerEventId failure event that caused the move, or a marker for manual moves
 * @param timestamp      when the move happened (or was proposed)
 * @param qualityDelta   quality of {@code toTier} minus quality of {@code fromTier}
 * @param automatic      false for operator-chosen targets and restores
 */
public record TierTransition(
        String service,
        String fromTier,
        String toTier,
        String triggerEventId,
        Instant timestamp,
        int qualityDelta,
        boolean automatic
) {

    public static final String MANUAL_TRIGGER = "manual";
    public static final String RESTORE_TRIGGER = "restore-to-primary";

    static TierTransition between(String service, FallbackTier from, FallbackTier to, String triggerEventId,
                                  Instant timestamp, boolean automatic) {
        return new TierTransition(service, from.id(), to.id(), triggerEventId, timestamp,
                to.qualityPercent() - from.qualityPercent(), automatic);
    }
}
