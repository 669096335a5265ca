package com.aegis.governance.engine;

import com.aegis.governance.detection.DetectionThresholds;
import com.aegis.governance.degradation.DegradationLevel;
import com.aegis.governance.degradation.DegradationPolicy;
import com.aegis.governance.recovery.ValidationThresholds;
import com.aegis.governance.support.BoundedLog;

/**
 * Tunables of a {@link GovernanceEngine}.
 *
 * @param detection          failure classification thresholds
 * @param validation         recovery validation thresholds
 * @param degradationPolicy  feature rules per degradation level
 * @param criticalFloor      lowest degradation level forced by a CRITICAL failure
 * @param planOwner          owner assigned to new recovery plans
 * @param historyRetention   entries kept in each in-memory log (audit, notifications, failures,
 *                           transitions, validation reports, finished plans)
 */
public record GovernanceSettings(
        DetectionThresholds detection,
        ValidationThresholds validation,
        DegradationPolicy degradationPolicy,
        DegradationLevel criticalFloor,
        String planOwner,
        int historyRetention
) {

    public GovernanceSettings {
        if (detection == null) {
            detection = DetectionThresholds.defaults();
        }
        if (validation == null) {
            validation = ValidationThresholds.defaults();
        }
        if (degradationPolicy == null) {
            degradationPolicy = DegradationPolicy.defaults();
        }
        if (criticalFloor == null) {
            criticalFloor = DegradationLevel.DEGRADED_L2;
        }
        if (planOwner == null || planOwner.isBlank()) {
            planOwner = "oncall";
        }
        if (historyRetention <= 0) {
            historyRetention = BoundedLog.DEFAULT_CAPACITY;
        }
    }

    public static GovernanceSettings defaults() {
        return new GovernanceSettings(null, null, null, null, null, 0);
    }
}
