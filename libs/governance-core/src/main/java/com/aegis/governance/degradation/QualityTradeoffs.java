package com.aegis.governance.degradation;

import java.util.Map;

/**
 * What the active degradation level costs.
 *
 * @param level               active level
 * @param featureAvailability availability of every known feature
 * @param slaImpact           SLA impact description
 * @param notifyUsers         whether users should be informed
 */
public record QualityTradeoffs(
        DegradationLevel level,
        Map<String, Boolean> featureAvailability,
        String slaImpact,
        boolean notifyUsers
) {

    public QualityTradeoffs {
        featureAvailability = Map.copyOf(featureAvailability);
    }
}
