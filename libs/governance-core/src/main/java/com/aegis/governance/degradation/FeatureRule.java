package com.aegis.governance.degradation;

import java.util.HashSet;
import java.util.Set;

/**
 * Features kept, reduced and switched off at one degradation level.
 *
 * @param preserved   features served normally
 * @param reduced     features served in a reduced form
 * @param disabled    features switched off
 * @param slaImpact   operator-facing description of the SLA impact
 * @param notifyUsers whether users should be told when this level is entered
 */
public record FeatureRule(
        Set<String> preserved,
        Set<String> reduced,
        Set<String> disabled,
        String slaImpact,
        boolean notifyUsers
) {

    public FeatureRule {
        preserved = preserved == null ? Set.of() : Set.copyOf(preserved);
        reduced = reduced == null ? Set.of() : Set.copyOf(reduced);
        disabled = disabled == null ? Set.of() : Set.copyOf(disabled);
        Set<String> seen = new HashSet<>(preserved);
        for (String feature : reduced) {
            if (!seen.add(feature)) {
                throw new IllegalArgumentException("feature '" + feature + "' listed twice");
            }
        }
        for (String feature : disabled) {
            if (!seen.add(feature)) {
                throw new IllegalArgumentException("feature '" + feature + "' listed twice");
            }
        }
    }
}
