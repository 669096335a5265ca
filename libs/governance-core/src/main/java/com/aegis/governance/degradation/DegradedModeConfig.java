package com.aegis.governance.degradation;

import java.time.Instant;
import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * The active degraded mode. Never mutated; every change produces a new instance.
 *
 * @param level        degradation level
 * @param preserved    features served normally at this level
 * @param reduced      features served in reduced form
 * @param disabled     features switched off
 * @param featureFlags resolved flag of every known feature
 * @param reason       why the mode was entered
 * @param activatedAt  when the mode was entered
 */
public record DegradedModeConfig(
        DegradationLevel level,
        Set<String> preserved,
        Set<String> reduced,
        Set<String> disabled,
        Map<String, FeatureFlag> featureFlags,
        String reason,
        Instant activatedAt
) {

    public DegradedModeConfig {
        preserved = Set.copyOf(preserved);
        reduced = Set.copyOf(reduced);
        disabled = Set.copyOf(disabled);
        featureFlags = Collections.unmodifiableMap(new TreeMap<>(featureFlags));
    }

    /** Flag of the feature; features nobody configured are ENABLED. */
    public FeatureFlag flag(String feature) {
        return featureFlags.getOrDefault(feature, FeatureFlag.ENABLED);
    }
}
