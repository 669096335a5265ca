package com.aegis.governance.degradation;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Feature rules for every {@link DegradationLevel}.
 */
public final class DegradationPolicy {

    public static final String CORE_API = "core_api";
    public static final String AUTHENTICATION = "authentication";
    public static final String SEARCH = "search";
    public static final String NOTIFICATIONS = "notifications";
    public static final String RECOMMENDATIONS = "recommendations";
    public static final String ANALYTICS = "analytics";
    public static final String PERSONALIZATION = "personalization";
    public static final String REPORTING = "reporting";
    public static final String EXPORTS = "exports";
    public static final String REALTIME_UPDATES = "realtime_updates";

    private final Map<DegradationLevel, FeatureRule> rules;

    /**
     * @param rules one rule per level; every level must be present
     */
    public DegradationPolicy(Map<DegradationLevel, FeatureRule> rules) {
        if (rules == null) {
            throw new IllegalArgumentException("rules must not be null");
        }
        for (DegradationLevel level : DegradationLevel.values()) {
            if (!rules.containsKey(level)) {
                throw new IllegalArgumentException("no rule for level " + level);
            }
        }
        this.rules = Collections.unmodifiableMap(new EnumMap<>(rules));
    }

    public FeatureRule rule(DegradationLevel level) {
        return rules.get(level);
    }

    /** Every feature named by any rule, sorted. */
    public Set<String> features() {
        Set<String> all = new TreeSet<>();
        rules.values().forEach(rule -> {
            all.addAll(rule.preserved());
            all.addAll(rule.reduced());
            all.addAll(rule.disabled());
        });
        return all;
    }

    public static DegradationPolicy defaults() {
        Map<DegradationLevel, FeatureRule> rules = new EnumMap<>(DegradationLevel.class);
        rules.put(DegradationLevel.NORMAL, new FeatureRule(
                Set.of(CORE_API, AUTHENTICATION, SEARCH, NOTIFICATIONS, RECOMMENDATIONS, ANALYTICS,
                        PERSONALIZATION, REPORTING, EXPORTS, REALTIME_UPDATES),
                Set.of(), Set.of(), "No impact", false));
        rules.put(DegradationLevel.DEGRADED_L1, new FeatureRule(
                Set.of(CORE_API, AUTHENTICATION, SEARCH, NOTIFICATIONS, PERSONALIZATION, REPORTING, EXPORTS,
                        REALTIME_UPDATES),
                Set.of(RECOMMENDATIONS, ANALYTICS), Set.of(),
                "Minor: non-essential features slower or less accurate", false));
        rules.put(DegradationLevel.DEGRADED_L2, new FeatureRule(
                Set.of(CORE_API, AUTHENTICATION, REPORTING),
                Set.of(SEARCH, NOTIFICATIONS, REALTIME_UPDATES),
                Set.of(RECOMMENDATIONS, ANALYTICS, PERSONALIZATION, EXPORTS),
                "Moderate: secondary features reduced, enrichment disabled", true));
        rules.put(DegradationLevel.DEGRADED_L3, new FeatureRule(
                Set.of(CORE_API, AUTHENTICATION),
                Set.of(SEARCH),
                Set.of(NOTIFICATIONS, RECOMMENDATIONS, ANALYTICS, PERSONALIZATION, REPORTING, EXPORTS,
                        REALTIME_UPDATES),
                "Severe: only core flows and basic search", true));
        rules.put(DegradationLevel.EMERGENCY, new FeatureRule(
                Set.of(AUTHENTICATION),
                Set.of(CORE_API),
                Set.of(SEARCH, NOTIFICATIONS, RECOMMENDATIONS, ANALYTICS, PERSONALIZATION, REPORTING, EXPORTS,
                        REALTIME_UPDATES),
                "Critical: core flows at reduced capacity", true));
        rules.put(DegradationLevel.OFFLINE, new FeatureRule(
                Set.of(), Set.of(),
                Set.of(CORE_API, AUTHENTICATION, SEARCH, NOTIFICATIONS, RECOMMENDATIONS, ANALYTICS,
                        PERSONALIZATION, REPORTING, EXPORTS, REALTIME_UPDATES),
                "Outage: service unavailable", true));
        return new DegradationPolicy(rules);
    }
}
