package com.aegis.governance.fallback;

import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Fallback chain and policy of one service. Tier 0 is primary; quality strictly decreases along
 * the chain.
 *
 * @param service           governed service
 * @param tiers             ordered tiers
 * @param autoFailover      whether failures move the service down the chain automatically
 * @param autoRecovery      whether a passed recovery validation restores primary automatically
 * @param failureThreshold  failure events needed before an automatic step
 * @param recoveryThreshold consecutive passing health checks required to validate recovery
 */
public record FallbackConfig(
        String service,
        List<FallbackTier> tiers,
        boolean autoFailover,
        boolean autoRecovery,
        int failureThreshold,
        int recoveryThreshold
) {

    public static final int DEFAULT_FAILURE_THRESHOLD = 1;
    public static final int DEFAULT_RECOVERY_THRESHOLD = 3;

    public FallbackConfig {
        if (service == null || service.isBlank()) {
            throw new IllegalArgumentException("service must not be null or blank");
        }
        if (tiers == null || tiers.isEmpty()) {
            throw new IllegalArgumentException("tiers must not be null or empty");
        }
        if (failureThreshold < 1) {
            throw new IllegalArgumentException("failureThreshold must be >= 1");
        }
        if (recoveryThreshold < 1) {
            throw new IllegalArgumentException("recoveryThreshold must be >= 1");
        }
        tiers = List.copyOf(tiers);
        Set<String> ids = new HashSet<>();
        for (int i = 0; i < tiers.size(); i++) {
            FallbackTier tier = tiers.get(i);
            if (!ids.add(tier.id())) {
                throw new IllegalArgumentException("duplicate tier id '" + tier.id() + "' in " + service);
            }
            if (i > 0 && tier.qualityPercent() >= tiers.get(i - 1).qualityPercent()) {
                throw new IllegalArgumentException("tier '" + tier.id() + "' must have lower quality than '"
                        + tiers.get(i - 1).id() + "'");
            }
        }
    }

    /** Automatic failover and recovery with default thresholds. */
    public static FallbackConfig of(String service, List<FallbackTier> tiers) {
        return new FallbackConfig(service, tiers, true, true, DEFAULT_FAILURE_THRESHOLD, DEFAULT_RECOVERY_THRESHOLD);
    }

    public FallbackTier primary() {
        return tiers.get(0);
    }

    public int indexOf(String tierId) {
        for (int i = 0; i < tiers.size(); i++) {
            if (tiers.get(i).id().equals(tierId)) {
                return i;
            }
        }
        return -1;
    }

    public Optional<FallbackTier> tier(String tierId) {
        int index = indexOf(tierId);
        return index < 0 ? Optional.empty() : Optional.of(tiers.get(index));
    }
}
