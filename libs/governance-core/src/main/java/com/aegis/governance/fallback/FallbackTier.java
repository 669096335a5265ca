package com.aegis.governance.fallback;

/**
 * One rung in a service's fallback chain.
 *
 * @param id                tier id, unique within the chain (e.g. "primary", "replica-eu")
 * @param kind              tier kind
 * @param provider          what serves traffic at this tier (e.g. "postgres-primary", "redis")
 * @param qualityPercent    response quality relative to primary, 0-100
 * @param latencyMultiplier latency relative to primary
 * @param approvalGated     automatic failover out of this tier needs approval
 */
public record FallbackTier(
        String id,
        TierKind kind,
        String provider,
        int qualityPercent,
        double latencyMultiplier,
        boolean approvalGated
) {

    public FallbackTier {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id must not be null or blank");
        }
        if (kind == null) {
            throw new IllegalArgumentException("kind must not be null");
        }
        if (qualityPercent < 0 || qualityPercent > 100) {
            throw new IllegalArgumentException("qualityPercent must be between 0 and 100");
        }
        if (latencyMultiplier <= 0) {
            throw new IllegalArgumentException("latencyMultiplier must be positive");
        }
    }

    /** A tier using the kind's default quality, latency and approval settings. */
    public static FallbackTier of(String id, TierKind kind, String provider) {
        TierProfiles.TierProfile profile = TierProfiles.of(kind);
        return new FallbackTier(id, kind, provider, profile.qualityPercent(), profile.latencyMultiplier(),
                profile.approvalGated());
    }

    /** A tier with an explicit quality and the kind's other defaults. */
    public static FallbackTier of(String id, TierKind kind, String provider, int qualityPercent) {
        TierProfiles.TierProfile profile = TierProfiles.of(kind);
        return new FallbackTier(id, kind, provider, qualityPercent, profile.latencyMultiplier(),
                profile.approvalGated());
    }
}
