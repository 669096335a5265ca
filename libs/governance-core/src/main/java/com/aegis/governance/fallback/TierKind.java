package com.aegis.governance.fallback;

/**
 * Kind of a fallback tier. Default quality, latency and approval settings per kind live in
 * {@link TierProfiles}.
 */
public enum TierKind {
    PRIMARY,
    SECONDARY,
    CACHE,
    DEGRADED,
    STATIC_FALLBACK
}
