package com.aegis.governance.fallback;

/**
 * Result of {@link FallbackOrchestrator#triggerFallback} or
 * {@link FallbackOrchestrator#restoreToPrimary}.
 *
 * @param outcome    what happened
 * @param service    the service
 * @param fromTier   tier before the request (null if not configured)
 * @param toTier     tier after the request, or the proposed tier for APPROVAL_REQUIRED
 * @param transition the applied transition, or the proposed one for APPROVAL_REQUIRED; null otherwise
 * @param message    operator-facing explanation
 */
public record FallbackResult(
        FallbackOutcome outcome,
        String service,
        String fromTier,
        String toTier,
        TierTransition transition,
        String message
) {

    static FallbackResult moved(FallbackOutcome outcome, TierTransition transition, String message) {
        return new FallbackResult(outcome, transition.service(), transition.fromTier(), transition.toTier(),
                transition, message);
    }

    static FallbackResult approvalRequired(TierTransition proposed, String message) {
        return new FallbackResult(FallbackOutcome.APPROVAL_REQUIRED, proposed.service(), proposed.fromTier(),
                proposed.toTier(), proposed, message);
    }

    static FallbackResult unchanged(FallbackOutcome outcome, String service, String currentTier, String message) {
        return new FallbackResult(outcome, service, currentTier, currentTier, null, message);
    }

    static FallbackResult notConfigured(String service) {
        return new FallbackResult(FallbackOutcome.NOT_CONFIGURED, service, null, null, null,
                "Service '" + service + "' has no fallback configuration");
    }

    public boolean moved() {
        return outcome.moved();
    }
}
