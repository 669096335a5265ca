package com.aegis.governance.engine;

import com.aegis.events.Notification;
import com.aegis.governance.breaker.CircuitState;
import com.aegis.governance.degradation.DegradationLevel;
import com.aegis.governance.fallback.FallbackResult;
import com.aegis.governance.model.FailureEvent;
import com.aegis.governance.recovery.RecoveryPlan;

import java.util.List;

/**
 * Result of {@link GovernanceEngine#handleFailure}.
 *
 * @param outcome          what happened
 * @param dependencyId     the dependency the sample was for
 * @param service          owning service, null when not configured
 * @param failureEvent     classified failure, null unless HANDLED
 * @param circuitState     breaker state after the call, null if the dependency has no breaker
 * @param fallback         fallback result, null unless HANDLED
 * @param degradationLevel degradation level after the call
 * @param recoveryPlan     plan created for the failure, null unless HANDLED
 * @param abortedPlanIds   recovery plans aborted because of this failure
 * @param notifications    notifications sent
 * @param message          operator-facing summary
 */
public record FailureHandlingResult(
        FailureOutcome outcome,
        String dependencyId,
        String service,
        FailureEvent failureEvent,
        CircuitState circuitState,
        FallbackResult fallback,
        DegradationLevel degradationLevel,
        RecoveryPlan recoveryPlan,
        List<String> abortedPlanIds,
        List<Notification> notifications,
        String message
) {

    public FailureHandlingResult {
        abortedPlanIds = abortedPlanIds == null ? List.of() : List.copyOf(abortedPlanIds);
        notifications = notifications == null ? List.of() : List.copyOf(notifications);
    }
}
