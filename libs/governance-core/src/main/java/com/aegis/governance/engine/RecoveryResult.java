package com.aegis.governance.engine;

import com.aegis.governance.fallback.FallbackResult;
import com.aegis.governance.recovery.RecoveryPlan;
import com.aegis.governance.recovery.RestorationStep;
import com.aegis.governance.recovery.ValidationReport;

import java.util.List;

/**
 * Result of a recovery request.
 *
 * @param outcome         what happened
 * @param planId          plan the request was about
 * @param activePlan      plan tracking the incident after the call (a fresh one after a rollback)
 * @param report          validation report, null if validation did not run
 * @param fallback        restore or rollback result, null if the tier was not touched
 * @param restorationPlan ramp to drive, empty unless RECOVERING
 * @param recommendation  operator-facing next step
 */
public record RecoveryResult(
        RecoveryOutcome outcome,
        String planId,
        RecoveryPlan activePlan,
        ValidationReport report,
        FallbackResult fallback,
        List<RestorationStep> restorationPlan,
        String recommendation
) {

    public RecoveryResult {
        restorationPlan = restorationPlan == null ? List.of() : List.copyOf(restorationPlan);
    }

    static RecoveryResult refused(RecoveryOutcome outcome, String planId, RecoveryPlan plan, String recommendation) {
        return new RecoveryResult(outcome, planId, plan, null, null, List.of(), recommendation);
    }
}
