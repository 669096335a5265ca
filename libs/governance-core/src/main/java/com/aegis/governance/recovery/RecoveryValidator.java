package com.aegis.governance.recovery;

import com.aegis.governance.model.FailureEvent;
import com.aegis.governance.model.FailureKind;
import com.aegis.governance.model.FailureProfiles;
import com.aegis.governance.support.BoundedLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Creates recovery plans, validates recovered dependencies and supplies the restoration ramp.
 * <p>
 * This component does not split traffic itself; callers drive the ramp and ask
 * {@link #shouldRollback(double)} at every step.
 * <p>
 * Active plans are kept until they finish. Of the finished (completed or aborted) plans only the
 * most recently updated {@code retention} are kept, pruned whenever a new plan is created.
 */
public final class RecoveryValidator {

    private static final Logger log = LoggerFactory.getLogger(RecoveryValidator.class);

    private static final List<RestorationStep> RESTORATION_PLAN = List.of(
            new RestorationStep(1, 10, Duration.ofMinutes(5)),
            new RestorationStep(2, 25, Duration.ofMinutes(10)),
            new RestorationStep(3, 50, Duration.ofMinutes(15)),
            new RestorationStep(4, 100, Duration.ofMinutes(30)));

    private final ValidationThresholds thresholds;
    private final Clock clock;
    private final int retention;
    private final Map<String, RecoveryPlan> plans = new ConcurrentHashMap<>();
    private final BoundedLog<ValidationReport> validationLog;

    public RecoveryValidator(ValidationThresholds thresholds, Clock clock) {
        this(thresholds, clock, BoundedLog.DEFAULT_CAPACITY);
    }

    /**
     * @param retention finished plans and validation reports kept for lookup
     */
    public RecoveryValidator(ValidationThresholds thresholds, Clock clock, int retention) {
        if (thresholds == null) {
            throw new IllegalArgumentException("thresholds must not be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock must not be null");
        }
        this.thresholds = thresholds;
        this.clock = clock;
        this.retention = retention;
        this.validationLog = new BoundedLog<>(retention);
    }

    /** Creates an ACTIVE plan in the DETECTION phase with steps derived from the failure kind. */
    public RecoveryPlan createRecoveryPlan(FailureEvent event, String owner) {
        if (event == null) {
            throw new IllegalArgumentException("event must not be null");
        }
        if (owner == null || owner.isBlank()) {
            throw new IllegalArgumentException("owner must not be null or blank");
        }
        RecoveryPlan plan = new RecoveryPlan(UUID.randomUUID().toString(), event, owner, stepsFor(event), clock);
        plans.put(plan.id(), plan);
        pruneFinishedPlans();
        log.info("Created recovery plan {} for {} on {} (owner {})", plan.id(), event.kind(), event.dependencyId(), owner);
        return plan;
    }

    /** Runs the battery against the configured thresholds. */
    public ValidationReport runValidationChecks(String dependencyId, RecoveryMetrics metrics) {
        return runValidationChecks(dependencyId, metrics, thresholds);
    }

    /**
     * Runs the battery. Every report is kept in the validation log whatever its outcome.
     */
    public ValidationReport runValidationChecks(String dependencyId, RecoveryMetrics metrics,
                                                ValidationThresholds criteria) {
        if (metrics == null) {
            throw new IllegalArgumentException("metrics must not be null");
        }
        List<ValidationCheck> checks = new ArrayList<>(4);
        checks.add(ValidationCheck.atLeast(ValidationCheck.HEALTH_PASSES,
                metrics.consecutiveHealthPasses(), criteria.minHealthPasses()));
        checks.add(ValidationCheck.atMost(ValidationCheck.LATENCY_P99, metrics.latencyP99Ms(), criteria.maxLatencyP99Ms()));
        checks.add(ValidationCheck.atMost(ValidationCheck.ERROR_RATE, metrics.errorRate(), criteria.maxErrorRate()));
        checks.add(ValidationCheck.atLeast(ValidationCheck.THROUGHPUT, metrics.throughputRps(), criteria.minThroughputRps()));

        boolean allPassed = checks.stream().allMatch(ValidationCheck::passed);
        ValidationReport report = new ValidationReport(dependencyId, checks, allPassed, clock.instant());
        validationLog.append(report);
        if (allPassed) {
            log.info("Recovery validation for {} passed", dependencyId);
        } else {
            log.warn("Recovery validation for {} failed: {}", dependencyId,
                    report.failedChecks().stream().map(ValidationCheck::describe).toList());
        }
        return report;
    }

    /** Traffic ramp: 10%, 25%, 50%, 100%. */
    public List<RestorationStep> getRestorationPlan() {
        return RESTORATION_PLAN;
    }

    /** True if the observed error rate calls for rolling the ramp back, whatever step it is on. */
    public boolean shouldRollback(double errorRate) {
        return errorRate > thresholds.rollbackErrorRate();
    }

    public Optional<RecoveryPlan> getPlan(String planId) {
        return planId == null ? Optional.empty() : Optional.ofNullable(plans.get(planId));
    }

    /** Most recently created active plan for the dependency. */
    public Optional<RecoveryPlan> activePlan(String dependencyId) {
        return plans.values().stream()
                .filter(plan -> plan.isActive() && plan.dependencyId().equals(dependencyId))
                .max(Comparator.comparing(RecoveryPlan::createdAt));
    }

    /**
     * Aborts every active plan of the dependency.
     *
     * @return the plans that were aborted by this call
     */
    public List<RecoveryPlan> abortActivePlans(String dependencyId, String reason) {
        List<RecoveryPlan> aborted = new ArrayList<>();
        for (RecoveryPlan plan : plans.values()) {
            if (plan.dependencyId().equals(dependencyId) && plan.abort(reason)) {
                log.warn("Aborted recovery plan {} for {} in phase {}: {}", plan.id(), dependencyId, plan.phase(), reason);
                aborted.add(plan);
            }
        }
        return aborted;
    }

    public List<RecoveryPlan> activePlans() {
        return plans.values().stream().filter(RecoveryPlan::isActive).toList();
    }

    public List<ValidationReport> validationLog() {
        return validationLog.snapshot();
    }

    public ValidationThresholds thresholds() {
        return thresholds;
    }

    /** Number of plans held, active and finished. */
    public int retainedPlanCount() {
        return plans.size();
    }

    private void pruneFinishedPlans() {
        List<RecoveryPlan> finished = plans.values().stream()
                .filter(plan -> !plan.isActive())
                .sorted(Comparator.comparing(RecoveryPlan::updatedAt))
                .toList();
        int excess = finished.size() - retention;
        for (int i = 0; i < excess; i++) {
            plans.remove(finished.get(i).id());
        }
    }

    private static List<RecoveryStep> stepsFor(FailureEvent event) {
        String dep = event.dependencyId();
        boolean manual = event.requiresManualIntervention();
        return List.of(
                new RecoveryStep("confirm", RecoveryPhase.DETECTION, "Confirm " + event.kind() + " on " + dep, true),
                new RecoveryStep("isolate", RecoveryPhase.ISOLATION, "Open the circuit breaker for " + dep, true),
                new RecoveryStep("fallback", RecoveryPhase.FALLBACK_ACTIVE, "Serve traffic from the fallback tier", true),
                new RecoveryStep("diagnose", RecoveryPhase.DIAGNOSIS,
                        "Diagnose: " + FailureProfiles.of(event.kind()).description(), false),
                new RecoveryStep("remediate", RecoveryPhase.REMEDIATION, remediation(event.kind(), dep), !manual),
                new RecoveryStep("validate", RecoveryPhase.VALIDATION, "Run recovery validation checks", true),
                new RecoveryStep("ramp", RecoveryPhase.GRADUAL_RESTORE, "Ramp traffic back through the restoration plan", true),
                new RecoveryStep("restore", RecoveryPhase.FULL_RESTORE, "Serve all traffic from primary", true),
                new RecoveryStep("post-mortem", RecoveryPhase.POST_MORTEM, "Write the post-mortem for " + event.id(), false));
    }

    private static String remediation(FailureKind kind, String dep) {
        return switch (kind) {
            case HIGH_LATENCY -> "Scale out or shed load on " + dep;
            case ERROR_SPIKE -> "Roll back recent changes to " + dep;
            case CAPACITY_EXCEEDED -> "Add capacity to " + dep;
            case DEPENDENCY_DOWN -> "Restart or replace " + dep;
            case TIMEOUT -> "Tune timeouts and connection pools for " + dep;
            case RATE_LIMITED -> "Reduce request rate to " + dep + " or raise its quota";
            case NETWORK_PARTITION -> "Restore the network path to " + dep;
            case DATA_CORRUPTION -> "Restore " + dep + " from the last verified backup";
            case CONFIG_ERROR -> "Revert the configuration of " + dep;
        };
    }
}
