package com.aegis.governance.engine;

import com.aegis.events.Audience;
import com.aegis.events.AuditAction;
import com.aegis.events.AuditEntry;
import com.aegis.events.DetailRedactor;
import com.aegis.events.Notification;
import com.aegis.events.Severity;
import com.aegis.governance.breaker.CircuitBreaker;
import com.aegis.governance.breaker.CircuitBreakerRegistry;
import com.aegis.governance.breaker.CircuitState;
import com.aegis.governance.degradation.DegradationController;
import com.aegis.governance.degradation.DegradationLevel;
import com.aegis.governance.degradation.DegradedModeConfig;
import com.aegis.governance.detection.FailureDetector;
import com.aegis.governance.detection.HealthProbe;
import com.aegis.governance.fallback.FallbackConfig;
import com.aegis.governance.fallback.FallbackOrchestrator;
import com.aegis.governance.fallback.FallbackOutcome;
import com.aegis.governance.fallback.FallbackResult;
import com.aegis.governance.fallback.FallbackTier;
import com.aegis.governance.fallback.TierTransition;
import com.aegis.governance.model.Dependency;
import com.aegis.governance.model.EscalationType;
import com.aegis.governance.model.FailureEvent;
import com.aegis.governance.model.FailureKind;
import com.aegis.governance.model.HealthCheck;
import com.aegis.governance.model.MetricsSnapshot;
import com.aegis.governance.recovery.RecoveryMetrics;
import com.aegis.governance.recovery.RecoveryPhase;
import com.aegis.governance.recovery.RecoveryPlan;
import com.aegis.governance.recovery.RecoveryValidator;
import com.aegis.governance.recovery.RestorationStep;
import com.aegis.governance.recovery.ValidationCheck;
import com.aegis.governance.recovery.ValidationReport;
import com.aegis.governance.recovery.ValidationThresholds;
import com.aegis.governance.spi.AuditSink;
import com.aegis.governance.spi.NotificationSink;
import com.aegis.observability.IncidentContext;
import com.aegis.observability.IncidentContextHolder;
import com.aegis.observability.MetricFactory;
import com.aegis.observability.SpanHelper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Coordinates detection, circuit breaking, fallback, degradation and recovery for every governed
 * service.
 * <p>
 * Owns the dependency registry and the dependency-to-service ownership map, and hands them to the
 * sub-components it builds. Operations on one service are serialized by a per-service lock; each
 * operation runs with an {@link IncidentContext} in MDC and inside a tracing span. Every decision,
 * block and refusal is written to the audit trail.
 */
public final class GovernanceEngine {

    private static final Logger log = LoggerFactory.getLogger(GovernanceEngine.class);

    private final GovernanceSettings settings;
    private final Clock clock;
    private final SpanHelper spans;
    private final GovernorMetrics metrics;
    private final AuditTrail audit;
    private final Notifier notifier;

    private final Map<String, Dependency> dependencies = new ConcurrentHashMap<>();
    private final Map<String, String> owners = new ConcurrentHashMap<>();
    private final Map<String, ReentrantLock> serviceLocks = new ConcurrentHashMap<>();

    private final FailureDetector detector;
    private final CircuitBreakerRegistry breakers;
    private final FallbackOrchestrator orchestrator;
    private final DegradationController degradation;
    private final RecoveryValidator validator;

    public GovernanceEngine(GovernanceSettings settings, AuditSink auditSink, NotificationSink notificationSink,
                            MetricFactory metricFactory, SpanHelper spans, Clock clock) {
        if (auditSink == null || notificationSink == null) {
            throw new IllegalArgumentException("audit and notification sinks must not be null");
        }
        if (metricFactory == null || spans == null || clock == null) {
            throw new IllegalArgumentException("metricFactory, spans and clock must not be null");
        }
        this.settings = settings == null ? GovernanceSettings.defaults() : settings;
        this.clock = clock;
        this.spans = spans;
        this.metrics = new GovernorMetrics(metricFactory);
        int retention = this.settings.historyRetention();
        this.audit = new AuditTrail(auditSink, new DetailRedactor(), metrics, clock, retention);
        this.notifier = new Notifier(notificationSink, clock, retention);

        this.detector = new FailureDetector(dependencies, this.settings.detection(), clock, retention);
        this.breakers = new CircuitBreakerRegistry(clock, this::onCircuitStateChange);
        this.orchestrator = new FallbackOrchestrator(clock, retention);
        this.degradation = new DegradationController(this.settings.degradationPolicy(), clock);
        this.validator = new RecoveryValidator(this.settings.validation(), clock, retention);
    }

    // ---- setup ----

    /**
     * Registers the service's dependencies, probes, circuit breakers and fallback chain. Calling it
     * again for the same service replaces the chain and keeps the current tier where possible.
     *
     * @throws IllegalArgumentException if a dependency is already owned by another service
     */
    public SetupResult setupService(ServiceDefinition definition) {
        if (definition == null) {
            throw new IllegalArgumentException("definition must not be null");
        }
        String service = definition.service();
        for (Dependency dependency : definition.dependencies()) {
            String owner = owners.get(dependency.id());
            if (owner != null && !owner.equals(service)) {
                throw new IllegalArgumentException("dependency " + dependency.id() + " already belongs to " + owner);
            }
        }
        IncidentContext context = new IncidentContext(newCorrelationId(), service, null, null);
        return withContext(context, "governor.setupService", () -> locked(service, () -> {
            List<String> dependencyIds = new ArrayList<>();
            List<String> breakerIds = new ArrayList<>();
            for (Dependency dependency : definition.dependencies()) {
                HealthProbe probe = definition.probes().get(dependency.id());
                if (probe != null) {
                    detector.registerDependency(dependency, probe);
                } else {
                    detector.registerDependency(dependency);
                }
                owners.put(dependency.id(), service);
                dependencyIds.add(dependency.id());
                if (dependency.circuitBreakerEnabled()) {
                    breakers.register(dependency.id(), definition.breakerConfig());
                    breakerIds.add(dependency.id());
                }
            }
            orchestrator.configure(definition.fallback());
            List<String> tierIds = definition.fallback().tiers().stream().map(FallbackTier::id).toList();

            audit.record(AuditAction.SERVICE_SETUP, service, details(
                    "dependencies", String.join(",", dependencyIds),
                    "breakers", String.join(",", breakerIds),
                    "tiers", String.join(",", tierIds)));
            log.info("Governing {}: dependencies {}, breakers {}, tiers {}", service, dependencyIds, breakerIds, tierIds);
            return new SetupResult(service, dependencyIds, breakerIds, tierIds);
        }));
    }

    // ---- health ----

    /** Probes the dependency and records the result; unknown dependencies yield an UNKNOWN check. */
    public HealthCheck checkHealth(String dependencyId) {
        IncidentContext context = new IncidentContext(newCorrelationId(), owners.get(dependencyId), dependencyId, null);
        return withContext(context, "governor.checkHealth", () -> {
            HealthCheck check = detector.checkHealth(dependencyId);
            if (detector.isRegistered(dependencyId)) {
                audit.record(AuditAction.HEALTH_CHECK_RECORDED, dependencyId, details(
                        "status", check.status().name(),
                        "latencyMs", String.valueOf(check.latencyMs()),
                        "error", check.error()));
            }
            return check;
        });
    }

    // ---- failures ----

    /**
     * Classifies a metrics sample and, if it is a failure, runs the governance chain: aborts the
     * dependency's active recovery plan, records a breaker failure, asks the orchestrator for a
     * fallback, escalates degradation for CRITICAL failures, notifies and opens a recovery plan.
     * A sample within thresholds counts as a breaker success.
     */
    public FailureHandlingResult handleFailure(String dependencyId, double errorRate, long latencyMs, long queueDepth) {
        String service = dependencyId == null ? null : owners.get(dependencyId);
        if (service == null || !detector.isRegistered(dependencyId)) {
            return notConfigured(dependencyId);
        }
        IncidentContext context = new IncidentContext(newCorrelationId(), service, dependencyId, null);
        return withContext(context, "governor.handleFailure", () -> locked(service, () -> {
            Optional<FailureEvent> detected = detector.detectFailure(dependencyId, errorRate, latencyMs, queueDepth);
            if (detected.isEmpty()) {
                CircuitState state = breakers.get(dependencyId).map(GovernanceEngine::admitSuccess).orElse(null);
                return new FailureHandlingResult(FailureOutcome.NO_FAILURE_DETECTED, dependencyId, service, null,
                        state, null, degradation.currentLevel(), null, List.of(), List.of(),
                        "No failure detected for " + dependencyId);
            }
            return govern(service, context, detected.get());
        }));
    }

    /**
     * Runs the governance chain for a failure classified outside the detector, such as
     * DATA_CORRUPTION reported by an integrity job. The kind's default severity applies when
     * {@code severity} is null.
     */
    public FailureHandlingResult reportFailure(String dependencyId, FailureKind kind, Severity severity,
                                               MetricsSnapshot snapshot) {
        return reportFailure(dependencyId, kind, severity, null, snapshot);
    }

    /**
     * Runs the governance chain for an externally reported failure escalated under an explicit
     * category. LEGAL_THREAT, SAFETY_CONCERN and DATA_CORRUPTION escalations require a named
     * approver before the resulting plan can restore the service.
     */
    public FailureHandlingResult reportFailure(String dependencyId, FailureKind kind, Severity severity,
                                               EscalationType escalation, MetricsSnapshot snapshot) {
        if (kind == null) {
            throw new IllegalArgumentException("kind must not be null");
        }
        String service = dependencyId == null ? null : owners.get(dependencyId);
        if (service == null || !detector.isRegistered(dependencyId)) {
            return notConfigured(dependencyId);
        }
        IncidentContext context = new IncidentContext(newCorrelationId(), service, dependencyId, null);
        return withContext(context, "governor.reportFailure", () -> locked(service, () -> {
            FailureEvent event = detector.recordFailure(dependencyId, kind, severity, escalation, snapshot)
                    .orElseThrow(() -> new IllegalStateException(dependencyId + " was unregistered concurrently"));
            return govern(service, context, event);
        }));
    }

    private FailureHandlingResult govern(String service, IncidentContext context, FailureEvent event) {
        return IncidentContextHolder.callWithContext(context.withFailureEvent(event.id()), () -> {
            String dependencyId = event.dependencyId();
            metrics.failureDetected(event);
            spans.event("failure.detected");
            audit.record(AuditAction.FAILURE_DETECTED, dependencyId, details(
                    "eventId", event.id(),
                    "kind", event.kind().name(),
                    "severity", event.severity().name(),
                    "errorRate", String.valueOf(event.metrics().errorRate()),
                    "latencyMs", String.valueOf(event.metrics().latencyMs()),
                    "queueDepth", String.valueOf(event.metrics().queueDepth()),
                    "escalation", event.escalation().name(),
                    "manualIntervention", String.valueOf(event.requiresManualIntervention())));

            List<String> abortedPlanIds = new ArrayList<>();
            boolean restoreInterrupted = false;
            for (RecoveryPlan aborted : validator.abortActivePlans(dependencyId, "superseded by failure " + event.id())) {
                abortedPlanIds.add(aborted.id());
                restoreInterrupted |= aborted.phase().compareTo(RecoveryPhase.GRADUAL_RESTORE) >= 0;
                audit.record(AuditAction.RECOVERY_ABORTED, dependencyId, details(
                        "planId", aborted.id(),
                        "phase", aborted.phase().name(),
                        "reason", aborted.abortReason()));
            }

            CircuitState circuitState = breakers.get(dependencyId).map(CircuitBreaker::recordFailure).orElse(null);

            // an interrupted restore goes straight back to the tier it left, bypassing automatic holds
            String target = restoreInterrupted ? restoredFromTier(service) : null;
            FallbackResult fallback = orchestrator.triggerFallback(service, event, target);
            recordFallback(fallback);

            DegradationLevel before = degradation.currentLevel();
            if (event.severity() == Severity.CRITICAL) {
                DegradedModeConfig mode = degradation.escalateTo(settings.criticalFloor(),
                        "critical " + event.kind() + " on " + dependencyId);
                recordDegradation(before, mode.level(), mode.reason());
            }
            DegradationLevel level = degradation.currentLevel();

            RecoveryPlan plan = validator.createRecoveryPlan(event, settings.planOwner());
            plan.advanceTo(orchestrator.activeFallbacks().contains(service)
                    ? RecoveryPhase.FALLBACK_ACTIVE
                    : RecoveryPhase.ISOLATION);
            audit.record(AuditAction.RECOVERY_PLAN_CREATED, dependencyId, details(
                    "planId", plan.id(),
                    "eventId", event.id(),
                    "owner", plan.owner(),
                    "phase", plan.phase().name()));

            List<Notification> notifications = notifyFailure(service, event, fallback, before, level);

            String message = event.kind() + " (" + event.severity() + ") on " + dependencyId + ": " + fallback.message();
            audit.record(AuditAction.FAILURE_HANDLED, dependencyId, details(
                    "eventId", event.id(),
                    "fallbackOutcome", fallback.outcome().name(),
                    "tier", fallback.toTier(),
                    "circuitState", circuitState == null ? null : circuitState.name(),
                    "degradationLevel", level.name(),
                    "planId", plan.id()));
            log.warn("Handled {}", message);
            return new FailureHandlingResult(FailureOutcome.HANDLED, dependencyId, service, event, circuitState,
                    fallback, level, plan, abortedPlanIds, notifications, message);
        });
    }

    private List<Notification> notifyFailure(String service, FailureEvent event, FallbackResult fallback,
                                             DegradationLevel before, DegradationLevel after) {
        List<Notification> sent = new ArrayList<>();
        String summary = event.kind() + " on " + event.dependencyId() + " (" + service + "): " + fallback.message();
        sent.add(notify(Audience.ONCALL, summary, event.severity()));
        if (event.severity() == Severity.CRITICAL) {
            sent.add(notify(Audience.LEADERSHIP, "Critical incident on " + service + ": " + event.kind(),
                    event.severity()));
        }
        if (fallback.outcome() == FallbackOutcome.APPROVAL_REQUIRED
                || fallback.outcome() == FallbackOutcome.ALREADY_AT_LOWEST_TIER) {
            sent.add(notify(Audience.INTERNAL, fallback.message(), event.severity()));
        }
        if (after != before && degradation.getQualityTradeoffs().notifyUsers()) {
            sent.add(notify(Audience.USERS, "Some features are temporarily limited while we resolve an issue",
                    event.severity()));
        }
        return sent;
    }

    // ---- recovery ----

    /** Validates recovery of the plan's dependency without an approver. */
    public RecoveryResult initiateRecovery(String planId, RecoveryMetrics recoveryMetrics) {
        return initiateRecovery(planId, recoveryMetrics, null);
    }

    /**
     * Validates that the plan's dependency has recovered and, if it has, restores its service to
     * primary and returns the traffic ramp.
     *
     * @param planId          the recovery plan
     * @param recoveryMetrics observed health of the dependency
     * @param approvedBy      person approving the restore; required for failures that need manual
     *                        intervention and for services without automatic recovery
     */
    public RecoveryResult initiateRecovery(String planId, RecoveryMetrics recoveryMetrics, String approvedBy) {
        if (recoveryMetrics == null) {
            throw new IllegalArgumentException("recoveryMetrics must not be null");
        }
        Optional<RecoveryPlan> found = validator.getPlan(planId);
        if (found.isEmpty()) {
            return RecoveryResult.refused(RecoveryOutcome.PLAN_NOT_FOUND, planId, null, "No recovery plan " + planId);
        }
        RecoveryPlan plan = found.get();
        String service = owners.get(plan.dependencyId());
        IncidentContext context = new IncidentContext(newCorrelationId(), service, plan.dependencyId(),
                plan.failureEvent().id());
        return withContext(context, "governor.initiateRecovery", () -> locked(service, () -> {
            boolean approved = approvedBy != null && !approvedBy.isBlank();
            if (!plan.isActive()) {
                return refuse(RecoveryOutcome.PLAN_NOT_ACTIVE, plan, "Plan is " + plan.status());
            }
            if (plan.phase().compareTo(RecoveryPhase.GRADUAL_RESTORE) >= 0) {
                return refuse(RecoveryOutcome.RESTORE_IN_PROGRESS, plan,
                        "Restoration already in progress; report ramp progress instead");
            }
            if (plan.failureEvent().requiresManualIntervention() && !approved) {
                return refuse(RecoveryOutcome.MANUAL_INTERVENTION_REQUIRED, plan,
                        plan.failureEvent().kind() + " must be signed off by a named approver");
            }

            plan.advanceTo(RecoveryPhase.VALIDATION);
            FallbackConfig config = orchestrator.config(service).orElse(null);
            ValidationThresholds criteria = config == null
                    ? validator.thresholds()
                    : validator.thresholds().withMinHealthPasses(config.recoveryThreshold());
            ValidationReport report = validator.runValidationChecks(plan.dependencyId(), recoveryMetrics, criteria);
            metrics.validation(report.allPassed());

            if (!report.allPassed()) {
                audit.record(AuditAction.RECOVERY_VALIDATION_FAILED, plan.dependencyId(), details(
                        "planId", plan.id(),
                        "failedChecks", String.join(",",
                                report.failedChecks().stream().map(ValidationCheck::describe).toList())));
                return new RecoveryResult(RecoveryOutcome.VALIDATION_FAILED, plan.id(), plan, report, null, List.of(),
                        "Validation failed; continue monitoring and retry once the failed checks pass");
            }
            audit.record(AuditAction.RECOVERY_VALIDATED, plan.dependencyId(), details(
                    "planId", plan.id(),
                    "approvedBy", approvedBy));

            if (config != null && !config.autoRecovery() && !approved) {
                return new RecoveryResult(RecoveryOutcome.AWAITING_MANUAL_RESTORE, plan.id(), plan, report, null,
                        List.of(), service + " restores manually; call again with an approver to restore primary");
            }

            plan.advance();
            FallbackResult restore = orchestrator.restoreToPrimary(service);
            recordFallback(restore);

            if (validator.activePlans().stream().allMatch(p -> p.id().equals(plan.id()))) {
                DegradationLevel before = degradation.currentLevel();
                if (before != DegradationLevel.NORMAL) {
                    DegradedModeConfig mode = degradation.setDegradationLevel(DegradationLevel.NORMAL,
                            "recovery validated for " + plan.dependencyId());
                    recordDegradation(before, mode.level(), mode.reason());
                }
            }
            notify(Audience.ONCALL, plan.dependencyId() + " validated; starting gradual restore of " + service,
                    Severity.LOW);
            List<RestorationStep> ramp = validator.getRestorationPlan();
            return new RecoveryResult(RecoveryOutcome.RECOVERING, plan.id(), plan, report, restore, ramp,
                    "Ramp traffic through " + ramp.size() + " steps and report the error rate at each");
        }));
    }

    /**
     * Reports the error rate observed at a ramp step (1-based index into the restoration plan).
     * Too many errors abort the plan and send the service back to the tier it was restored from;
     * the last step completes the plan and resolves the failure.
     *
     * @throws IllegalArgumentException if {@code step} is outside the restoration plan
     */
    public RecoveryResult reportRestorationProgress(String planId, double errorRate, int step) {
        List<RestorationStep> ramp = validator.getRestorationPlan();
        if (step < 1 || step > ramp.size()) {
            throw new IllegalArgumentException("step must be between 1 and " + ramp.size() + ", was " + step);
        }
        Optional<RecoveryPlan> found = validator.getPlan(planId);
        if (found.isEmpty()) {
            return RecoveryResult.refused(RecoveryOutcome.PLAN_NOT_FOUND, planId, null, "No recovery plan " + planId);
        }
        RecoveryPlan plan = found.get();
        String service = owners.get(plan.dependencyId());
        IncidentContext context = new IncidentContext(newCorrelationId(), service, plan.dependencyId(),
                plan.failureEvent().id());
        return withContext(context, "governor.reportRestorationProgress", () -> locked(service, () -> {
            if (!plan.isActive()) {
                return refuse(RecoveryOutcome.PLAN_NOT_ACTIVE, plan, "Plan is " + plan.status());
            }
            if (plan.phase() != RecoveryPhase.GRADUAL_RESTORE) {
                return refuse(RecoveryOutcome.RESTORE_NOT_STARTED, plan,
                        "Plan is in " + plan.phase() + "; validate recovery first");
            }
            RestorationStep current = ramp.get(step - 1);

            if (validator.shouldRollback(errorRate)) {
                return rollBack(service, plan, current, errorRate);
            }

            if (step < ramp.size()) {
                audit.record(AuditAction.RECOVERY_PROGRESSED, plan.dependencyId(), details(
                        "planId", plan.id(),
                        "step", String.valueOf(step),
                        "trafficPercent", String.valueOf(current.trafficPercent()),
                        "errorRate", String.valueOf(errorRate)));
                return new RecoveryResult(RecoveryOutcome.IN_PROGRESS, plan.id(), plan, null, null, ramp,
                        "Hold " + current.trafficPercent() + "% for " + current.dwell()
                                + ", then move to " + ramp.get(step).trafficPercent() + "%");
            }

            plan.complete();
            detector.markResolved(plan.failureEvent().id(), clock.instant());
            audit.record(AuditAction.RECOVERY_COMPLETED, plan.dependencyId(), details(
                    "planId", plan.id(),
                    "eventId", plan.failureEvent().id(),
                    "errorRate", String.valueOf(errorRate)));
            notify(Audience.ONCALL, plan.dependencyId() + " fully restored; schedule the post-mortem", Severity.LOW);
            return new RecoveryResult(RecoveryOutcome.COMPLETED, plan.id(), plan, null, null, List.of(),
                    "Full traffic restored; hold the post-mortem");
        }));
    }

    private RecoveryResult rollBack(String service, RecoveryPlan plan, RestorationStep step, double errorRate) {
        String reason = "error rate " + errorRate + " at " + step.trafficPercent() + "% traffic";
        plan.abort(reason);
        audit.record(AuditAction.RECOVERY_ABORTED, plan.dependencyId(), details(
                "planId", plan.id(),
                "phase", plan.phase().name(),
                "reason", reason));

        FallbackResult fallback = orchestrator.triggerFallback(service, plan.failureEvent(), restoredFromTier(service));
        recordFallback(fallback);

        RecoveryPlan replacement = validator.createRecoveryPlan(plan.failureEvent(), plan.owner());
        replacement.advanceTo(orchestrator.activeFallbacks().contains(service)
                ? RecoveryPhase.FALLBACK_ACTIVE
                : RecoveryPhase.ISOLATION);
        audit.record(AuditAction.RECOVERY_PLAN_CREATED, plan.dependencyId(), details(
                "planId", replacement.id(),
                "eventId", plan.failureEvent().id(),
                "owner", replacement.owner(),
                "phase", replacement.phase().name(),
                "replaces", plan.id()));
        notify(Audience.ONCALL, "Restore of " + service + " rolled back: " + reason, Severity.HIGH);
        log.warn("Rolled back restore of {} ({}); new plan {}", service, reason, replacement.id());
        return new RecoveryResult(RecoveryOutcome.ROLLED_BACK, plan.id(), replacement, null, fallback, List.of(),
                "Rolled back to fallback; investigate before validating again");
    }

    /** Tier the service was last restored to primary from, or null if it never was. */
    private String restoredFromTier(String service) {
        List<TierTransition> history = orchestrator.transitionHistory(service);
        for (int i = history.size() - 1; i >= 0; i--) {
            TierTransition transition = history.get(i);
            if (TierTransition.RESTORE_TRIGGER.equals(transition.triggerEventId())) {
                return transition.fromTier();
            }
        }
        return null;
    }

    private RecoveryResult refuse(RecoveryOutcome outcome, RecoveryPlan plan, String reason) {
        audit.record(AuditAction.RECOVERY_REFUSED, plan.dependencyId(), details(
                "planId", plan.id(),
                "outcome", outcome.name(),
                "reason", reason));
        log.info("Recovery request for plan {} refused: {}", plan.id(), reason);
        return RecoveryResult.refused(outcome, plan.id(), plan, reason);
    }

    // ---- operator controls ----

    /**
     * Moves a service down its chain. With a {@code targetTier} this is an operator decision and
     * may skip approval gates; without one it follows the automatic rules.
     */
    public FallbackResult triggerFallback(String service, String targetTier) {
        IncidentContext context = new IncidentContext(newCorrelationId(), service, null, null);
        return withContext(context, "governor.triggerFallback", () -> locked(service, () -> {
            FallbackResult result = orchestrator.triggerFallback(service, null, targetTier);
            recordFallback(result);
            return result;
        }));
    }

    /** Sends the service straight back to its primary tier. Idempotent. */
    public FallbackResult restoreToPrimary(String service) {
        IncidentContext context = new IncidentContext(newCorrelationId(), service, null, null);
        return withContext(context, "governor.restoreToPrimary", () -> locked(service, () -> {
            FallbackResult result = orchestrator.restoreToPrimary(service);
            recordFallback(result);
            return result;
        }));
    }

    /** Operator override of the degradation level. */
    public DegradedModeConfig setDegradationLevel(DegradationLevel level, String reason) {
        IncidentContext context = new IncidentContext(newCorrelationId(), null, null, null);
        return withContext(context, "governor.setDegradationLevel", () -> {
            DegradationLevel before = degradation.currentLevel();
            DegradedModeConfig mode = degradation.setDegradationLevel(level, reason);
            recordDegradation(before, mode.level(), reason);
            return mode;
        });
    }

    // ---- status ----

    public SystemStatus getSystemStatus() {
        Map<String, String> tiers = new TreeMap<>();
        for (String service : new TreeSet<>(owners.values())) {
            orchestrator.currentTier(service).ifPresent(tier -> tiers.put(service, tier.id()));
        }
        return new SystemStatus(detector.healthCounts(), orchestrator.activeFallbacks(), tiers,
                degradation.currentLevel(), breakers.states(), validator.activePlans().size(), clock.instant());
    }

    public FailureDetector detector() {
        return detector;
    }

    public CircuitBreakerRegistry breakers() {
        return breakers;
    }

    public FallbackOrchestrator orchestrator() {
        return orchestrator;
    }

    public DegradationController degradation() {
        return degradation;
    }

    public RecoveryValidator validator() {
        return validator;
    }

    /** Every audit entry written by this engine, oldest first. */
    public List<AuditEntry> auditLog() {
        return audit.entries();
    }

    public List<Notification> notifications() {
        return notifier.sent();
    }

    public Optional<String> ownerOf(String dependencyId) {
        return dependencyId == null ? Optional.empty() : Optional.ofNullable(owners.get(dependencyId));
    }

    // ---- helpers ----

    private FailureHandlingResult notConfigured(String dependencyId) {
        String component = dependencyId == null ? "unknown" : dependencyId;
        audit.record(AuditAction.FAILURE_REJECTED, component, details("reason", "dependency not configured"));
        log.warn("Failure report for unconfigured dependency {} ignored", dependencyId);
        return new FailureHandlingResult(FailureOutcome.NOT_CONFIGURED, dependencyId, null, null, null, null,
                degradation.currentLevel(), null, List.of(), List.of(),
                "Dependency '" + dependencyId + "' is not configured");
    }

    private void recordFallback(FallbackResult result) {
        metrics.fallbackOutcome(result.service() == null ? "unknown" : result.service(), result.outcome());
        AuditAction action = switch (result.outcome()) {
            case TRANSITIONED -> AuditAction.FALLBACK_TRANSITIONED;
            case RESTORED -> AuditAction.FALLBACK_RESTORED;
            case APPROVAL_REQUIRED, AUTO_FAILOVER_DISABLED, THRESHOLD_NOT_REACHED -> AuditAction.FALLBACK_BLOCKED;
            default -> AuditAction.FALLBACK_REFUSED;
        };
        TierTransition transition = result.transition();
        audit.record(action, result.service() == null ? "unknown" : result.service(), details(
                "outcome", result.outcome().name(),
                "fromTier", result.fromTier(),
                "toTier", result.toTier(),
                "trigger", transition == null ? null : transition.triggerEventId(),
                "qualityDelta", transition == null ? null : String.valueOf(transition.qualityDelta()),
                "message", result.message()));
    }

    private void recordDegradation(DegradationLevel before, DegradationLevel after, String reason) {
        if (before == after) {
            return;
        }
        metrics.degradationLevel(after);
        audit.record(AuditAction.DEGRADATION_CHANGED, "degradation", details(
                "from", before.name(),
                "to", after.name(),
                "reason", reason));
    }

    private void onCircuitStateChange(String dependencyId, CircuitState from, CircuitState to) {
        metrics.circuitTransition(dependencyId, to);
        audit.record(AuditAction.CIRCUIT_STATE_CHANGED, dependencyId, details(
                "from", from.name(),
                "to", to.name()));
    }

    private Notification notify(Audience audience, String message, Severity severity) {
        Notification notification = notifier.notify(audience, message, severity);
        audit.record(AuditAction.NOTIFICATION_SENT, audience.name(), details(
                "notificationId", notification.id(),
                "channel", notification.channel().name(),
                "severity", severity.name()));
        return notification;
    }

    /**
     * Records a healthy sample on a breaker. The admission check runs first so an elapsed open
     * timeout moves the breaker to HALF_OPEN and the success counts toward closing it.
     */
    private static CircuitState admitSuccess(CircuitBreaker breaker) {
        if (!breaker.shouldAllowRequest()) {
            return breaker.state();
        }
        return breaker.recordSuccess();
    }

    private <T> T locked(String service, Supplier<T> work) {
        if (service == null) {
            return work.get();
        }
        ReentrantLock lock = serviceLocks.computeIfAbsent(service, s -> new ReentrantLock());
        lock.lock();
        try {
            return work.get();
        } finally {
            lock.unlock();
        }
    }

    private <T> T withContext(IncidentContext context, String spanName, Supplier<T> work) {
        return IncidentContextHolder.callWithContext(context, () -> spans.inSpan(spanName, work));
    }

    private static String newCorrelationId() {
        return UUID.randomUUID().toString();
    }

    /** Alternating key/value pairs to an ordered map; null values are kept for the redactor to blank. */
    private static Map<String, String> details(String... keyValues) {
        Map<String, String> map = new LinkedHashMap<>();
        for (int i = 0; i + 1 < keyValues.length; i += 2) {
            map.put(keyValues[i], keyValues[i + 1]);
        }
        return map;
    }
}
