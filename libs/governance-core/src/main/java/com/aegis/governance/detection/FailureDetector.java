package com.aegis.governance.detection;

import com.aegis.events.Severity;
import com.aegis.governance.model.Dependency;
import com.aegis.governance.model.EscalationType;
import com.aegis.governance.model.FailureEvent;
import com.aegis.governance.model.FailureKind;
import com.aegis.governance.model.HealthCheck;
import com.aegis.governance.model.HealthStatus;
import com.aegis.governance.model.MetricsSnapshot;
import com.aegis.governance.support.BoundedLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

/**
 * Dependency registry, health-check history and threshold-based failure classification.
 * <p>
 * Classification precedence, first match wins:
 * <ol>
 *   <li>latency above the critical latency: {@link FailureKind#HIGH_LATENCY} / HIGH</li>
 *   <li>error rate above the critical error rate: {@link FailureKind#ERROR_SPIKE} / CRITICAL</li>
 *   <li>queue depth above the critical depth: {@link FailureKind#CAPACITY_EXCEEDED} / HIGH</li>
 * </ol>
 * Operations on unregistered dependencies never throw: {@link #checkHealth(String)} returns an
 * UNKNOWN check and {@link #detectFailure} returns empty.
 */
public final class FailureDetector {

    private static final Logger log = LoggerFactory.getLogger(FailureDetector.class);

    private final Map<String, Dependency> dependencies;
    private final Map<String, HealthProbe> probes = new ConcurrentHashMap<>();
    private final Map<String, HealthHistory> histories = new ConcurrentHashMap<>();
    private final BoundedLog<FailureEvent> failureLog;
    private final DetectionThresholds thresholds;
    private final Clock clock;

    /**
     * @param dependencies registry owned by the caller; the detector replaces entries as health
     *                     checks update their status
     * @param thresholds   classification thresholds
     * @param clock        time source
     */
    public FailureDetector(Map<String, Dependency> dependencies, DetectionThresholds thresholds, Clock clock) {
        this(dependencies, thresholds, clock, BoundedLog.DEFAULT_CAPACITY);
    }

    /**
     * @param failureRetention most recent failure events kept in the failure log
     */
    public FailureDetector(Map<String, Dependency> dependencies, DetectionThresholds thresholds, Clock clock,
                           int failureRetention) {
        if (dependencies == null) {
            throw new IllegalArgumentException("dependencies must not be null");
        }
        if (thresholds == null) {
            throw new IllegalArgumentException("thresholds must not be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock must not be null");
        }
        this.dependencies = dependencies;
        this.thresholds = thresholds;
        this.clock = clock;
        this.failureLog = new BoundedLog<>(failureRetention);
    }

    /**
     * Registers (or replaces) a dependency without a probe. Health is then fed through
     * {@link #recordHealthCheck(String, ProbeResult)}.
     */
    public void registerDependency(Dependency dependency) {
        if (dependency == null) {
            throw new IllegalArgumentException("dependency must not be null");
        }
        dependencies.put(dependency.id(), dependency);
        histories.computeIfAbsent(dependency.id(), id -> new HealthHistory(thresholds.historyCapacity()));
        log.info("Registered dependency {} ({}, endpoint={})", dependency.id(), dependency.type(), dependency.endpoint());
    }

    /** Registers a dependency together with the probe {@link #checkHealth(String)} will call. */
    public void registerDependency(Dependency dependency, HealthProbe probe) {
        registerDependency(dependency);
        if (probe != null) {
            probes.put(dependency.id(), probe);
        }
    }

    public boolean isRegistered(String dependencyId) {
        return dependencyId != null && dependencies.containsKey(dependencyId);
    }

    /**
     * Probes the dependency and records the observation.
     * <p>
     * A probe that fails or exceeds the probe timeout is recorded as UNHEALTHY. An unregistered
     * dependency, or one without a probe, yields an UNKNOWN check that is not recorded.
     */
    public HealthCheck checkHealth(String dependencyId) {
        Instant now = clock.instant();
        if (!isRegistered(dependencyId)) {
            return HealthCheck.unknown(dependencyId, now, "Dependency '" + dependencyId + "' is not registered");
        }
        HealthProbe probe = probes.get(dependencyId);
        if (probe == null) {
            return HealthCheck.unknown(dependencyId, now, "No health probe registered for '" + dependencyId + "'");
        }

        ProbeResult result;
        long timeoutMs = thresholds.probeTimeout().toMillis();
        try {
            result = probe.probe().orTimeout(timeoutMs, TimeUnit.MILLISECONDS).join();
        } catch (RuntimeException e) {
            log.warn("Health probe for {} failed: {}", dependencyId, e.getMessage());
            result = ProbeResult.unhealthy("Timeout or error: " + e.getMessage(), timeoutMs);
        }
        return recordHealthCheck(dependencyId, result);
    }

    /**
     * Records a probe result pushed by the telemetry feed: appends it to the history and updates
     * the dependency's cached status. A HEALTHY result slower than the dependency's timeout is
     * recorded as DEGRADED.
     */
    public HealthCheck recordHealthCheck(String dependencyId, ProbeResult result) {
        Instant now = clock.instant();
        Dependency dependency = dependencyId == null ? null : dependencies.get(dependencyId);
        if (dependency == null) {
            return HealthCheck.unknown(dependencyId, now, "Dependency '" + dependencyId + "' is not registered");
        }

        HealthStatus status = result.status();
        if (status == HealthStatus.HEALTHY && result.latencyMs() > dependency.timeout().toMillis()) {
            status = HealthStatus.DEGRADED;
        }
        HealthCheck check = new HealthCheck(dependencyId, now, status, result.latencyMs(), result.error());

        histories.computeIfAbsent(dependencyId, id -> new HealthHistory(thresholds.historyCapacity())).append(check);
        dependencies.computeIfPresent(dependencyId, (id, dep) -> dep.withStatus(check.status()));
        if (status != dependency.status()) {
            log.info("Dependency {} status {} -> {}", dependencyId, dependency.status(), status);
        }
        return check;
    }

    /**
     * Classifies a telemetry sample. A detected failure is appended to the failure log.
     *
     * @return the failure, or empty if the sample is within thresholds or the dependency is unknown
     */
    public Optional<FailureEvent> detectFailure(String dependencyId, double errorRate, long latencyMs, long queueDepth) {
        if (!isRegistered(dependencyId)) {
            log.warn("Ignoring telemetry for unregistered dependency {}", dependencyId);
            return Optional.empty();
        }
        MetricsSnapshot snapshot = new MetricsSnapshot(errorRate, latencyMs, queueDepth);

        FailureKind kind;
        Severity severity;
        if (latencyMs > thresholds.criticalLatencyMs()) {
            kind = FailureKind.HIGH_LATENCY;
            severity = Severity.HIGH;
        } else if (errorRate > thresholds.criticalErrorRate()) {
            kind = FailureKind.ERROR_SPIKE;
            severity = Severity.CRITICAL;
        } else if (queueDepth > thresholds.criticalQueueDepth()) {
            kind = FailureKind.CAPACITY_EXCEEDED;
            severity = Severity.HIGH;
        } else {
            return Optional.empty();
        }
        return Optional.of(record(FailureEvent.detected(dependencyId, kind, severity, clock.instant(), snapshot)));
    }

    /**
     * Records a failure classified outside the detector (e.g. a checksum job reporting
     * DATA_CORRUPTION). The kind's default severity applies when {@code severity} is null.
     *
     * @return the failure, or empty if the dependency is unknown
     */
    public Optional<FailureEvent> recordFailure(String dependencyId, FailureKind kind, Severity severity,
                                                MetricsSnapshot snapshot) {
        return recordFailure(dependencyId, kind, severity, null, snapshot);
    }

    /**
     * Records an externally classified failure escalated under {@code escalation}. Legal threats,
     * safety concerns and data corruption mark the event as requiring manual intervention whatever
     * its kind.
     *
     * @return the failure, or empty if the dependency is unknown
     */
    public Optional<FailureEvent> recordFailure(String dependencyId, FailureKind kind, Severity severity,
                                                EscalationType escalation, MetricsSnapshot snapshot) {
        if (!isRegistered(dependencyId)) {
            log.warn("Ignoring {} reported for unregistered dependency {}", kind, dependencyId);
            return Optional.empty();
        }
        return Optional.of(record(FailureEvent.escalated(dependencyId, kind, severity, escalation, clock.instant(),
                snapshot)));
    }

    /** Marks a logged failure resolved. Returns the resolved event, or empty if it is no longer retained. */
    public Optional<FailureEvent> markResolved(String eventId, Instant at) {
        return failureLog.replaceLast(event -> event.id().equals(eventId),
                event -> event.isResolved() ? event : event.resolve(at));
    }

    public Optional<Dependency> getDependency(String dependencyId) {
        return dependencyId == null ? Optional.empty() : Optional.ofNullable(dependencies.get(dependencyId));
    }

    public Collection<Dependency> dependencies() {
        return List.copyOf(dependencies.values());
    }

    /** Health checks for one dependency, oldest first. Empty for unknown dependencies. */
    public List<HealthCheck> getHealthHistory(String dependencyId) {
        HealthHistory history = dependencyId == null ? null : histories.get(dependencyId);
        return history == null ? List.of() : history.snapshot();
    }

    /** Number of passing checks at the end of the dependency's history. */
    public int consecutiveHealthPasses(String dependencyId) {
        HealthHistory history = dependencyId == null ? null : histories.get(dependencyId);
        return history == null ? 0 : history.consecutivePasses();
    }

    /** Retained failures, in detection order. */
    public List<FailureEvent> getFailureLog() {
        return failureLog.snapshot();
    }

    public List<FailureEvent> getFailures(String dependencyId) {
        return failureLog.filter(e -> e.dependencyId().equals(dependencyId));
    }

    /** Number of registered dependencies per cached status; every status is present. */
    public Map<HealthStatus, Long> healthCounts() {
        Map<HealthStatus, Long> counts = new EnumMap<>(HealthStatus.class);
        for (HealthStatus status : HealthStatus.values()) {
            counts.put(status, 0L);
        }
        dependencies.values().forEach(dep -> counts.merge(dep.status(), 1L, Long::sum));
        return counts;
    }

    public DetectionThresholds thresholds() {
        return thresholds;
    }

    private FailureEvent record(FailureEvent event) {
        failureLog.append(event);
        log.warn("Detected {} ({}) on {}: errorRate={}, latencyMs={}, queueDepth={}", event.kind(), event.severity(),
                event.dependencyId(), event.metrics().errorRate(), event.metrics().latencyMs(),
                event.metrics().queueDepth());
        return event;
    }
}
