package com.aegis.governor.config;

import com.aegis.governance.breaker.CircuitBreakerConfig;
import com.aegis.governance.degradation.DegradationLevel;
import com.aegis.governance.degradation.DegradationPolicy;
import com.aegis.governance.detection.DetectionThresholds;
import com.aegis.governance.engine.GovernanceSettings;
import com.aegis.governance.engine.ServiceDefinition;
import com.aegis.governance.fallback.FallbackConfig;
import com.aegis.governance.fallback.FallbackTier;
import com.aegis.governance.fallback.TierKind;
import com.aegis.governance.model.Dependency;
import com.aegis.governance.model.DependencyType;
import com.aegis.governance.model.HealthStatus;
import com.aegis.governance.recovery.ValidationThresholds;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Type-safe configuration of the governor, bound from {@code aegis.governor.*}.
 *
 * <pre>
 * aegis:
 *   governor:
 *     name: edge-governor
 *     detection:
 *       critical-latency-ms: 2000
 *     services:
 *       - name: checkout
 *         dependencies:
 *           - id: payments-db
 *             type: database
 *         tiers:
 *           - id: primary
 *             kind: primary
 * </pre>
 *
 * <p>Compact constructors fill in defaults before Bean Validation runs, so an omitted section
 * behaves like the library defaults.
 *
 * @param name        governor name, tagged on every meter. Required.
 * @param environment deployment environment (development, staging, production)
 * @param detection   failure classification thresholds
 * @param breaker     circuit breaker thresholds applied to every breaker-enabled dependency
 * @param recovery    validation thresholds and plan defaults
 * @param services    services to set up at start-up
 * @param historyRetention entries kept in each in-memory governance log; 0 keeps the default
 */
@ConfigurationProperties(prefix = "aegis.governor")
@Validated
public record GovernorProperties(
        @NotBlank String name,
        String environment,
        @Valid Detection detection,
        @Valid Breaker breaker,
        @Valid Recovery recovery,
        @Valid List<ServiceProperties> services,
        int historyRetention) {

    public GovernorProperties {
        if (environment == null || environment.isBlank()) {
            environment = "development";
        }
        if (detection == null) {
            detection = new Detection(0, 0, 0, 0, null);
        }
        if (breaker == null) {
            breaker = new Breaker(0, 0, null);
        }
        if (recovery == null) {
            recovery = new Recovery(0, 0, 0, 0, 0, null, null);
        }
        services = services == null ? List.of() : List.copyOf(services);
    }

    /** Engine settings derived from these properties, with the default degradation policy. */
    public GovernanceSettings toSettings() {
        return new GovernanceSettings(detection.toThresholds(), recovery.toThresholds(),
                DegradationPolicy.defaults(), recovery.criticalDegradationLevel(), recovery.planOwner(),
                historyRetention);
    }

    /**
     * @param criticalLatencyMs  latency above which a sample is HIGH_LATENCY
     * @param criticalErrorRate  error rate above which a sample is ERROR_SPIKE
     * @param criticalQueueDepth queue depth above which a sample is CAPACITY_EXCEEDED
     * @param historyCapacity    health checks kept per dependency
     * @param probeTimeout       longest wait for a health probe
     */
    public record Detection(
            long criticalLatencyMs,
            double criticalErrorRate,
            long criticalQueueDepth,
            int historyCapacity,
            Duration probeTimeout) {

        public Detection {
            if (criticalLatencyMs <= 0) {
                criticalLatencyMs = DetectionThresholds.DEFAULT_CRITICAL_LATENCY_MS;
            }
            if (criticalErrorRate <= 0) {
                criticalErrorRate = DetectionThresholds.DEFAULT_CRITICAL_ERROR_RATE;
            }
            if (criticalQueueDepth <= 0) {
                criticalQueueDepth = DetectionThresholds.DEFAULT_CRITICAL_QUEUE_DEPTH;
            }
            if (historyCapacity <= 0) {
                historyCapacity = DetectionThresholds.DEFAULT_HISTORY_CAPACITY;
            }
            if (probeTimeout == null || probeTimeout.isZero() || probeTimeout.isNegative()) {
                probeTimeout = DetectionThresholds.DEFAULT_PROBE_TIMEOUT;
            }
        }

        DetectionThresholds toThresholds() {
            return new DetectionThresholds(criticalLatencyMs, criticalErrorRate, criticalQueueDepth,
                    historyCapacity, probeTimeout);
        }
    }

    /**
     * @param failureThreshold consecutive failures that open a breaker
     * @param successThreshold half-open successes that close it again
     * @param openTimeout      time a breaker stays open before probing
     */
    public record Breaker(int failureThreshold, int successThreshold, Duration openTimeout) {

        public Breaker {
            CircuitBreakerConfig defaults = CircuitBreakerConfig.defaults();
            if (failureThreshold <= 0) {
                failureThreshold = defaults.failureThreshold();
            }
            if (successThreshold <= 0) {
                successThreshold = defaults.successThreshold();
            }
            if (openTimeout == null || openTimeout.isNegative()) {
                openTimeout = defaults.openTimeout();
            }
        }

        CircuitBreakerConfig toConfig() {
            return new CircuitBreakerConfig(failureThreshold, successThreshold, openTimeout);
        }
    }

    /**
     * @param minHealthPasses          passing health checks required before restore
     * @param maxLatencyP99Ms          highest acceptable p99 latency
     * @param maxErrorRate             highest acceptable error rate
     * @param minThroughputRps         lowest acceptable throughput
     * @param rollbackErrorRate        ramp error rate that triggers a rollback
     * @param planOwner                owner assigned to new recovery plans
     * @param criticalDegradationLevel level a CRITICAL failure raises degradation to
     */
    public record Recovery(
            int minHealthPasses,
            double maxLatencyP99Ms,
            double maxErrorRate,
            double minThroughputRps,
            double rollbackErrorRate,
            String planOwner,
            DegradationLevel criticalDegradationLevel) {

        public Recovery {
            ValidationThresholds defaults = ValidationThresholds.defaults();
            if (minHealthPasses <= 0) {
                minHealthPasses = defaults.minHealthPasses();
            }
            if (maxLatencyP99Ms <= 0) {
                maxLatencyP99Ms = defaults.maxLatencyP99Ms();
            }
            if (maxErrorRate <= 0) {
                maxErrorRate = defaults.maxErrorRate();
            }
            if (minThroughputRps <= 0) {
                minThroughputRps = defaults.minThroughputRps();
            }
            if (rollbackErrorRate <= 0) {
                rollbackErrorRate = defaults.rollbackErrorRate();
            }
            if (planOwner == null || planOwner.isBlank()) {
                planOwner = "oncall";
            }
            if (criticalDegradationLevel == null) {
                criticalDegradationLevel = DegradationLevel.DEGRADED_L2;
            }
        }

        ValidationThresholds toThresholds() {
            return new ValidationThresholds(minHealthPasses, maxLatencyP99Ms, maxErrorRate, minThroughputRps,
                    rollbackErrorRate);
        }
    }

    /**
     * One governed service.
     *
     * @param name              service name
     * @param dependencies      dependencies it relies on
     * @param tiers             fallback chain, primary first
     * @param autoFailover      move down the chain automatically (default true)
     * @param autoRecovery      restore primary after a passed validation (default true)
     * @param failureThreshold  failures needed before an automatic step (default 1)
     * @param recoveryThreshold health passes needed to validate recovery (default 3)
     */
    public record ServiceProperties(
            @NotBlank String name,
            @NotEmpty @Valid List<DependencyProperties> dependencies,
            @NotEmpty @Valid List<TierProperties> tiers,
            Boolean autoFailover,
            Boolean autoRecovery,
            int failureThreshold,
            int recoveryThreshold) {

        public ServiceProperties {
            if (autoFailover == null) {
                autoFailover = Boolean.TRUE;
            }
            if (autoRecovery == null) {
                autoRecovery = Boolean.TRUE;
            }
            if (failureThreshold <= 0) {
                failureThreshold = FallbackConfig.DEFAULT_FAILURE_THRESHOLD;
            }
            if (recoveryThreshold <= 0) {
                recoveryThreshold = FallbackConfig.DEFAULT_RECOVERY_THRESHOLD;
            }
        }

        /**
         * @throws IllegalArgumentException if the tiers do not form a valid chain
         */
        public ServiceDefinition toDefinition(Breaker breaker) {
            List<FallbackTier> chain = tiers.stream().map(TierProperties::toTier).toList();
            FallbackConfig fallback = new FallbackConfig(name, chain, autoFailover, autoRecovery,
                    failureThreshold, recoveryThreshold);
            return new ServiceDefinition(name, dependencies.stream().map(DependencyProperties::toDependency).toList(),
                    null, fallback, breaker.toConfig());
        }
    }

    /**
     * @param id                    dependency id, unique across services
     * @param type                  dependency type
     * @param endpoint              address, for operators
     * @param slaTargetPercent      availability target (default 99.9)
     * @param timeout               slower healthy probes count as DEGRADED (default 5s)
     * @param circuitBreakerEnabled whether the dependency gets a breaker (default true)
     */
    public record DependencyProperties(
            @NotBlank String id,
            @NotNull DependencyType type,
            String endpoint,
            double slaTargetPercent,
            Duration timeout,
            Boolean circuitBreakerEnabled) {

        public DependencyProperties {
            if (slaTargetPercent <= 0) {
                slaTargetPercent = 99.9;
            }
            if (circuitBreakerEnabled == null) {
                circuitBreakerEnabled = Boolean.TRUE;
            }
        }

        Dependency toDependency() {
            return new Dependency(id, id, type, endpoint, slaTargetPercent, timeout, 3, circuitBreakerEnabled,
                    HealthStatus.UNKNOWN);
        }
    }

    /**
     * @param id       tier id
     * @param kind     tier kind; supplies default quality, latency and approval gating
     * @param provider what serves the tier
     * @param quality  quality percent override; 0 keeps the kind's default
     */
    public record TierProperties(@NotBlank String id, @NotNull TierKind kind, String provider, int quality) {

        FallbackTier toTier() {
            return quality > 0 ? FallbackTier.of(id, kind, provider, quality) : FallbackTier.of(id, kind, provider);
        }
    }
}
