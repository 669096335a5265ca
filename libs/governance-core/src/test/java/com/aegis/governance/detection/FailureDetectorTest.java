package com.aegis.governance.detection;

import static org.assertj.core.api.Assertions.assertThat;

import com.aegis.events.Severity;
import com.aegis.governance.model.Dependency;
import com.aegis.governance.model.DependencyType;
import com.aegis.governance.model.EscalationType;
import com.aegis.governance.model.FailureEvent;
import com.aegis.governance.model.FailureKind;
import com.aegis.governance.model.HealthCheck;
import com.aegis.governance.model.HealthStatus;
import com.aegis.governance.model.MetricsSnapshot;
import com.aegis.governance.testing.InMemoryHealthProbe;
import com.aegis.governance.testing.MutableClock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("FailureDetector")
class FailureDetectorTest {

    private MutableClock clock;
    private FailureDetector detector;
    private InMemoryHealthProbe probe;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-03-01T10:00:00Z"));
        DetectionThresholds thresholds = new DetectionThresholds(2000, 0.05, 1000, 3, Duration.ofMillis(50));
        detector = new FailureDetector(new ConcurrentHashMap<>(), thresholds, clock);
        probe = new InMemoryHealthProbe();
        detector.registerDependency(Dependency.of("db-1", DependencyType.DATABASE, "postgres://db-1"), probe);
    }

    @Nested
    @DisplayName("detectFailure")
    class DetectFailure {

        @Test
        @DisplayName("should prefer HIGH_LATENCY over the other breaches")
        void shouldPreferLatency() {
            Optional<FailureEvent> event = detector.detectFailure("db-1", 0.10, 3000, 600);

            assertThat(event).isPresent();
            assertThat(event.get().kind()).isEqualTo(FailureKind.HIGH_LATENCY);
            assertThat(event.get().severity()).isEqualTo(Severity.HIGH);
            assertThat(event.get().metrics()).isEqualTo(new MetricsSnapshot(0.10, 3000, 600));
        }

        @Test
        @DisplayName("should classify an error spike as CRITICAL")
        void shouldClassifyErrorSpike() {
            FailureEvent event = detector.detectFailure("db-1", 0.10, 100, 10).orElseThrow();

            assertThat(event.kind()).isEqualTo(FailureKind.ERROR_SPIKE);
            assertThat(event.severity()).isEqualTo(Severity.CRITICAL);
        }

        @Test
        @DisplayName("should classify a deep queue as CAPACITY_EXCEEDED")
        void shouldClassifyQueueDepth() {
            FailureEvent event = detector.detectFailure("db-1", 0.01, 100, 1001).orElseThrow();

            assertThat(event.kind()).isEqualTo(FailureKind.CAPACITY_EXCEEDED);
            assertThat(event.severity()).isEqualTo(Severity.HIGH);
        }

        @Test
        @DisplayName("should treat values at the threshold as healthy")
        void shouldUseStrictComparison() {
            assertThat(detector.detectFailure("db-1", 0.05, 2000, 1000)).isEmpty();
            assertThat(detector.getFailureLog()).isEmpty();
        }

        @Test
        @DisplayName("should ignore unknown dependencies")
        void shouldIgnoreUnknown() {
            assertThat(detector.detectFailure("nope", 0.9, 9000, 9000)).isEmpty();
        }

        @Test
        @DisplayName("should append detected failures to the log")
        void shouldLogFailures() {
            detector.detectFailure("db-1", 0.10, 100, 10);
            detector.detectFailure("db-1", 0.01, 5000, 10);

            assertThat(detector.getFailures("db-1")).extracting(FailureEvent::kind)
                    .containsExactly(FailureKind.ERROR_SPIKE, FailureKind.HIGH_LATENCY);
        }
    }

    @Nested
    @DisplayName("health checks")
    class HealthChecks {

        @Test
        @DisplayName("should record a healthy probe and update the dependency status")
        void shouldRecordHealthyProbe() {
            probe.setHealthy(40);

            HealthCheck check = detector.checkHealth("db-1");

            assertThat(check.status()).isEqualTo(HealthStatus.HEALTHY);
            assertThat(detector.getDependency("db-1")).map(Dependency::status).contains(HealthStatus.HEALTHY);
            assertThat(detector.getHealthHistory("db-1")).containsExactly(check);
        }

        @Test
        @DisplayName("should record a failing probe as UNHEALTHY")
        void shouldRecordFailingProbe() {
            probe.setFailing(new IllegalStateException("connection refused"));

            HealthCheck check = detector.checkHealth("db-1");

            assertThat(check.status()).isEqualTo(HealthStatus.UNHEALTHY);
            assertThat(check.error()).startsWith("Timeout or error:").contains("connection refused");
        }

        @Test
        @DisplayName("should record a hanging probe as UNHEALTHY after the probe timeout")
        void shouldTimeOutHangingProbe() {
            probe.setHanging();

            HealthCheck check = detector.checkHealth("db-1");

            assertThat(check.status()).isEqualTo(HealthStatus.UNHEALTHY);
            assertThat(check.error()).startsWith("Timeout or error:");
        }

        @Test
        @DisplayName("should return UNKNOWN for unregistered dependencies without recording")
        void shouldReturnUnknown() {
            HealthCheck check = detector.checkHealth("missing");

            assertThat(check.status()).isEqualTo(HealthStatus.UNKNOWN);
            assertThat(detector.getHealthHistory("missing")).isEmpty();
        }

        @Test
        @DisplayName("should downgrade a slow healthy result to DEGRADED")
        void shouldDowngradeSlowResult() {
            HealthCheck check = detector.recordHealthCheck("db-1", ProbeResult.healthy(6000));

            assertThat(check.status()).isEqualTo(HealthStatus.DEGRADED);
        }

        @Test
        @DisplayName("should keep a bounded history and count consecutive passes")
        void shouldBoundHistory() {
            detector.recordHealthCheck("db-1", ProbeResult.unhealthy("down", 10));
            detector.recordHealthCheck("db-1", ProbeResult.healthy(10));
            detector.recordHealthCheck("db-1", ProbeResult.healthy(10));
            detector.recordHealthCheck("db-1", ProbeResult.healthy(10));

            assertThat(detector.getHealthHistory("db-1")).hasSize(3);
            assertThat(detector.consecutiveHealthPasses("db-1")).isEqualTo(3);
        }

        @Test
        @DisplayName("should count dependencies per status")
        void shouldCountStatuses() {
            detector.registerDependency(Dependency.of("cache-1", DependencyType.CACHE, "redis://cache-1"));
            detector.recordHealthCheck("db-1", ProbeResult.healthy(10));

            assertThat(detector.healthCounts())
                    .containsEntry(HealthStatus.HEALTHY, 1L)
                    .containsEntry(HealthStatus.UNKNOWN, 1L)
                    .containsEntry(HealthStatus.CRITICAL, 0L);
        }
    }

    @Test
    @DisplayName("should record externally classified failures and resolve them")
    void shouldRecordAndResolve() {
        FailureEvent event = detector.recordFailure("db-1", FailureKind.DATA_CORRUPTION, null, null).orElseThrow();

        assertThat(event.severity()).isEqualTo(Severity.CRITICAL);
        assertThat(event.requiresManualIntervention()).isTrue();

        clock.advance(Duration.ofMinutes(5));
        FailureEvent resolved = detector.markResolved(event.id(), clock.instant()).orElseThrow();

        assertThat(resolved.isResolved()).isTrue();
        assertThat(detector.getFailureLog()).containsExactly(resolved);
    }

    @Test
    @DisplayName("should require manual intervention for legal and safety escalations of any kind")
    void shouldFlagManualEscalations() {
        FailureEvent legal = detector.recordFailure("db-1", FailureKind.TIMEOUT, null, EscalationType.LEGAL_THREAT,
                null).orElseThrow();
        FailureEvent safety = detector.recordFailure("db-1", FailureKind.HIGH_LATENCY, null,
                EscalationType.SAFETY_CONCERN, null).orElseThrow();
        FailureEvent routine = detector.recordFailure("db-1", FailureKind.TIMEOUT, null, null, null).orElseThrow();

        assertThat(legal.requiresManualIntervention()).isTrue();
        assertThat(safety.requiresManualIntervention()).isTrue();
        assertThat(routine.escalation()).isEqualTo(EscalationType.TECHNICAL);
        assertThat(routine.requiresManualIntervention()).isFalse();
    }
}
