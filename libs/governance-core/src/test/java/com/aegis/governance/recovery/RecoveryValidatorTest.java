package com.aegis.governance.recovery;

import static org.assertj.core.api.Assertions.assertThat;

import com.aegis.governance.model.FailureEvent;
import com.aegis.governance.model.FailureKind;
import com.aegis.governance.testing.MutableClock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("RecoveryValidator")
class RecoveryValidatorTest {

    private MutableClock clock;
    private RecoveryValidator validator;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-03-01T10:00:00Z"));
        validator = new RecoveryValidator(ValidationThresholds.defaults(), clock);
    }

    private FailureEvent failure(String dependencyId, FailureKind kind) {
        return FailureEvent.detected(dependencyId, kind, null, clock.instant(), null);
    }

    @Nested
    @DisplayName("runValidationChecks")
    class Validation {

        @Test
        @DisplayName("should pass when every metric is within thresholds")
        void shouldPass() {
            ValidationReport report = validator.runValidationChecks("db-1", new RecoveryMetrics(3, 200, 0.005, 150));

            assertThat(report.allPassed()).isTrue();
            assertThat(report.checks()).extracting(ValidationCheck::name).containsExactly(
                    ValidationCheck.HEALTH_PASSES, ValidationCheck.LATENCY_P99,
                    ValidationCheck.ERROR_RATE, ValidationCheck.THROUGHPUT);
            assertThat(report.failedChecks()).isEmpty();
        }

        @Test
        @DisplayName("should report every failed check")
        void shouldReportAllFailures() {
            ValidationReport report = validator.runValidationChecks("db-1", new RecoveryMetrics(1, 900, 0.02, 150));

            assertThat(report.allPassed()).isFalse();
            assertThat(report.failedChecks()).extracting(ValidationCheck::name).containsExactly(
                    ValidationCheck.HEALTH_PASSES, ValidationCheck.LATENCY_P99, ValidationCheck.ERROR_RATE);
            assertThat(report.failedChecks().get(2).describe())
                    .isEqualTo("error_rate: 0.02 (required <= 0.01) FAILED");
        }

        @Test
        @DisplayName("should accept values exactly at the threshold")
        void shouldAcceptBoundaries() {
            assertThat(validator.runValidationChecks("db-1", new RecoveryMetrics(3, 500, 0.01, 100)).allPassed())
                    .isTrue();
        }

        @Test
        @DisplayName("should honour custom criteria and log every run")
        void shouldUseCustomCriteria() {
            ValidationThresholds strict = ValidationThresholds.defaults().withMinHealthPasses(5);

            validator.runValidationChecks("db-1", new RecoveryMetrics(3, 200, 0.005, 150), strict);
            validator.runValidationChecks("db-1", new RecoveryMetrics(5, 200, 0.005, 150), strict);

            assertThat(validator.validationLog()).extracting(ValidationReport::allPassed).containsExactly(false, true);
        }
    }

    @Nested
    @DisplayName("plans")
    class Plans {

        @Test
        @DisplayName("should create an active plan with one step per phase")
        void shouldCreatePlan() {
            RecoveryPlan plan = validator.createRecoveryPlan(failure("db-1", FailureKind.HIGH_LATENCY), "alice");

            assertThat(plan.isActive()).isTrue();
            assertThat(plan.phase()).isEqualTo(RecoveryPhase.DETECTION);
            assertThat(plan.owner()).isEqualTo("alice");
            assertThat(plan.steps()).extracting(RecoveryStep::phase).containsExactly(RecoveryPhase.values());
            assertThat(validator.getPlan(plan.id())).contains(plan);
        }

        @Test
        @DisplayName("should leave remediation manual for corruption")
        void shouldRequireManualRemediation() {
            RecoveryPlan plan = validator.createRecoveryPlan(failure("db-1", FailureKind.DATA_CORRUPTION), "alice");

            RecoveryStep remediate = plan.steps().stream()
                    .filter(step -> step.phase() == RecoveryPhase.REMEDIATION).findFirst().orElseThrow();
            assertThat(remediate.automated()).isFalse();
            assertThat(remediate.description()).contains("backup");
        }

        @Test
        @DisplayName("should abort only the dependency's active plans")
        void shouldAbortActivePlans() {
            RecoveryPlan db = validator.createRecoveryPlan(failure("db-1", FailureKind.ERROR_SPIKE), "alice");
            RecoveryPlan cache = validator.createRecoveryPlan(failure("cache-1", FailureKind.TIMEOUT), "alice");

            List<RecoveryPlan> aborted = validator.abortActivePlans("db-1", "new failure");

            assertThat(aborted).containsExactly(db);
            assertThat(db.status()).isEqualTo(PlanStatus.ABORTED);
            assertThat(validator.activePlans()).containsExactly(cache);
            assertThat(validator.activePlan("db-1")).isEmpty();
        }

        @Test
        @DisplayName("should keep active plans and only the most recent finished ones")
        void shouldPruneFinishedPlans() {
            RecoveryValidator small = new RecoveryValidator(ValidationThresholds.defaults(), clock, 2);
            RecoveryPlan longRunning = small.createRecoveryPlan(failure("cache-1", FailureKind.TIMEOUT), "alice");
            RecoveryPlan oldest = null;
            RecoveryPlan newest = null;
            for (int i = 0; i < 5; i++) {
                clock.advance(Duration.ofMinutes(1));
                RecoveryPlan plan = small.createRecoveryPlan(failure("db-1", FailureKind.ERROR_SPIKE), "alice");
                small.abortActivePlans("db-1", "superseded");
                oldest = oldest == null ? plan : oldest;
                newest = plan;
            }
            small.createRecoveryPlan(failure("db-1", FailureKind.ERROR_SPIKE), "alice");

            assertThat(small.getPlan(longRunning.id())).contains(longRunning);
            assertThat(small.getPlan(newest.id())).contains(newest);
            assertThat(small.getPlan(oldest.id())).isEmpty();
            assertThat(small.retainedPlanCount()).isEqualTo(4);
        }
    }

    @Test
    @DisplayName("should ramp traffic through 10, 25, 50 and 100 percent")
    void shouldProvideRestorationPlan() {
        assertThat(validator.getRestorationPlan()).extracting(RestorationStep::trafficPercent)
                .containsExactly(10, 25, 50, 100);
        assertThat(validator.getRestorationPlan().get(3).dwell()).isEqualTo(Duration.ofMinutes(30));
    }

    @Test
    @DisplayName("should roll back above a 5% error rate at any step")
    void shouldDecideRollback() {
        assertThat(validator.shouldRollback(0.05)).isFalse();
        assertThat(validator.shouldRollback(0.051)).isTrue();
    }
}
