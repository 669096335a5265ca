package com.aegis.governance.recovery;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.aegis.governance.model.FailureEvent;
import com.aegis.governance.model.FailureKind;
import com.aegis.governance.testing.MutableClock;
import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("RecoveryPlan")
class RecoveryPlanTest {

    private MutableClock clock;
    private RecoveryPlan plan;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-03-01T10:00:00Z"));
        RecoveryValidator validator = new RecoveryValidator(ValidationThresholds.defaults(), clock);
        plan = validator.createRecoveryPlan(
                FailureEvent.detected("db-1", FailureKind.TIMEOUT, null, clock.instant(), null), "oncall");
    }

    @Test
    @DisplayName("should advance one phase at a time and complete the steps it leaves")
    void shouldAdvance() {
        clock.advance(Duration.ofMinutes(1));

        assertThat(plan.advance()).isEqualTo(RecoveryPhase.ISOLATION);
        assertThat(plan.completedSteps()).containsExactly("confirm");
        assertThat(plan.updatedAt()).isEqualTo(clock.instant());
    }

    @Test
    @DisplayName("should refuse to go backwards")
    void shouldNotGoBack() {
        plan.advanceTo(RecoveryPhase.DIAGNOSIS);

        assertThatThrownBy(() -> plan.advanceTo(RecoveryPhase.ISOLATION))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("cannot go back");
    }

    @Test
    @DisplayName("should stop changing once aborted")
    void shouldFreezeWhenAborted() {
        assertThat(plan.abort("superseded")).isTrue();
        assertThat(plan.abort("again")).isFalse();

        assertThat(plan.abortReason()).isEqualTo("superseded");
        assertThatThrownBy(plan::advance).isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("should complete every step on completion")
    void shouldComplete() {
        plan.complete();

        assertThat(plan.status()).isEqualTo(PlanStatus.COMPLETED);
        assertThat(plan.phase()).isEqualTo(RecoveryPhase.POST_MORTEM);
        assertThat(plan.completedSteps()).hasSize(plan.steps().size());
        assertThatThrownBy(plan::advance).isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("should reject unknown step ids")
    void shouldRejectUnknownStep() {
        assertThatThrownBy(() -> plan.completeStep("reboot-the-world"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
