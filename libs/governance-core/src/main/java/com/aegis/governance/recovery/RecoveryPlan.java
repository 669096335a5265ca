package com.aegis.governance.recovery;

import com.aegis.governance.model.FailureEvent;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Recovery of one failure event, from detection to post-mortem.
 * <p>
 * The phase only moves forward one step at a time; leaving a phase marks its steps completed. An
 * aborted or completed plan no longer changes. All mutators are synchronized on the plan.
 */
public final class RecoveryPlan {

    private final String id;
    private final FailureEvent failureEvent;
    private final String owner;
    private final List<RecoveryStep> steps;
    private final Instant createdAt;
    private final Clock clock;

    private RecoveryPhase phase = RecoveryPhase.DETECTION;
    private PlanStatus status = PlanStatus.ACTIVE;
    private final Set<String> completedSteps = new LinkedHashSet<>();
    private String abortReason;
    private Instant updatedAt;

    RecoveryPlan(String id, FailureEvent failureEvent, String owner, List<RecoveryStep> steps, Clock clock) {
        this.id = id;
        this.failureEvent = failureEvent;
        this.owner = owner;
        this.steps = List.copyOf(steps);
        this.clock = clock;
        this.createdAt = clock.instant();
        this.updatedAt = createdAt;
    }

    /**
     * Moves to the next phase.
     *
     * @throws IllegalStateException if the plan is not active or already in POST_MORTEM
     */
    public synchronized RecoveryPhase advance() {
        requireActive();
        RecoveryPhase next = phase.next()
                .orElseThrow(() -> new IllegalStateException("plan " + id + " is already in " + phase));
        completePhaseSteps(phase);
        phase = next;
        updatedAt = clock.instant();
        return phase;
    }

    /**
     * Advances one phase at a time until {@code target} is reached. Does nothing if the plan is
     * already there.
     *
     * @throws IllegalStateException if {@code target} is behind the current phase or the plan is
     *                               not active
     */
    public synchronized RecoveryPhase advanceTo(RecoveryPhase target) {
        requireActive();
        if (target.compareTo(phase) < 0) {
            throw new IllegalStateException("plan " + id + " cannot go back from " + phase + " to " + target);
        }
        while (phase != target) {
            advance();
        }
        return phase;
    }

    /** Marks one step done without changing phase. Unknown step ids are rejected. */
    public synchronized void completeStep(String stepId) {
        requireActive();
        boolean known = steps.stream().anyMatch(step -> step.id().equals(stepId));
        if (!known) {
            throw new IllegalArgumentException("plan " + id + " has no step '" + stepId + "'");
        }
        completedSteps.add(stepId);
        updatedAt = clock.instant();
    }

    /** Stops the plan; returns false if it was no longer active. */
    public synchronized boolean abort(String reason) {
        if (status != PlanStatus.ACTIVE) {
            return false;
        }
        status = PlanStatus.ABORTED;
        abortReason = reason;
        updatedAt = clock.instant();
        return true;
    }

    /**
     * Finishes the plan: advances to POST_MORTEM and marks every step done.
     *
     * @throws IllegalStateException if the plan is not active
     */
    public synchronized void complete() {
        advanceTo(RecoveryPhase.POST_MORTEM);
        completePhaseSteps(RecoveryPhase.POST_MORTEM);
        status = PlanStatus.COMPLETED;
        updatedAt = clock.instant();
    }

    public String id() {
        return id;
    }

    public FailureEvent failureEvent() {
        return failureEvent;
    }

    public String dependencyId() {
        return failureEvent.dependencyId();
    }

    public String owner() {
        return owner;
    }

    public List<RecoveryStep> steps() {
        return steps;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public synchronized RecoveryPhase phase() {
        return phase;
    }

    public synchronized PlanStatus status() {
        return status;
    }

    public synchronized boolean isActive() {
        return status == PlanStatus.ACTIVE;
    }

    public synchronized Set<String> completedSteps() {
        return Set.copyOf(completedSteps);
    }

    public synchronized String abortReason() {
        return abortReason;
    }

    public synchronized Instant updatedAt() {
        return updatedAt;
    }

    private void requireActive() {
        if (status != PlanStatus.ACTIVE) {
            throw new IllegalStateException("plan " + id + " is " + status);
        }
    }

    private void completePhaseSteps(RecoveryPhase finished) {
        steps.stream().filter(step -> step.phase() == finished).forEach(step -> completedSteps.add(step.id()));
    }
}
