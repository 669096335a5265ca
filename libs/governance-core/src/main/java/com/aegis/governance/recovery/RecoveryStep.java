package com.aegis.governance.recovery;

/**
 * One step of a recovery plan.
 *
 * @param id          step id, unique within the plan
 * @param phase       phase the step belongs to
 * @param description what to do
 * @param automated   false if a human has to perform it
 */
public record RecoveryStep(String id, RecoveryPhase phase, String description, boolean automated) {}
