package com.aegis.governance.degradation;

import java.time.Instant;

/**
 * One entry of the degradation history.
 *
 * @param from      level before the change
 * @param to        level after the change
 * @param reason    operator- or engine-supplied reason
 * @param timestamp when the change happened
 */
public record ModeChange(DegradationLevel from, DegradationLevel to, String reason, Instant timestamp) {}
