package com.aegis.governance.recovery;

import java.time.Duration;

/**
 * One step of the traffic restoration ramp.
 *
 * @param step           1-based position in the ramp
 * @param trafficPercent share of traffic sent to primary during the step
 * @param dwell          how long to hold the step before moving on
 */
public record RestorationStep(int step, int trafficPercent, Duration dwell) {}
