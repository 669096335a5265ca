package com.aegis.governance.engine;

import com.aegis.governance.breaker.CircuitState;
import com.aegis.governance.degradation.DegradationLevel;
import com.aegis.governance.model.HealthStatus;

import java.time.Instant;
import java.util.Map;
import java.util.Set;

/**
 * Aggregate view of everything the governor controls.
 *
 * @param dependencyHealth number of dependencies per health status
 * @param activeFallbacks  services currently below tier 0
 * @param currentTiers     current tier id per service
 * @param degradationLevel active degradation level
 * @param circuitBreakers  breaker state per dependency
 * @param openIncidents    active recovery plans
 * @param generatedAt      when the snapshot was taken
 */
public record SystemStatus(
        Map<HealthStatus, Long> dependencyHealth,
        Set<String> activeFallbacks,
        Map<String, String> currentTiers,
        DegradationLevel degradationLevel,
        Map<String, CircuitState> circuitBreakers,
        int openIncidents,
        Instant generatedAt
) {

    public SystemStatus {
        dependencyHealth = Map.copyOf(dependencyHealth);
        activeFallbacks = Set.copyOf(activeFallbacks);
        currentTiers = Map.copyOf(currentTiers);
        circuitBreakers = Map.copyOf(circuitBreakers);
    }

    /** True when nothing is in fallback, degraded or open. */
    public boolean isNominal() {
        return activeFallbacks.isEmpty() && degradationLevel == DegradationLevel.NORMAL && openIncidents == 0
                && circuitBreakers.values().stream().allMatch(state -> state == CircuitState.CLOSED);
    }
}
