package com.aegis.governance.engine;

import com.aegis.governance.breaker.CircuitBreakerConfig;
import com.aegis.governance.detection.HealthProbe;
import com.aegis.governance.fallback.FallbackConfig;
import com.aegis.governance.model.Dependency;

import java.util.List;
import java.util.Map;

/**
 * Everything {@link GovernanceEngine#setupService(ServiceDefinition)} needs to govern a service.
 *
 * @param service       service name; must match {@code fallback.service()}
 * @param dependencies  dependencies the service relies on
 * @param probes        health probes by dependency id (may be empty)
 * @param fallback      fallback chain and policy
 * @param breakerConfig thresholds for the dependencies' circuit breakers
 */
public record ServiceDefinition(
        String service,
        List<Dependency> dependencies,
        Map<String, HealthProbe> probes,
        FallbackConfig fallback,
        CircuitBreakerConfig breakerConfig
) {

    public ServiceDefinition {
        if (service == null || service.isBlank()) {
            throw new IllegalArgumentException("service must not be null or blank");
        }
        if (dependencies == null || dependencies.isEmpty()) {
            throw new IllegalArgumentException("dependencies must not be null or empty");
        }
        if (fallback == null) {
            throw new IllegalArgumentException("fallback must not be null");
        }
        if (!fallback.service().equals(service)) {
            throw new IllegalArgumentException("fallback config is for '" + fallback.service()
                    + "', not '" + service + "'");
        }
        dependencies = List.copyOf(dependencies);
        probes = probes == null ? Map.of() : Map.copyOf(probes);
        if (breakerConfig == null) {
            breakerConfig = CircuitBreakerConfig.defaults();
        }
    }

    /** A definition without probes and with default breaker thresholds. */
    public static ServiceDefinition of(String service, List<Dependency> dependencies, FallbackConfig fallback) {
        return new ServiceDefinition(service, dependencies, Map.of(), fallback, null);
    }
}
