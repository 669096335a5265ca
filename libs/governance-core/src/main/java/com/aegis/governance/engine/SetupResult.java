package com.aegis.governance.engine;

import java.util.List;

/**
 * What {@link GovernanceEngine#setupService(ServiceDefinition)} registered.
 *
 * @param service       the service
 * @param dependencyIds registered dependencies
 * @param breakerIds    dependencies that received a circuit breaker
 * @param tierIds       fallback chain, in order
 */
public record SetupResult(String service, List<String> dependencyIds, List<String> breakerIds, List<String> tierIds) {}
