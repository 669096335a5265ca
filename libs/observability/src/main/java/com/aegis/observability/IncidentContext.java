package com.aegis.observability;

/**
 * Identifiers of the incident the governor is currently working on.
 * <p>
 * While the engine handles a failure or drives a recovery, these values are pushed into SLF4J MDC
 * (see {@link IncidentContextHolder}) so every log line emitted by the detector, breakers,
 * orchestrator and validator can be grouped by incident.
 *
 * @param correlationId  unique id of this governance operation
 * @param service        governed service (nullable when the dependency has no owner yet)
 * @param dependencyId   dependency the operation concerns (nullable for service-level operations)
 * @param failureEventId failure event being handled or recovered (nullable before detection)
 */
public record IncidentContext(
        String correlationId,
        String service,
        String dependencyId,
        String failureEventId
) {

    public static final String MDC_CORRELATION_ID = "correlationId";
    public static final String MDC_SERVICE = "service";
    public static final String MDC_DEPENDENCY_ID = "dependencyId";
    public static final String MDC_FAILURE_EVENT_ID = "failureEventId";

    public IncidentContext {
        if (correlationId == null || correlationId.isBlank()) {
            throw new IllegalArgumentException("correlationId must not be null or blank");
        }
    }

    /** Returns a copy carrying the given failure event id. */
    public IncidentContext withFailureEvent(String eventId) {
        return new IncidentContext(correlationId, service, dependencyId, eventId);
    }
}
