package com.aegis.events;

import java.time.Instant;
import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;
import java.util.UUID;

/**
 * Immutable audit record for a single governance action.
 *
 * <p>The checksum is computed over every other field (see {@link AuditChecksum}); any later edit
 * to the entry can be detected with {@link AuditVerifier}.
 *
 * @param id        unique entry id
 * @param action    the governance action
 * @param component component that performed the action (e.g. "fallback-orchestrator")
 * @param details   action details, sorted by key
 * @param timestamp when the action happened
 * @param checksum  hex SHA-256 over the other fields
 */
public record AuditEntry(
        String id,
        AuditAction action,
        String component,
        Map<String, String> details,
        Instant timestamp,
        String checksum
) {

    public AuditEntry {
        details = details == null ? Map.of() : Collections.unmodifiableMap(new TreeMap<>(details));
    }

    /** Creates an entry with a fresh id and a checksum computed from its content. */
    public static AuditEntry create(AuditAction action, String component, Map<String, String> details,
                                    Instant timestamp) {
        if (action == null) {
            throw new IllegalArgumentException("action must not be null");
        }
        if (component == null || component.isBlank()) {
            throw new IllegalArgumentException("component must not be null or blank");
        }
        if (timestamp == null) {
            throw new IllegalArgumentException("timestamp must not be null");
        }
        String id = UUID.randomUUID().toString();
        String checksum = AuditChecksum.compute(id, action, component, details, timestamp);
        return new AuditEntry(id, action, component, details, timestamp, checksum);
    }
}
