package com.aegis.events;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.util.Arrays;
import java.util.HexFormat;
import java.util.Map;
import java.util.TreeMap;

/**
 * Computes the tamper-evident checksum of an {@link AuditEntry}.
 *
 * <p>The digest input is the JSON array {@code [id, action, component, timestamp, details]} with
 * details sorted by key. JSON quoting keeps separators inside values from colliding, and key
 * ordering makes the checksum independent of map ordering.
 */
public final class AuditChecksum {

    private static final String ALGORITHM = "SHA-256";

    private static final ObjectMapper CANONICAL = new ObjectMapper()
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);

    private AuditChecksum() {
        // utility class
    }

    /**
     * @throws AuditSerializer.SerializationException if the canonical form cannot be written
     */
    public static String compute(String id, AuditAction action, String component,
                                 Map<String, String> details, Instant timestamp) {
        byte[] canonical = canonicalForm(id, action, component, details, timestamp);
        return HexFormat.of().formatHex(digest().digest(canonical));
    }

    /** Recomputes the checksum of {@code entry} from its content. */
    public static String compute(AuditEntry entry) {
        return compute(entry.id(), entry.action(), entry.component(), entry.details(), entry.timestamp());
    }

    static byte[] canonicalForm(String id, AuditAction action, String component,
                                Map<String, String> details, Instant timestamp) {
        Map<String, String> sorted = details == null ? new TreeMap<>() : new TreeMap<>(details);
        try {
            String json = CANONICAL.writeValueAsString(Arrays.asList(
                    id,
                    action == null ? null : action.name(),
                    component,
                    timestamp == null ? null : timestamp.toString(),
                    sorted));
            return json.getBytes(StandardCharsets.UTF_8);
        } catch (JsonProcessingException e) {
            throw new AuditSerializer.SerializationException("Failed to write canonical form of audit entry " + id, e);
        }
    }

    private static MessageDigest digest() {
        try {
            return MessageDigest.getInstance(ALGORITHM);
        } catch (NoSuchAlgorithmException e) {
            // every JRE is required to ship SHA-256
            throw new IllegalStateException(ALGORITHM + " not available", e);
        }
    }
}
