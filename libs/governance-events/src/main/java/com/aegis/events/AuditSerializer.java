package com.aegis.events;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.util.Optional;

/**
 * JSON serialization for {@link AuditEntry} and {@link Notification}, the two record types handed
 * to the persistence and paging collaborators. Instants are written as ISO 8601 strings.
 */
public final class AuditSerializer {

    private static final ObjectMapper MAPPER = createMapper();

    private AuditSerializer() {
        // utility class
    }

    private static ObjectMapper createMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    /**
     * Serializes an audit entry to JSON.
     *
     * @throws SerializationException if serialization fails
     */
    public static String serialize(AuditEntry entry) {
        return write(entry, "audit entry " + entry.id());
    }

    /**
     * Serializes a notification to JSON.
     *
     * @throws SerializationException if serialization fails
     */
    public static String serialize(Notification notification) {
        return write(notification, "notification " + notification.id());
    }

    /**
     * Reads an audit entry back from JSON. The checksum is not verified here; use
     * {@link AuditVerifier}.
     *
     * @throws SerializationException if the JSON is malformed
     */
    public static AuditEntry deserializeAudit(String json) {
        try {
            return MAPPER.readValue(json, AuditEntry.class);
        } catch (JsonProcessingException e) {
            throw new SerializationException("Failed to deserialize audit entry", e);
        }
    }

    /** Reads an audit entry back, returning empty on any failure. */
    public static Optional<AuditEntry> tryDeserializeAudit(String json) {
        try {
            return Optional.of(deserializeAudit(json));
        } catch (SerializationException e) {
            return Optional.empty();
        }
    }

    /**
     * Reads a notification back from JSON.
     *
     * @throws SerializationException if the JSON is malformed
     */
    public static Notification deserializeNotification(String json) {
        try {
            return MAPPER.readValue(json, Notification.class);
        } catch (JsonProcessingException e) {
            throw new SerializationException("Failed to deserialize notification", e);
        }
    }

    private static String write(Object value, String what) {
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new SerializationException("Failed to serialize " + what, e);
        }
    }

    /** Thrown when an audit entry or notification cannot be converted to or from JSON. */
    public static class SerializationException extends RuntimeException {
        public SerializationException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
