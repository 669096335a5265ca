package com.aegis.events;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Instant;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Tests for {@link AuditSerializer}: JSON shape handed to the persistence and paging
 * collaborators.
 */
@DisplayName("AuditSerializer")
class AuditSerializerTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:15:30Z");

    @Nested
    @DisplayName("audit entries")
    class AuditEntries {

        @Test
        @DisplayName("writes instants as ISO 8601")
        void writesIsoInstants() {
            var entry = AuditEntry.create(AuditAction.CIRCUIT_STATE_CHANGED, "circuit-breaker",
                    Map.of("dependency", "db-1"), NOW);

            var json = AuditSerializer.serialize(entry);

            assertThat(json)
                    .contains("\"timestamp\":\"2026-03-01T10:15:30Z\"")
                    .contains("\"action\":\"CIRCUIT_STATE_CHANGED\"")
                    .contains("\"checksum\":\"" + entry.checksum() + "\"");
        }

        @Test
        @DisplayName("read-back entry still verifies")
        void readBackStillVerifies() {
            var entry = AuditEntry.create(AuditAction.FAILURE_DETECTED, "failure-detector",
                    Map.of("kind", "HIGH_LATENCY", "severity", "HIGH"), NOW);

            var restored = AuditSerializer.deserializeAudit(AuditSerializer.serialize(entry));

            assertThat(restored).isEqualTo(entry);
            assertThat(AuditVerifier.verify(restored).valid()).isTrue();
        }

        @Test
        @DisplayName("malformed JSON throws SerializationException")
        void malformedJsonThrows() {
            assertThatThrownBy(() -> AuditSerializer.deserializeAudit("{not json"))
                    .isInstanceOf(AuditSerializer.SerializationException.class);
        }

        @Test
        @DisplayName("tryDeserializeAudit returns empty on malformed JSON")
        void tryDeserializeReturnsEmpty() {
            assertThat(AuditSerializer.tryDeserializeAudit("[]")).isEmpty();
        }
    }

    @Nested
    @DisplayName("notifications")
    class Notifications {

        @Test
        @DisplayName("includes audience, channel and severity")
        void includesRoutingFields() {
            var notification = Notification.of(Audience.ONCALL, "db-1 is down", Severity.CRITICAL, NOW);

            var json = AuditSerializer.serialize(notification);

            assertThat(json)
                    .contains("\"audience\":\"ONCALL\"")
                    .contains("\"channel\":\"PAGER\"")
                    .contains("\"severity\":\"CRITICAL\"")
                    .contains("\"sentAt\":\"2026-03-01T10:15:30Z\"");
            assertThat(AuditSerializer.deserializeNotification(json)).isEqualTo(notification);
        }
    }
}
