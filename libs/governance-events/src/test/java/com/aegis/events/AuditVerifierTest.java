package com.aegis.events;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Instant;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Tests for {@link AuditEntry} creation and {@link AuditVerifier}: checksum stability and
 * tamper detection.
 */
@DisplayName("AuditVerifier")
class AuditVerifierTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:15:30Z");

    private AuditEntry sampleEntry() {
        return AuditEntry.create(AuditAction.FALLBACK_TRANSITIONED, "fallback-orchestrator",
                Map.of("service", "checkout", "from", "primary", "to", "secondary"), NOW);
    }

    @Nested
    @DisplayName("create()")
    class Create {

        @Test
        @DisplayName("computes a 64 character hex checksum")
        void computesChecksum() {
            var entry = sampleEntry();

            assertThat(entry.checksum()).hasSize(64).matches("[0-9a-f]+");
            assertThat(entry.id()).isNotBlank();
        }

        @Test
        @DisplayName("checksum does not depend on detail insertion order")
        void checksumIsOrderIndependent() {
            var a = new java.util.LinkedHashMap<String, String>();
            a.put("x", "1");
            a.put("y", "2");
            var b = new java.util.LinkedHashMap<String, String>();
            b.put("y", "2");
            b.put("x", "1");

            assertThat(AuditChecksum.compute("id-1", AuditAction.SERVICE_SETUP, "engine", a, NOW))
                    .isEqualTo(AuditChecksum.compute("id-1", AuditAction.SERVICE_SETUP, "engine", b, NOW));
        }

        @Test
        @DisplayName("separator characters inside details cannot forge another entry's checksum")
        void checksumSeparatesEmbeddedDelimiters() {
            Map<String, String> joined = Map.of("a", "1;b=2");
            Map<String, String> split = Map.of("a", "1", "b", "2");

            assertThat(AuditChecksum.compute("id-1", AuditAction.SERVICE_SETUP, "engine", joined, NOW))
                    .isNotEqualTo(AuditChecksum.compute("id-1", AuditAction.SERVICE_SETUP, "engine", split, NOW));
            assertThat(AuditChecksum.compute("id-1", AuditAction.SERVICE_SETUP, "a|b", Map.of(), NOW))
                    .isNotEqualTo(AuditChecksum.compute("id-1|a", AuditAction.SERVICE_SETUP, "b", Map.of(), NOW));
        }

        @Test
        @DisplayName("details are immutable")
        void detailsAreImmutable() {
            var entry = sampleEntry();

            assertThatThrownBy(() -> entry.details().put("k", "v"))
                    .isInstanceOf(UnsupportedOperationException.class);
        }

        @Test
        @DisplayName("rejects blank component")
        void rejectsBlankComponent() {
            assertThatThrownBy(() -> AuditEntry.create(AuditAction.SERVICE_SETUP, " ", Map.of(), NOW))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("component");
        }
    }

    @Nested
    @DisplayName("verify()")
    class Verify {

        @Test
        @DisplayName("accepts an untouched entry")
        void acceptsUntouched() {
            assertThat(AuditVerifier.verify(sampleEntry()).valid()).isTrue();
        }

        @Test
        @DisplayName("detects modified details")
        void detectsModifiedDetails() {
            var entry = sampleEntry();
            var tampered = new AuditEntry(entry.id(), entry.action(), entry.component(),
                    Map.of("service", "checkout", "from", "primary", "to", "cache"),
                    entry.timestamp(), entry.checksum());

            var result = AuditVerifier.verify(tampered);

            assertThat(result.valid()).isFalse();
            assertThat(result.errors()).singleElement().asString().contains("checksum mismatch");
        }

        @Test
        @DisplayName("detects a modified action")
        void detectsModifiedAction() {
            var entry = sampleEntry();
            var tampered = new AuditEntry(entry.id(), AuditAction.FALLBACK_RESTORED, entry.component(),
                    entry.details(), entry.timestamp(), entry.checksum());

            assertThat(AuditVerifier.verify(tampered).valid()).isFalse();
        }

        @Test
        @DisplayName("reports every missing field at once")
        void reportsAllMissingFields() {
            var broken = new AuditEntry(null, null, null, Map.of(), null, null);

            var result = AuditVerifier.verify(broken);

            assertThat(result.errors()).hasSize(5);
        }
    }
}
