package com.aegis.events;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("DetailRedactor")
class DetailRedactorTest {

    private final DetailRedactor redactor = new DetailRedactor();

    @Test
    @DisplayName("masks credential-like keys case-insensitively")
    void masksSensitiveKeys() {
        var details = Map.of("dependency", "db-1", "ConnectionString", "jdbc:postgresql://u:p@db",
                "authToken", "abc");

        var redacted = redactor.redact(details);

        assertThat(redacted)
                .containsEntry("dependency", "db-1")
                .containsEntry("ConnectionString", DetailRedactor.REDACTED)
                .containsEntry("authToken", DetailRedactor.REDACTED);
    }

    @Test
    @DisplayName("replaces null values with empty strings")
    void replacesNullValues() {
        var details = new LinkedHashMap<String, String>();
        details.put("error", null);

        assertThat(redactor.redact(details)).containsEntry("error", "");
    }

    @Test
    @DisplayName("returns an empty map for null input")
    void nullInput() {
        assertThat(redactor.redact(null)).isEmpty();
    }

    @Test
    @DisplayName("rejects an empty key set")
    void rejectsEmptyKeys() {
        assertThatThrownBy(() -> new DetailRedactor(Set.of()))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
