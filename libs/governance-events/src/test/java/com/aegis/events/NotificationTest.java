package com.aegis.events;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/** Tests for {@link Notification} and the per-{@link Audience} notification SLA. */
@DisplayName("Notification")
class NotificationTest {

    private static final Instant DETECTED = Instant.parse("2026-03-01T10:00:00Z");

    @Test
    @DisplayName("on-call has the tightest SLA and public the loosest")
    void slaOrdering() {
        assertThat(Audience.ONCALL.slaMinutes()).isEqualTo(5);
        assertThat(Audience.PUBLIC.slaMinutes()).isEqualTo(60);
        for (Audience audience : Audience.values()) {
            assertThat(audience.slaMinutes()).isBetween(Audience.ONCALL.slaMinutes(), Audience.PUBLIC.slaMinutes());
        }
    }

    @Test
    @DisplayName("detects an SLA breach")
    void detectsBreach() {
        var onTime = Notification.of(Audience.ONCALL, "paged", Severity.HIGH, DETECTED.plus(Duration.ofMinutes(4)));
        var late = Notification.of(Audience.ONCALL, "paged", Severity.HIGH, DETECTED.plus(Duration.ofMinutes(6)));

        assertThat(onTime.breachedSla(DETECTED)).isFalse();
        assertThat(late.breachedSla(DETECTED)).isTrue();
    }

    @Test
    @DisplayName("falls back to the audience's default channel")
    void defaultsChannel() {
        var notification = new Notification("n-1", Audience.PUBLIC, "degraded", Severity.MEDIUM, null, DETECTED);

        assertThat(notification.channel()).isEqualTo(NotificationChannel.STATUS_PAGE);
    }

    @Test
    @DisplayName("rejects a blank message")
    void rejectsBlankMessage() {
        assertThatThrownBy(() -> Notification.of(Audience.USERS, "", Severity.LOW, DETECTED))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
