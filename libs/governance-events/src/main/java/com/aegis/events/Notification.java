package com.aegis.events;

import java.time.Instant;
import java.util.UUID;

/**
 * A message destined for the paging / status-page transport.
 *
 * @param id       unique notification id
 * @param audience who the message is addressed to
 * @param message  human-readable text
 * @param severity severity of the underlying incident
 * @param channel  transport channel
 * @param sentAt   when the notification was emitted
 */
public record Notification(
        String id,
        Audience audience,
        String message,
        Severity severity,
        NotificationChannel channel,
        Instant sentAt
) {

    public Notification {
        if (audience == null) {
            throw new IllegalArgumentException("audience must not be null");
        }
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("message must not be null or blank");
        }
        if (severity == null) {
            throw new IllegalArgumentException("severity must not be null");
        }
        if (channel == null) {
            channel = audience.defaultChannel();
        }
    }

    /** Creates a notification on the audience's default channel. */
    public static Notification of(Audience audience, String message, Severity severity, Instant sentAt) {
        return new Notification(UUID.randomUUID().toString(), audience, message, severity,
                audience.defaultChannel(), sentAt);
    }

    /**
     * Returns true if this notification went out later than the audience SLA allows for an
     * incident detected at {@code detectedAt}.
     */
    public boolean breachedSla(Instant detectedAt) {
        return sentAt.isAfter(audience.notificationDeadline(detectedAt));
    }
}
