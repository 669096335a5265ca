package com.aegis.events;

import java.time.Duration;
import java.time.Instant;

/**
 * Who a notification is addressed to.
 *
 * <p>Each audience carries a fixed notification SLA: the maximum time between an incident being
 * detected and the audience being told about it. Callers compare a notification's
 * {@code sentAt} against {@link #notificationDeadline(Instant)} to detect breaches.
 */
public enum Audience {
    USERS,
    CUSTOMERS,
    INTERNAL,
    LEADERSHIP,
    ONCALL,
    PUBLIC;

    /** Notification SLA in minutes. */
    public int slaMinutes() {
        return switch (this) {
            case ONCALL -> 5;
            case INTERNAL -> 10;
            case CUSTOMERS -> 15;
            case USERS, LEADERSHIP -> 30;
            case PUBLIC -> 60;
        };
    }

    /** Default channel used to reach this audience. */
    public NotificationChannel defaultChannel() {
        return switch (this) {
            case ONCALL -> NotificationChannel.PAGER;
            case INTERNAL -> NotificationChannel.CHAT;
            case LEADERSHIP, CUSTOMERS -> NotificationChannel.EMAIL;
            case USERS, PUBLIC -> NotificationChannel.STATUS_PAGE;
        };
    }

    /** Latest instant at which an incident detected at {@code detectedAt} must be notified. */
    public Instant notificationDeadline(Instant detectedAt) {
        return detectedAt.plus(Duration.ofMinutes(slaMinutes()));
    }
}
