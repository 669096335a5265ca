package com.aegis.events;

/** Transport a notification is routed through. */
public enum NotificationChannel {
    PAGER,
    CHAT,
    EMAIL,
    STATUS_PAGE,
    SMS
}
