package com.aegis.governance.spi;

import com.aegis.events.Notification;

/**
 * Paging / status-page transport. Implementations must be safe for concurrent use and must not
 * block the caller on delivery.
 */
@FunctionalInterface
public interface NotificationSink {

    void send(Notification notification);
}
