package com.aegis.governor.infrastructure;

import com.aegis.events.AuditSerializer;
import com.aegis.events.Notification;
import com.aegis.events.Severity;
import com.aegis.governance.spi.NotificationSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Logs notifications instead of delivering them. HIGH and CRITICAL notifications are logged at
 * WARN.
 */
public class LoggingNotificationSink implements NotificationSink {

    public static final String LOGGER_NAME = "aegis.notifications";

    private static final Logger log = LoggerFactory.getLogger(LOGGER_NAME);

    @Override
    public void send(Notification notification) {
        String json = AuditSerializer.serialize(notification);
        if (notification.severity().isAtLeast(Severity.HIGH)) {
            log.warn(json);
        } else {
            log.info(json);
        }
    }
}
