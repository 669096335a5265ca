package com.aegis.governance.engine;

import com.aegis.events.Audience;
import com.aegis.events.Notification;
import com.aegis.events.Severity;
import com.aegis.governance.spi.NotificationSink;
import com.aegis.governance.support.BoundedLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;

/** Emits notifications to the {@link NotificationSink} and keeps the most recent ones. */
final class Notifier {

    private static final Logger log = LoggerFactory.getLogger(Notifier.class);

    private final NotificationSink sink;
    private final Clock clock;
    private final BoundedLog<Notification> sent;

    Notifier(NotificationSink sink, Clock clock, int retention) {
        this.sink = sink;
        this.sent = new BoundedLog<>(retention);
        this.clock = clock;
    }

    Notification notify(Audience audience, String message, Severity severity) {
        Notification notification = Notification.of(audience, message, severity, clock.instant());
        sent.append(notification);
        try {
            sink.send(notification);
        } catch (RuntimeException e) {
            log.error("Notification {} to {} could not be delivered", notification.id(), audience, e);
        }
        return notification;
    }

    List<Notification> sent() {
        return sent.snapshot();
    }
}
