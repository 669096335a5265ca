package com.aegis.governance.testing;

import com.aegis.events.Audience;
import com.aegis.events.Notification;
import com.aegis.governance.spi.NotificationSink;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/** Collects notifications in memory for assertions. */
public final class InMemoryNotificationSink implements NotificationSink {

    private final List<Notification> sent = new CopyOnWriteArrayList<>();

    @Override
    public void send(Notification notification) {
        sent.add(notification);
    }

    public List<Notification> sent() {
        return List.copyOf(sent);
    }

    public List<Notification> sentTo(Audience audience) {
        return sent.stream().filter(n -> n.audience() == audience).toList();
    }
}
