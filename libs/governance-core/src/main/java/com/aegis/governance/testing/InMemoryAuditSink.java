package com.aegis.governance.testing;

import com.aegis.events.AuditAction;
import com.aegis.events.AuditEntry;
import com.aegis.governance.spi.AuditSink;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/** Collects audit entries in memory for assertions. */
public final class InMemoryAuditSink implements AuditSink {

    private final List<AuditEntry> entries = new CopyOnWriteArrayList<>();

    @Override
    public void record(AuditEntry entry) {
        entries.add(entry);
    }

    public List<AuditEntry> entries() {
        return List.copyOf(entries);
    }

    public List<AuditEntry> entries(AuditAction action) {
        return entries.stream().filter(e -> e.action() == action).toList();
    }

    public void clear() {
        entries.clear();
    }
}
