package com.aegis.governance.spi;

import com.aegis.events.AuditEntry;

/**
 * Persistence collaborator that stores audit entries. Implementations must be safe for concurrent
 * use; the governor calls {@link #record(AuditEntry)} from whichever thread performs the action.
 */
@FunctionalInterface
public interface AuditSink {

    void record(AuditEntry entry);
}
