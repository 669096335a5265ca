package com.aegis.governance.engine;

import com.aegis.events.AuditAction;
import com.aegis.events.AuditEntry;
import com.aegis.events.DetailRedactor;
import com.aegis.governance.spi.AuditSink;
import com.aegis.governance.support.BoundedLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Map;

/**
 * Builds checksummed audit entries and forwards them to the {@link AuditSink}. The most recent
 * entries are also kept locally. A failing sink is logged and counted.
 */
final class AuditTrail {

    private static final Logger log = LoggerFactory.getLogger(AuditTrail.class);

    private final AuditSink sink;
    private final DetailRedactor redactor;
    private final GovernorMetrics metrics;
    private final Clock clock;
    private final BoundedLog<AuditEntry> entries;

    AuditTrail(AuditSink sink, DetailRedactor redactor, GovernorMetrics metrics, Clock clock, int retention) {
        this.sink = sink;
        this.entries = new BoundedLog<>(retention);
        this.redactor = redactor;
        this.metrics = metrics;
        this.clock = clock;
    }

    AuditEntry record(AuditAction action, String component, Map<String, String> details) {
        AuditEntry entry = AuditEntry.create(action, component, redactor.redact(details), clock.instant());
        entries.append(entry);
        try {
            sink.record(entry);
        } catch (RuntimeException e) {
            metrics.auditSinkFailure();
            log.error("Audit sink rejected entry {} ({})", entry.id(), action, e);
        }
        return entry;
    }

    List<AuditEntry> entries() {
        return entries.snapshot();
    }
}
