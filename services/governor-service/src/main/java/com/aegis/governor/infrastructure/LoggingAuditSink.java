package com.aegis.governor.infrastructure;

import com.aegis.events.AuditEntry;
import com.aegis.events.AuditSerializer;
import com.aegis.governance.spi.AuditSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes each audit entry as one JSON line to the {@value #LOGGER_NAME} logger, so a log shipper
 * can forward the trail to durable storage.
 */
public class LoggingAuditSink implements AuditSink {

    public static final String LOGGER_NAME = "aegis.audit";

    private static final Logger audit = LoggerFactory.getLogger(LOGGER_NAME);

    @Override
    public void record(AuditEntry entry) {
        audit.info(AuditSerializer.serialize(entry));
    }
}
