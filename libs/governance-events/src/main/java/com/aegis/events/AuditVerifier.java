package com.aegis.events;

import java.util.ArrayList;
import java.util.List;

/**
 * Checks audit entries read back from the persistence layer for completeness and tampering.
 * All problems are reported at once.
 */
public final class AuditVerifier {

    private AuditVerifier() {
        // utility class
    }

    public static ValidationResult verify(AuditEntry entry) {
        if (entry == null) {
            return ValidationResult.fail(List.of("entry must not be null"));
        }
        var errors = new ArrayList<String>();

        if (isBlank(entry.id())) {
            errors.add("id must not be null or blank");
        }
        if (entry.action() == null) {
            errors.add("action must not be null");
        }
        if (isBlank(entry.component())) {
            errors.add("component must not be null or blank");
        }
        if (entry.timestamp() == null) {
            errors.add("timestamp must not be null");
        }
        if (isBlank(entry.checksum())) {
            errors.add("checksum must not be null or blank");
        } else if (errors.isEmpty() && !AuditChecksum.compute(entry).equals(entry.checksum())) {
            errors.add("checksum mismatch: entry " + entry.id() + " was modified after it was recorded");
        }

        return errors.isEmpty() ? ValidationResult.ok() : ValidationResult.fail(errors);
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
