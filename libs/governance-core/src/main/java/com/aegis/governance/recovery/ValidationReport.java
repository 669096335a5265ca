package com.aegis.governance.recovery;

import java.time.Instant;
import java.util.List;

/**
 * Result of one validation run.
 *
 * @param dependencyId validated dependency
 * @param checks       every check, in battery order
 * @param allPassed    true only if every check passed
 * @param timestamp    when the run happened
 */
public record ValidationReport(String dependencyId, List<ValidationCheck> checks, boolean allPassed,
                               Instant timestamp) {

    public ValidationReport {
        checks = List.copyOf(checks);
    }

    public List<ValidationCheck> failedChecks() {
        return checks.stream().filter(check -> !check.passed()).toList();
    }
}
