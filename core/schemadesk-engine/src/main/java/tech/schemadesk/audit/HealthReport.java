package tech.schemadesk.audit;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Result of a full registry audit. Checks are kept in execution order.
 */
public record HealthReport(
    Instant timestamp,
    String endpoint,
    Map<String, CheckResult> checks,
    HealthSummary summary
) {
    public HealthReport {
        checks = Collections.unmodifiableMap(new LinkedHashMap<>(checks));
    }

    public CheckStatus status() {
        return summary.status();
    }

    /**
     * Process exit code for command line wrappers: 2 for CRITICAL, 1 for WARNING, 0 otherwise.
     */
    public int exitCode() {
        return switch (summary.status()) {
            case CRITICAL -> 2;
            case WARNING -> 1;
            default -> 0;
        };
    }
}
