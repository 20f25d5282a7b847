package tech.schemadesk.audit;

import java.util.List;

/**
 * Aggregate of all findings of an audit.
 *
 * <p>The status is derived from the issue and warning lists only: CRITICAL when any
 * issue was recorded, WARNING when only warnings were, OK otherwise. A check that
 * ended in ERROR does not change it by itself.
 */
public record HealthSummary(
    int totalIssues,
    int totalWarnings,
    List<String> issues,
    List<String> warnings,
    CheckStatus status
) {
    public static HealthSummary of(List<String> issues, List<String> warnings) {
        CheckStatus status = !issues.isEmpty() ? CheckStatus.CRITICAL
            : !warnings.isEmpty() ? CheckStatus.WARNING
            : CheckStatus.OK;
        return new HealthSummary(issues.size(), warnings.size(), List.copyOf(issues), List.copyOf(warnings), status);
    }
}
