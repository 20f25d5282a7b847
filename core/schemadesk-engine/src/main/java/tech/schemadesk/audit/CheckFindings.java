package tech.schemadesk.audit;

import java.util.List;

/**
 * What one check found: its report entry plus the issues and warnings it contributes
 * to the summary. Each check returns its own findings; the auditor merges them.
 */
public record CheckFindings(
    CheckResult result,
    List<String> issues,
    List<String> warnings
) {
    public CheckFindings {
        issues = issues != null ? List.copyOf(issues) : List.of();
        warnings = warnings != null ? List.copyOf(warnings) : List.of();
    }

    public static CheckFindings of(CheckResult result) {
        return new CheckFindings(result, List.of(), List.of());
    }

    public static CheckFindings issue(CheckResult result, String issue) {
        return new CheckFindings(result, List.of(issue), List.of());
    }

    public static CheckFindings warning(CheckResult result, String warning) {
        return new CheckFindings(result, List.of(), List.of(warning));
    }
}
