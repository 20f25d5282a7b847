package tech.schemadesk.audit.checks;

import tech.schemadesk.audit.AuditConfig;
import tech.schemadesk.audit.AuditContext;
import tech.schemadesk.audit.CheckFindings;
import tech.schemadesk.audit.CheckResult;
import tech.schemadesk.audit.CheckStatus;
import tech.schemadesk.audit.RegistryCheck;

/**
 * Flags registries with many subjects.
 *
 * <p>The warning threshold is tested first, so unless
 * {@code subject-count.escalate-critical} is set, counts above the critical threshold
 * are still reported as WARNING.
 */
public class SubjectCountCheck implements RegistryCheck {

    public static final String NAME = "subject_count";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public CheckFindings run(AuditContext context) {
        AuditConfig.SubjectCountConfig thresholds = context.config().subjectCount();
        int count = context.subjects().size();
        String message = "Total subjects: " + count;

        if (thresholds.escalateCritical() && count > thresholds.criticalThreshold()) {
            return CheckFindings.issue(
                CheckResult.of(CheckStatus.CRITICAL, message).withDetail("count", count),
                "Very high subject count: " + count);
        }
        if (count > thresholds.warningThreshold()) {
            return CheckFindings.warning(
                CheckResult.of(CheckStatus.WARNING, message).withDetail("count", count),
                "High subject count: " + count);
        }
        return CheckFindings.of(CheckResult.ok(message).withDetail("count", count));
    }
}
