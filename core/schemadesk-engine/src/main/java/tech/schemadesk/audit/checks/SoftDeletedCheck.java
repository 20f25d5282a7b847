package tech.schemadesk.audit.checks;

import tech.schemadesk.audit.AuditContext;
import tech.schemadesk.audit.CheckFindings;
import tech.schemadesk.audit.CheckResult;
import tech.schemadesk.audit.CheckStatus;
import tech.schemadesk.audit.RegistryCheck;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Counts subjects that appear only in the listing that includes deleted subjects.
 */
public class SoftDeletedCheck implements RegistryCheck {

    public static final String NAME = "soft_deleted";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public CheckFindings run(AuditContext context) {
        List<String> withDeleted = context.client().listSubjects(true);
        Set<String> active = new HashSet<>(context.subjects());
        List<String> softDeleted = withDeleted.stream()
            .filter(subject -> !active.contains(subject))
            .toList();

        if (softDeleted.isEmpty()) {
            return CheckFindings.of(CheckResult.ok("No soft-deleted subjects"));
        }
        int count = softDeleted.size();
        int limit = Math.min(count, context.config().softDeleted().listingLimit());
        CheckResult result = CheckResult.of(CheckStatus.WARNING, count + " subjects in soft-delete state")
            .withDetail("count", count)
            .withDetail("subjects", softDeleted.subList(0, limit));
        return CheckFindings.warning(result, count + " soft-deleted subjects");
    }
}
