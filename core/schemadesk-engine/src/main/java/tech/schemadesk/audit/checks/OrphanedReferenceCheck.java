package tech.schemadesk.audit.checks;

import org.jboss.logging.Logger;
import tech.schemadesk.audit.AuditContext;
import tech.schemadesk.audit.CheckFindings;
import tech.schemadesk.audit.CheckResult;
import tech.schemadesk.audit.CheckStatus;
import tech.schemadesk.audit.RegistryCheck;
import tech.schemadesk.registry.client.SchemaRegistryClient;
import tech.schemadesk.registry.dto.SchemaReference;
import tech.schemadesk.registry.exception.RegistryTimeoutException;
import tech.schemadesk.registry.exception.SchemaRegistryException;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Resolves the references of sampled latest schemas. A reference is orphaned when its
 * subject has no versions, or when it pins a version the subject no longer has.
 *
 * <p>A registry error on one reference skips only that reference. A timeout skips the
 * rest of the subject.
 */
public class OrphanedReferenceCheck implements RegistryCheck {

    private static final Logger LOG = Logger.getLogger(OrphanedReferenceCheck.class);

    public static final String NAME = "orphaned_refs";

    public record OrphanedReference(String subject, String missingRef, int version) {}

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public CheckFindings run(AuditContext context) {
        SchemaRegistryClient client = context.client();
        List<String> sample = context.sample(context.config().orphanedRefs().sampleSize());
        List<OrphanedReference> orphaned = new ArrayList<>();
        List<String> issues = new ArrayList<>();

        context.scan(sample, "references", subject ->
            client.getLatestVersion(subject).ifPresent(latest -> {
                for (SchemaReference reference : latest.references()) {
                    Optional<List<Integer>> versions;
                    try {
                        versions = client.getVersions(reference.subject());
                    } catch (RegistryTimeoutException e) {
                        throw e;
                    } catch (SchemaRegistryException e) {
                        LOG.warnf("Could not resolve reference %s -> %s: %s", subject, reference.subject(), e.getMessage());
                        continue;
                    }
                    if (versions.isEmpty()) {
                        orphaned.add(new OrphanedReference(subject, reference.subject(), reference.version()));
                        issues.add(subject + " → " + reference.subject() + " (missing)");
                    } else if (reference.version() > 0 && !versions.get().contains(reference.version())) {
                        orphaned.add(new OrphanedReference(subject, reference.subject(), reference.version()));
                        issues.add(subject + " → " + reference.subject() + " v" + reference.version() + " (missing)");
                    }
                }
            }));

        int total = context.subjects().size();
        if (orphaned.isEmpty()) {
            return CheckFindings.of(CheckResult.ok("No orphaned references").sampled(sample.size(), total));
        }
        CheckResult result = CheckResult.of(CheckStatus.CRITICAL, "Found " + orphaned.size() + " broken references")
            .withDetail("orphaned", orphaned)
            .sampled(sample.size(), total);
        return new CheckFindings(result, issues, List.of());
    }
}
