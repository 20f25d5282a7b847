package tech.schemadesk.audit;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.schemadesk.audit.checks.CompatibilityCheck;
import tech.schemadesk.audit.checks.ConnectivityCheck;
import tech.schemadesk.audit.checks.LargeSchemaCheck;
import tech.schemadesk.audit.checks.OrphanedReferenceCheck;
import tech.schemadesk.audit.checks.SoftDeletedCheck;
import tech.schemadesk.audit.checks.SubjectCountCheck;
import tech.schemadesk.audit.checks.VersionExplosionCheck;
import tech.schemadesk.registry.client.SchemaRegistryClient;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Audits a schema registry for structural anomalies.
 *
 * <p>Runs a fixed battery of checks in order: connectivity, subject_count,
 * version_explosion, large_schemas, compatibility, soft_deleted, orphaned_refs.
 * Each check is isolated: an exception escaping one is reported as ERROR for that
 * check and the audit carries on, so a report is always produced.
 *
 * <p>large_schemas, compatibility and orphaned_refs inspect only the first subjects
 * of the listing (see {@link AuditConfig}); their results state how many subjects
 * were sampled.
 */
@ApplicationScoped
public class RegistryHealthAuditor {

    private static final Logger LOG = Logger.getLogger(RegistryHealthAuditor.class);

    private final SchemaRegistryClient client;
    private final AuditConfig config;
    private final List<RegistryCheck> checks;

    @Inject
    public RegistryHealthAuditor(SchemaRegistryClient client, AuditConfig config) {
        this(client, config, List.of(
            new ConnectivityCheck(),
            new SubjectCountCheck(),
            new VersionExplosionCheck(),
            new LargeSchemaCheck(),
            new CompatibilityCheck(),
            new SoftDeletedCheck(),
            new OrphanedReferenceCheck()
        ));
    }

    RegistryHealthAuditor(SchemaRegistryClient client, AuditConfig config, List<RegistryCheck> checks) {
        this.client = client;
        this.config = config;
        this.checks = List.copyOf(checks);
    }

    public HealthReport auditAll() {
        return auditAll(CancellationToken.none());
    }

    /**
     * Run every check. Once the token is cancelled, the running check stops at its
     * next subject and the remaining checks report ERROR without contacting the registry.
     */
    public HealthReport auditAll(CancellationToken cancellation) {
        String endpoint = client.endpoint();
        LOG.infof("Starting schema registry audit of %s", endpoint);

        AuditContext context = new AuditContext(client, config, cancellation);
        Map<String, CheckResult> results = new LinkedHashMap<>();
        List<String> issues = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        for (RegistryCheck check : checks) {
            CheckFindings findings = runIsolated(check, context);
            results.put(check.name(), findings.result());
            issues.addAll(findings.issues());
            warnings.addAll(findings.warnings());
        }

        HealthReport report = new HealthReport(Instant.now(), endpoint, results, HealthSummary.of(issues, warnings));
        LOG.infof("Audit of %s finished: %s (%d issues, %d warnings)",
            endpoint, report.status(), issues.size(), warnings.size());
        return report;
    }

    private CheckFindings runIsolated(RegistryCheck check, AuditContext context) {
        if (context.cancellation().isCancelled()) {
            return CheckFindings.of(CheckResult.error(AuditCancelledException.MESSAGE));
        }
        LOG.debugf("Running check %s", check.name());
        try {
            return check.run(context);
        } catch (AuditCancelledException e) {
            LOG.infof("Audit cancelled during check %s", check.name());
            return CheckFindings.of(CheckResult.error(e.getMessage()));
        } catch (RuntimeException e) {
            LOG.errorf(e, "Check %s failed", check.name());
            return CheckFindings.of(CheckResult.error(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName()));
        }
    }
}
