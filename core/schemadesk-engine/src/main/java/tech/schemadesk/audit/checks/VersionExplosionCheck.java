package tech.schemadesk.audit.checks;

import tech.schemadesk.audit.AuditConfig;
import tech.schemadesk.audit.AuditContext;
import tech.schemadesk.audit.CheckFindings;
import tech.schemadesk.audit.CheckResult;
import tech.schemadesk.audit.CheckStatus;
import tech.schemadesk.audit.RegistryCheck;

import java.util.ArrayList;
import java.util.List;

/**
 * Scans every subject for an excessive number of versions.
 */
public class VersionExplosionCheck implements RegistryCheck {

    public static final String NAME = "version_explosion";

    public record Explosion(String subject, int versions) {}

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public CheckFindings run(AuditContext context) {
        AuditConfig.VersionsConfig thresholds = context.config().versions();
        List<Explosion> explosions = new ArrayList<>();
        List<String> issues = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        context.scan(context.subjects(), "versions", subject ->
            context.client().getVersions(subject).ifPresent(versions -> {
                int count = versions.size();
                if (count > thresholds.warningThreshold()) {
                    explosions.add(new Explosion(subject, count));
                    if (count > thresholds.criticalThreshold()) {
                        issues.add(subject + ": " + count + " versions");
                    } else {
                        warnings.add(subject + ": " + count + " versions");
                    }
                }
            }));

        if (explosions.isEmpty()) {
            return CheckFindings.of(CheckResult.ok("No version explosions detected"));
        }
        CheckStatus status = issues.isEmpty() ? CheckStatus.WARNING : CheckStatus.CRITICAL;
        CheckResult result = CheckResult.of(status,
                "Found " + explosions.size() + " subjects with >" + thresholds.warningThreshold() + " versions")
            .withDetail("explosions", explosions);
        return new CheckFindings(result, issues, warnings);
    }
}
