package tech.schemadesk.audit.checks;

import tech.schemadesk.audit.AuditConfig;
import tech.schemadesk.audit.AuditContext;
import tech.schemadesk.audit.CheckFindings;
import tech.schemadesk.audit.CheckResult;
import tech.schemadesk.audit.CheckStatus;
import tech.schemadesk.audit.RegistryCheck;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Flags latest schemas whose text exceeds the size threshold. Samples the first
 * subjects of the listing only.
 */
public class LargeSchemaCheck implements RegistryCheck {

    public static final String NAME = "large_schemas";

    public record LargeSchema(String subject, double sizeKb) {}

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public CheckFindings run(AuditContext context) {
        AuditConfig.LargeSchemaConfig limits = context.config().largeSchema();
        List<String> sample = context.sample(limits.sampleSize());
        List<LargeSchema> large = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        context.scan(sample, "size", subject ->
            context.client().getLatestVersion(subject).ifPresent(latest -> {
                double sizeKb = latest.schemaSizeBytes() / 1024.0;
                if (sizeKb > limits.thresholdKb()) {
                    large.add(new LargeSchema(subject, roundKb(sizeKb)));
                    warnings.add(String.format(Locale.ROOT, "%s: %.2f KB", subject, sizeKb));
                }
            }));

        int total = context.subjects().size();
        if (large.isEmpty()) {
            return CheckFindings.of(CheckResult.ok("No unusually large schemas").sampled(sample.size(), total));
        }
        CheckResult result = CheckResult.of(CheckStatus.WARNING,
                "Found " + large.size() + " large schemas (>" + limits.thresholdKb() + "KB)")
            .withDetail("largeSchemas", large)
            .sampled(sample.size(), total);
        return new CheckFindings(result, List.of(), warnings);
    }

    static double roundKb(double sizeKb) {
        return BigDecimal.valueOf(sizeKb).setScale(2, RoundingMode.HALF_UP).doubleValue();
    }
}
