package tech.schemadesk.audit.checks;

import tech.schemadesk.audit.AuditContext;
import tech.schemadesk.audit.CheckFindings;
import tech.schemadesk.audit.CheckResult;
import tech.schemadesk.audit.CheckStatus;
import tech.schemadesk.audit.RegistryCheck;
import tech.schemadesk.registry.dto.CompatibilityConfig;

import java.util.ArrayList;
import java.util.List;

/**
 * Collects sampled subjects whose own compatibility level is NONE. Subjects without
 * an override inherit the global level and are not counted.
 */
public class CompatibilityCheck implements RegistryCheck {

    public static final String NAME = "compatibility";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public CheckFindings run(AuditContext context) {
        CompatibilityConfig global = context.client().getConfig();
        List<String> sample = context.sample(context.config().compatibility().sampleSize());
        List<String> noneCompat = new ArrayList<>();

        context.scan(sample, "config", subject ->
            context.client().getConfig(subject)
                .filter(CompatibilityConfig::isNone)
                .ifPresent(config -> noneCompat.add(subject)));

        int total = context.subjects().size();
        if (noneCompat.isEmpty()) {
            return CheckFindings.of(CheckResult.ok("Compatibility configs look good")
                .withDetail("globalConfig", global)
                .sampled(sample.size(), total));
        }
        String message = noneCompat.size() + " subjects with NONE compatibility";
        CheckResult result = CheckResult.of(CheckStatus.WARNING, message)
            .withDetail("globalConfig", global)
            .withDetail("noneCompatCount", noneCompat.size())
            .withDetail("subjects", noneCompat)
            .sampled(sample.size(), total);
        return CheckFindings.warning(result, message);
    }
}
