package tech.schemadesk.audit.checks;

import tech.schemadesk.audit.AuditContext;
import tech.schemadesk.audit.CheckFindings;
import tech.schemadesk.audit.CheckResult;
import tech.schemadesk.audit.CheckStatus;
import tech.schemadesk.audit.RegistryCheck;
import tech.schemadesk.registry.exception.RegistryTimeoutException;

/**
 * Lists subjects once. Any failure is CRITICAL.
 */
public class ConnectivityCheck implements RegistryCheck {

    public static final String NAME = "connectivity";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public CheckFindings run(AuditContext context) {
        try {
            context.subjects();
            return CheckFindings.of(CheckResult.ok("Schema Registry is reachable"));
        } catch (RegistryTimeoutException e) {
            return unreachable("Connection timeout (>" + e.getTimeout().toSeconds() + "s)");
        } catch (RuntimeException e) {
            return unreachable(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        }
    }

    private static CheckFindings unreachable(String message) {
        return CheckFindings.issue(CheckResult.of(CheckStatus.CRITICAL, message), "Connectivity: " + message);
    }
}
