package tech.schemadesk.audit;

/**
 * One independent audit check.
 *
 * <p>A check returns its findings instead of recording them anywhere. Failures it
 * cannot classify itself may be thrown; the auditor reports them as ERROR for this
 * check only.
 */
public interface RegistryCheck {

    /**
     * Key of this check in the report, e.g. {@code version_explosion}.
     */
    String name();

    CheckFindings run(AuditContext context);
}
