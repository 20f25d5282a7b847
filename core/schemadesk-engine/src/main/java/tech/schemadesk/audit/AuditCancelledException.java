package tech.schemadesk.audit;

/**
 * Thrown inside a check when its audit has been cancelled.
 */
public class AuditCancelledException extends RuntimeException {

    public static final String MESSAGE = "Audit cancelled";

    public AuditCancelledException() {
        super(MESSAGE);
    }
}
