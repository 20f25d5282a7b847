package tech.schemadesk.audit;

/**
 * Severity of a single check, in increasing order.
 */
public enum CheckStatus {
    OK,
    WARNING,
    CRITICAL,
    ERROR
}
