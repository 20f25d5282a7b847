package tech.schemadesk.registry.enums;

/**
 * Compatibility rule enforced by the registry for a subject or globally.
 */
public enum CompatibilityLevel {
    BACKWARD,
    BACKWARD_TRANSITIVE,
    FORWARD,
    FORWARD_TRANSITIVE,
    FULL,
    FULL_TRANSITIVE,
    NONE
}
