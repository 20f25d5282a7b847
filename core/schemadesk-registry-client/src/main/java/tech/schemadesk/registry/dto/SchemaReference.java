package tech.schemadesk.registry.dto;

/**
 * A reference from one schema to a version of another subject.
 */
public record SchemaReference(
    String name,
    String subject,
    int version
) {}
