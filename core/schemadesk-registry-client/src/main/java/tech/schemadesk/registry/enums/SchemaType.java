package tech.schemadesk.registry.enums;

/**
 * Schema format of a registered version.
 */
public enum SchemaType {
    AVRO,
    JSON,
    PROTOBUF
}
