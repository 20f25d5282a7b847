package tech.schemadesk.registry.dto;

import tech.schemadesk.registry.enums.SchemaType;

import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * One immutable schema version registered under a subject.
 */
public record SchemaVersion(
    String subject,
    int version,
    int id,
    SchemaType schemaType,
    String schema,
    List<SchemaReference> references
) {
    public SchemaVersion {
        schemaType = schemaType != null ? schemaType : SchemaType.AVRO;
        schema = schema != null ? schema : "";
        references = references != null ? List.copyOf(references) : List.of();
    }

    /**
     * Size of the raw schema text in UTF-8 bytes.
     */
    public int schemaSizeBytes() {
        return schema.getBytes(StandardCharsets.UTF_8).length;
    }
}
