package tech.schemadesk.documentation;

import com.fasterxml.jackson.databind.JsonNode;
import tech.schemadesk.registry.dto.SchemaReference;
import tech.schemadesk.registry.enums.SchemaType;

import java.util.List;

/**
 * Documentation of the latest version of one subject: registry metadata plus the
 * descriptive schema and an example payload.
 */
public record SubjectDocumentation(
    String subject,
    int version,
    int id,
    SchemaType schemaType,
    JsonNode schema,
    JsonNode example,
    List<SchemaReference> references
) {}
