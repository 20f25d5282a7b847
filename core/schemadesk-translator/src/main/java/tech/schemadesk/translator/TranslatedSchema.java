package tech.schemadesk.translator;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * A whole wire schema translated into a descriptive JSON Schema plus an example payload.
 *
 * <p>A schema that could not be translated still yields a value: a generic object node
 * whose description carries the diagnostic, and an empty example mapping.
 */
public record TranslatedSchema(
    DescriptiveNode schema,
    JsonNode example
) {}
