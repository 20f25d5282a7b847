package tech.schemadesk.translator;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Result of translating one schema node.
 *
 * @param node     descriptive JSON Schema node
 * @param example  generated example value
 * @param nullable whether the source was a union containing {@code null}; feeds the
 *                 enclosing field's required flag and is not reflected in {@code node}
 */
public record TypeTranslation(
    DescriptiveNode node,
    JsonNode example,
    boolean nullable
) {}
