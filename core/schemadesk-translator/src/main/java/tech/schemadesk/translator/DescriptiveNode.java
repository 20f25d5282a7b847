package tech.schemadesk.translator;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A JSON Schema node describing the shape of a translated wire schema.
 *
 * <p>Used for documentation, not for encoding. Absent keywords are {@code null}
 * and omitted when serialized.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"type", "format", "contentEncoding", "description", "enum", "items", "properties", "required", "default"})
public record DescriptiveNode(
    String type,
    String format,
    String contentEncoding,
    String description,
    @JsonProperty("enum") List<String> enumSymbols,
    DescriptiveNode items,
    Map<String, DescriptiveNode> properties,
    List<String> required,
    @JsonProperty("default") JsonNode defaultValue
) {
    public static final String STRING = "string";
    public static final String OBJECT = "object";
    public static final String ARRAY = "array";

    public DescriptiveNode {
        enumSymbols = enumSymbols != null ? List.copyOf(enumSymbols) : null;
        required = required != null ? List.copyOf(required) : null;
        properties = properties != null ? Collections.unmodifiableMap(new LinkedHashMap<>(properties)) : null;
    }

    public static DescriptiveNode ofType(String type) {
        return new DescriptiveNode(type, null, null, null, null, null, null, null, null);
    }

    public static DescriptiveNode formatted(String format) {
        return new DescriptiveNode(STRING, format, null, null, null, null, null, null, null);
    }

    public static DescriptiveNode enumeration(List<String> symbols) {
        return new DescriptiveNode(STRING, null, null, null, symbols, null, null, null, null);
    }

    public static DescriptiveNode arrayOf(DescriptiveNode items) {
        return new DescriptiveNode(ARRAY, null, null, null, null, items, null, null, null);
    }

    public static DescriptiveNode object(String description, Map<String, DescriptiveNode> properties, List<String> required) {
        return new DescriptiveNode(OBJECT, null, null, description, null, null, properties, required, null);
    }

    /**
     * Generic node returned when a schema cannot be translated.
     */
    public static DescriptiveNode conversionError(String diagnostic) {
        return new DescriptiveNode(OBJECT, null, null, diagnostic, null, null, null, null, null);
    }

    public DescriptiveNode withDescription(String text) {
        return new DescriptiveNode(type, format, contentEncoding, text, enumSymbols, items, properties, required, defaultValue);
    }

    public DescriptiveNode withDefault(JsonNode value) {
        return new DescriptiveNode(type, format, contentEncoding, description, enumSymbols, items, properties, required, value);
    }
}
