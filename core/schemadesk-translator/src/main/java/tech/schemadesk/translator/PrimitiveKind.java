package tech.schemadesk.translator;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

import java.util.Arrays;
import java.util.Optional;

/**
 * Avro primitive types with their JSON Schema mapping and fixed example literal.
 */
public enum PrimitiveKind {
    STRING("string", "string", null, null, JsonNodeFactory.instance.textNode("example-string")),
    INT("int", "integer", null, null, JsonNodeFactory.instance.numberNode(42)),
    LONG("long", "integer", "int64", null, JsonNodeFactory.instance.numberNode(1234567890L)),
    FLOAT("float", "number", "float", null, JsonNodeFactory.instance.numberNode(3.14)),
    DOUBLE("double", "number", "double", null, JsonNodeFactory.instance.numberNode(3.14159)),
    BOOLEAN("boolean", "boolean", null, null, JsonNodeFactory.instance.booleanNode(true)),
    BYTES("bytes", "string", null, "base64", JsonNodeFactory.instance.textNode("base64-encoded-data")),
    NULL("null", "null", null, null, JsonNodeFactory.instance.nullNode());

    private final String avroName;
    private final String jsonType;
    private final String format;
    private final String contentEncoding;
    private final JsonNode example;

    PrimitiveKind(String avroName, String jsonType, String format, String contentEncoding, JsonNode example) {
        this.avroName = avroName;
        this.jsonType = jsonType;
        this.format = format;
        this.contentEncoding = contentEncoding;
        this.example = example;
    }

    public static Optional<PrimitiveKind> fromAvroName(String name) {
        return Arrays.stream(values())
            .filter(kind -> kind.avroName.equals(name))
            .findFirst();
    }

    /**
     * Descriptive node for this primitive, carrying its precision or encoding hint.
     */
    public DescriptiveNode describe() {
        return new DescriptiveNode(jsonType, format, contentEncoding, null, null, null, null, null, null);
    }

    /**
     * Example literal. Primitive literals are immutable nodes and safe to share.
     */
    public JsonNode example() {
        return example;
    }
}
