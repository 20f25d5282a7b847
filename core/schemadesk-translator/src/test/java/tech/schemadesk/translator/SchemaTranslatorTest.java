package tech.schemadesk.translator;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for SchemaTranslator.
 */
class SchemaTranslatorTest {

    private final ObjectMapper mapper = new ObjectMapper();

    private SchemaTranslator translator;

    @BeforeEach
    void setUp() {
        translator = new SchemaTranslator();
    }

    private TypeTranslation translateType(String schemaJson) {
        return translator.translateType(translator.parse(schemaJson).orElseThrow());
    }

    private JsonNode json(String text) throws Exception {
        return mapper.readTree(text);
    }

    // ========================================
    // PRIMITIVES
    // ========================================

    @ParameterizedTest(name = "{0} -> {1}")
    @CsvSource(delimiter = '|', nullValues = "-", value = {
        "string  | string  | -      | -      | \"example-string\"",
        "int     | integer | -      | -      | 42",
        "long    | integer | int64  | -      | 1234567890",
        "float   | number  | float  | -      | 3.14",
        "double  | number  | double | -      | 3.14159",
        "boolean | boolean | -      | -      | true",
        "bytes   | string  | -      | base64 | \"base64-encoded-data\"",
        "null    | null    | -      | -      | null"
    })
    @DisplayName("primitive kinds map to fixed descriptive types and example literals")
    void primitives_shouldMapToFixedTypeAndExample(String avro, String type, String format,
                                                   String encoding, String example) {
        TypeTranslation translation = translateType("\"" + avro + "\"");

        assertThat(translation.node().type()).isEqualTo(type);
        assertThat(translation.node().format()).isEqualTo(format);
        assertThat(translation.node().contentEncoding()).isEqualTo(encoding);
        assertThat(translation.example().toString()).isEqualTo(example);
        assertThat(translation.nullable()).isFalse();
    }

    @Test
    void primitiveInObjectForm_shouldMapLikeBareName() {
        assertThat(translateType("{\"type\":\"long\"}")).isEqualTo(translateType("\"long\""));
    }

    // ========================================
    // UNIONS
    // ========================================

    @Nested
    class Unions {

        @Test
        @DisplayName("[null, string] translates like string but is flagged nullable")
        void nullableUnion_shouldMatchNonNullMember() {
            TypeTranslation union = translateType("[\"null\",\"string\"]");
            TypeTranslation plain = translateType("\"string\"");

            assertThat(union.node()).isEqualTo(plain.node());
            assertThat(union.example()).isEqualTo(plain.example());
            assertThat(union.nullable()).isTrue();
        }

        @Test
        void nullOnlyUnion_shouldYieldNullNode() {
            TypeTranslation union = translateType("[\"null\"]");

            assertThat(union.node().type()).isEqualTo("null");
            assertThat(union.example().isNull()).isTrue();
        }

        @Test
        void firstNonNullMemberWins() {
            TypeTranslation union = translateType("[\"null\",\"int\",\"string\"]");

            assertThat(union.node().type()).isEqualTo("integer");
            assertThat(union.example().asInt()).isEqualTo(42);
        }

        @Test
        void unionWithoutNull_shouldNotBeNullable() {
            assertThat(translateType("[\"string\",\"int\"]").nullable()).isFalse();
        }

        @Test
        void unionOfComplexMember_shouldTranslateThatMember() {
            TypeTranslation union = translateType(
                "[\"null\",{\"type\":\"enum\",\"name\":\"Status\",\"symbols\":[\"NEW\",\"DONE\"]}]");

            assertThat(union.node().enumSymbols()).containsExactly("NEW", "DONE");
            assertThat(union.example().asText()).isEqualTo("NEW");
        }
    }

    // ========================================
    // COMPLEX TYPES
    // ========================================

    @Test
    void array_shouldWrapItemTypeWithEmptyExample() {
        TypeTranslation array = translateType("{\"type\":\"array\",\"items\":\"long\"}");

        assertThat(array.node().type()).isEqualTo("array");
        assertThat(array.node().items().type()).isEqualTo("integer");
        assertThat(array.node().items().format()).isEqualTo("int64");
        assertThat(array.example().isArray()).isTrue();
        assertThat(array.example()).isEmpty();
    }

    @Test
    @DisplayName("whole-schema enum yields string node with symbol set and first symbol as example")
    void enum_shouldYieldStringWithSymbols() {
        TranslatedSchema translated = translator.translate("{\"type\":\"enum\",\"name\":\"Letter\",\"symbols\":[\"A\",\"B\"]}");

        assertThat(translated.schema().type()).isEqualTo("string");
        assertThat(translated.schema().enumSymbols()).containsExactly("A", "B");
        assertThat(translated.example().asText()).isEqualTo("A");
    }

    @Test
    void emptyEnum_shouldUsePlaceholderExample() {
        TypeTranslation translation = translateType("{\"type\":\"enum\",\"name\":\"Empty\",\"symbols\":[]}");

        assertThat(translation.node().enumSymbols()).isEmpty();
        assertThat(translation.example().asText()).isEqualTo("ENUM_VALUE").isNotEmpty();
    }

    @ParameterizedTest
    @CsvSource({
        "long, timestamp-millis, date-time, 2024-01-01T12:00:00Z",
        "long, timestamp-micros, date-time, 2024-01-01T12:00:00Z",
        "int,  date,             date,      2024-01-01",
        "string, uuid,           uuid,      123e4567-e89b-12d3-a456-426614174000"
    })
    void logicalTypes_shouldOverridePrimitiveWithFormattedString(String base, String logical,
                                                                 String format, String example) {
        TypeTranslation translation = translateType(
            "{\"type\":\"" + base + "\",\"logicalType\":\"" + logical + "\"}");

        assertThat(translation.node().type()).isEqualTo("string");
        assertThat(translation.node().format()).isEqualTo(format);
        assertThat(translation.example().asText()).isEqualTo(example);
    }

    @Test
    void unknownLogicalType_shouldKeepBasePrimitiveMapping() {
        TypeTranslation decimal = translateType(
            "{\"type\":\"bytes\",\"logicalType\":\"decimal\",\"precision\":9,\"scale\":2}");

        assertThat(decimal).isEqualTo(translateType("\"bytes\""));
    }

    @Test
    void namedReferenceAndMap_shouldDegradeToGenericString() {
        TypeTranslation reference = translateType("\"com.acme.Address\"");
        TypeTranslation map = translateType("{\"type\":\"map\",\"values\":\"string\"}");

        for (TypeTranslation translation : new TypeTranslation[] {reference, map}) {
            assertThat(translation.node().type()).isEqualTo("string");
            assertThat(translation.example().asText()).isEqualTo("example");
        }
    }

    // ========================================
    // RECORDS AND THE FIELD RULE
    // ========================================

    @Nested
    class Records {

        private static final String ORDER = """
            {"type":"record","name":"Order","doc":"An order",
             "fields":[
               {"name":"id","type":"string","doc":"Order id"},
               {"name":"quantity","type":"int","default":0},
               {"name":"gift","type":"boolean","default":false},
               {"name":"note","type":"string","default":""},
               {"name":"coupon","type":["null","string"],"default":null},
               {"name":"comment","type":["null","string"]},
               {"name":"createdAt","type":{"type":"long","logicalType":"timestamp-millis"}},
               {"name":"customer","type":{"type":"record","name":"Customer",
                  "fields":[{"name":"name","type":"string"}]}},
               {"name":"tags","type":{"type":"array","items":"string"}}
             ]}
            """;

        @Test
        void record_shouldExpandTopLevelFieldsInOrder() {
            TranslatedSchema translated = translator.translate(ORDER);

            assertThat(translated.schema().type()).isEqualTo("object");
            assertThat(translated.schema().description()).isEqualTo("An order");
            assertThat(translated.schema().properties()).containsOnlyKeys(
                "id", "quantity", "gift", "note", "coupon", "comment", "createdAt", "customer", "tags");
            assertThat(translated.schema().properties().get("id").description()).isEqualTo("Order id");
        }

        @Test
        @DisplayName("falsy-but-present defaults are used verbatim as examples")
        void defaults_shouldBeUsedVerbatim() throws Exception {
            JsonNode example = translator.translate(ORDER).example();

            assertThat(example.get("quantity")).isEqualTo(json("0"));
            assertThat(example.get("gift")).isEqualTo(json("false"));
            assertThat(example.get("note")).isEqualTo(json("\"\""));
            assertThat(example.has("coupon")).isTrue();
            assertThat(example.get("coupon").isNull()).isTrue();
        }

        @Test
        void defaults_shouldBeAttachedToPropertyNode() throws Exception {
            DescriptiveNode quantity = translator.translate(ORDER).schema().properties().get("quantity");

            assertThat(quantity.defaultValue()).isEqualTo(json("0"));
        }

        @Test
        void fieldsWithoutDefault_shouldUseGeneratedExamples() {
            JsonNode example = translator.translate(ORDER).example();

            assertThat(example.get("id").asText()).isEqualTo("example-string");
            assertThat(example.get("comment").asText()).isEqualTo("example-string");
            assertThat(example.get("createdAt").asText()).isEqualTo("2024-01-01T12:00:00Z");
            assertThat(example.get("customer").isObject()).isTrue();
            assertThat(example.get("customer")).isEmpty();
            assertThat(example.get("tags").isArray()).isTrue();
        }

        @Test
        @DisplayName("required = no default and not a nullable union")
        void required_shouldFollowFieldRule() {
            DescriptiveNode schema = translator.translate(ORDER).schema();

            assertThat(schema.required()).containsExactly("id", "createdAt", "customer", "tags");
        }

        @Test
        void nestedRecord_shouldNotBeExpanded() {
            DescriptiveNode customer = translator.translate(ORDER).schema().properties().get("customer");

            assertThat(customer.type()).isEqualTo("object");
            assertThat(customer.properties()).isNull();
        }

        @Test
        void fieldWithoutType_shouldDegradeToGenericString() {
            TranslatedSchema translated = translator.translate(
                "{\"type\":\"record\",\"name\":\"R\",\"fields\":[{\"name\":\"broken\"}]}");

            assertThat(translated.schema().properties().get("broken").type()).isEqualTo("string");
            assertThat(translated.example().get("broken").asText()).isEqualTo("example");
        }

        @Test
        void translation_shouldBeDeterministic() {
            assertThat(translator.translate(ORDER)).isEqualTo(translator.translate(ORDER));
        }
    }

    // ========================================
    // DEGRADATION
    // ========================================

    @Test
    @DisplayName("malformed text does not throw and yields a diagnostic generic node")
    void malformedInput_shouldYieldDiagnosticNode() {
        TranslatedSchema translated = translator.translate("not json");

        assertThat(translated.schema().type()).isEqualTo("object");
        assertThat(translated.schema().description())
            .isNotBlank()
            .startsWith("Schema conversion error");
        assertThat(translated.schema().properties()).isNull();
        assertThat(translated.example().isObject()).isTrue();
        assertThat(translated.example()).isEmpty();
    }

    @Test
    void blankInput_shouldYieldDiagnosticNode() {
        assertThat(translator.translate("  ").schema().description()).contains("empty schema");
        assertThat(translator.translate(null).example()).isEmpty();
    }

    @Test
    void descriptiveNode_shouldSerializeAsJsonSchema() throws Exception {
        TranslatedSchema translated = translator.translate(
            "{\"type\":\"record\",\"name\":\"R\",\"fields\":[{\"name\":\"s\",\"type\":{\"type\":\"enum\",\"name\":\"E\",\"symbols\":[\"X\"]}}]}");

        JsonNode serialized = mapper.valueToTree(translated.schema());

        assertThat(serialized.get("type").asText()).isEqualTo("object");
        assertThat(serialized.at("/properties/s/enum/0").asText()).isEqualTo("X");
        assertThat(serialized.at("/required/0").asText()).isEqualTo("s");
        assertThat(serialized.has("format")).isFalse();
        assertThat(serialized.has("description")).isFalse();
    }
}
