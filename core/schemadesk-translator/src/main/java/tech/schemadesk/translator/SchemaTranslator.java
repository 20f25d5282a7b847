package tech.schemadesk.translator;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Translates Avro schemas into descriptive JSON Schema plus a synthetic example payload.
 *
 * <p>Translation never fails. Unrecognised shapes become a generic {@code string} node
 * with a placeholder example, and text that is not JSON becomes a generic object node
 * whose description explains why. Callers detect degradation from the content, not
 * from the absence of output.
 *
 * <p>Simplifications:
 * <ul>
 *   <li>Unions translate their first non-null member only.</li>
 *   <li>Only the top-level record is expanded field by field; nested records are
 *       untyped objects.</li>
 *   <li>Maps, fixed and named type references degrade to the generic node.</li>
 * </ul>
 */
@ApplicationScoped
public class SchemaTranslator {

    private static final Logger LOG = Logger.getLogger(SchemaTranslator.class);

    static final String PLACEHOLDER_EXAMPLE = "example";
    static final String ENUM_PLACEHOLDER = "ENUM_VALUE";

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private final ObjectMapper objectMapper = new ObjectMapper();

    /**
     * Translate a schema text as stored in the registry.
     */
    public TranslatedSchema translate(String schemaText) {
        if (schemaText == null || schemaText.isBlank()) {
            return conversionError("empty schema");
        }

        JsonNode json;
        try {
            json = objectMapper.readTree(schemaText);
        } catch (JsonProcessingException e) {
            return conversionError(e.getOriginalMessage());
        }

        SchemaNode root = SchemaNodeParser.parse(json);
        if (root instanceof SchemaNode.RecordType record) {
            return translateRecord(record);
        }

        TypeTranslation translation = translateType(root);
        return new TranslatedSchema(translation.node(), translation.example());
    }

    /**
     * Parse a schema text into its {@link SchemaNode} form, or empty if it is not JSON.
     */
    public Optional<SchemaNode> parse(String schemaText) {
        if (schemaText == null || schemaText.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(SchemaNodeParser.parse(objectMapper.readTree(schemaText)));
        } catch (JsonProcessingException e) {
            LOG.debugf("Schema text is not JSON: %s", e.getOriginalMessage());
            return Optional.empty();
        }
    }

    /**
     * Translate a single schema node. Pure and deterministic; does not apply the
     * field-level default/required rule.
     */
    public TypeTranslation translateType(SchemaNode node) {
        if (node instanceof SchemaNode.Primitive primitive) {
            return new TypeTranslation(primitive.kind().describe(), primitive.kind().example(), false);
        }
        if (node instanceof SchemaNode.Union union) {
            return translateUnion(union);
        }
        if (node instanceof SchemaNode.Array array) {
            TypeTranslation items = translateType(array.items());
            return new TypeTranslation(DescriptiveNode.arrayOf(items.node()), NODES.arrayNode(), false);
        }
        if (node instanceof SchemaNode.RecordType) {
            return new TypeTranslation(DescriptiveNode.ofType(DescriptiveNode.OBJECT), NODES.objectNode(), false);
        }
        if (node instanceof SchemaNode.EnumType enumType) {
            List<String> symbols = enumType.symbols();
            JsonNode example = NODES.textNode(symbols.isEmpty() ? ENUM_PLACEHOLDER : symbols.get(0));
            return new TypeTranslation(DescriptiveNode.enumeration(symbols), example, false);
        }
        if (node instanceof SchemaNode.Logical logical) {
            return translateLogical(logical);
        }
        return generic();
    }

    private TypeTranslation translateUnion(SchemaNode.Union union) {
        for (SchemaNode member : union.members()) {
            if (!isNull(member)) {
                TypeTranslation first = translateType(member);
                return new TypeTranslation(first.node(), first.example(), union.nullable());
            }
        }
        return new TypeTranslation(PrimitiveKind.NULL.describe(), PrimitiveKind.NULL.example(), union.nullable());
    }

    private TypeTranslation translateLogical(SchemaNode.Logical logical) {
        return LogicalKind.fromTag(logical.logicalType())
            .map(kind -> new TypeTranslation(
                DescriptiveNode.formatted(kind.format()), NODES.textNode(kind.example()), false))
            .orElseGet(() -> translateType(new SchemaNode.Primitive(logical.base())));
    }

    private TranslatedSchema translateRecord(SchemaNode.RecordType record) {
        Map<String, DescriptiveNode> properties = new LinkedHashMap<>();
        List<String> required = new ArrayList<>();
        ObjectNode example = NODES.objectNode();

        for (SchemaNode.Field field : record.fields()) {
            try {
                TypeTranslation translation = translateType(field.type());
                DescriptiveNode property = translation.node();
                if (field.doc() != null) {
                    property = property.withDescription(field.doc());
                }

                if (field.hasDefault()) {
                    properties.put(field.name(), property.withDefault(field.defaultValue().deepCopy()));
                    example.set(field.name(), field.defaultValue().deepCopy());
                } else {
                    properties.put(field.name(), property);
                    example.set(field.name(), translation.example().deepCopy());
                    if (!translation.nullable()) {
                        required.add(field.name());
                    }
                }
            } catch (RuntimeException e) {
                LOG.warnf(e, "Field conversion error for %s.%s", record.name(), field.name());
                properties.put(field.name(),
                    DescriptiveNode.ofType(DescriptiveNode.STRING).withDescription("Field conversion error: " + e.getMessage()));
                example.put(field.name(), PLACEHOLDER_EXAMPLE);
            }
        }

        DescriptiveNode schema = DescriptiveNode.object(record.doc(), properties, required);
        return new TranslatedSchema(schema, example);
    }

    private static boolean isNull(SchemaNode node) {
        return node instanceof SchemaNode.Primitive primitive && primitive.kind() == PrimitiveKind.NULL;
    }

    private static TypeTranslation generic() {
        return new TypeTranslation(DescriptiveNode.ofType(DescriptiveNode.STRING), NODES.textNode(PLACEHOLDER_EXAMPLE), false);
    }

    private static TranslatedSchema conversionError(String reason) {
        LOG.warnf("Schema conversion error: %s", reason);
        return new TranslatedSchema(
            DescriptiveNode.conversionError("Schema conversion error: " + reason),
            NODES.objectNode()
        );
    }
}
