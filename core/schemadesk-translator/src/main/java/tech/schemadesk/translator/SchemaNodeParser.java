package tech.schemadesk.translator;

import com.fasterxml.jackson.databind.JsonNode;
import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Parses an Avro schema JSON tree into {@link SchemaNode}s.
 *
 * <p>Total: shapes it does not understand become {@link SchemaNode.Unsupported}
 * instead of failing.
 */
final class SchemaNodeParser {

    private static final Logger LOG = Logger.getLogger(SchemaNodeParser.class);

    private SchemaNodeParser() {
    }

    static SchemaNode parse(JsonNode json) {
        if (json == null || json.isMissingNode() || json.isNull()) {
            return new SchemaNode.Unsupported("missing type");
        }
        if (json.isTextual()) {
            return parseName(json.asText());
        }
        if (json.isArray()) {
            return parseUnion(json);
        }
        if (json.isObject()) {
            return parseComplex(json);
        }
        return new SchemaNode.Unsupported("unexpected JSON " + json.getNodeType());
    }

    private static SchemaNode parseName(String name) {
        Optional<PrimitiveKind> primitive = PrimitiveKind.fromAvroName(name);
        if (primitive.isPresent()) {
            return new SchemaNode.Primitive(primitive.get());
        }
        return new SchemaNode.Unsupported("named type " + name);
    }

    private static SchemaNode parseUnion(JsonNode json) {
        List<SchemaNode> members = new ArrayList<>();
        boolean nullable = false;
        for (JsonNode member : json) {
            SchemaNode parsed = parse(member);
            if (parsed instanceof SchemaNode.Primitive p && p.kind() == PrimitiveKind.NULL) {
                nullable = true;
            }
            members.add(parsed);
        }
        return new SchemaNode.Union(members, nullable);
    }

    private static SchemaNode parseComplex(JsonNode json) {
        JsonNode type = json.path("type");
        String logicalType = json.path("logicalType").asText(null);

        if (logicalType != null && type.isTextual()) {
            Optional<PrimitiveKind> base = PrimitiveKind.fromAvroName(type.asText());
            if (base.isPresent()) {
                return new SchemaNode.Logical(base.get(), logicalType);
            }
        }

        if (!type.isTextual()) {
            // {"type": {...}} or {"type": [...]} wraps another schema
            return parse(type);
        }

        return switch (type.asText()) {
            case "record", "error" -> parseRecord(json);
            case "enum" -> parseEnum(json);
            case "array" -> new SchemaNode.Array(parse(json.path("items")));
            default -> parseName(type.asText());
        };
    }

    private static SchemaNode parseRecord(JsonNode json) {
        List<SchemaNode.Field> fields = new ArrayList<>();
        for (JsonNode field : json.path("fields")) {
            String name = field.path("name").asText(null);
            if (name == null) {
                LOG.warnf("Skipping field without a name in record %s", json.path("name").asText("<anonymous>"));
                continue;
            }
            fields.add(new SchemaNode.Field(
                name,
                field.path("doc").asText(null),
                parse(field.get("type")),
                field.has("default") ? field.get("default") : null
            ));
        }
        return new SchemaNode.RecordType(json.path("name").asText(null), json.path("doc").asText(null), fields);
    }

    private static SchemaNode parseEnum(JsonNode json) {
        List<String> symbols = new ArrayList<>();
        for (JsonNode symbol : json.path("symbols")) {
            if (symbol.isTextual()) {
                symbols.add(symbol.asText());
            }
        }
        return new SchemaNode.EnumType(json.path("name").asText(null), symbols);
    }
}
