package tech.schemadesk.translator;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * Parsed shape of an Avro schema node.
 *
 * <p>A recursive variant with one record per node kind:
 * <ul>
 *   <li>{@link Primitive} - string, int, long, float, double, boolean, bytes, null</li>
 *   <li>{@link Union} - ordered members plus whether {@code null} was one of them</li>
 *   <li>{@link Array} - item type</li>
 *   <li>{@link RecordType} - ordered named fields</li>
 *   <li>{@link EnumType} - ordered symbols</li>
 *   <li>{@link Logical} - a primitive annotated with a logical type tag</li>
 *   <li>{@link Unsupported} - anything else (maps, fixed, named references, garbage)</li>
 * </ul>
 */
public sealed interface SchemaNode permits SchemaNode.Primitive, SchemaNode.Union, SchemaNode.Array,
    SchemaNode.RecordType, SchemaNode.EnumType, SchemaNode.Logical, SchemaNode.Unsupported {

    record Primitive(PrimitiveKind kind) implements SchemaNode {}

    record Union(List<SchemaNode> members, boolean nullable) implements SchemaNode {
        public Union {
            members = List.copyOf(members);
        }
    }

    record Array(SchemaNode items) implements SchemaNode {}

    record RecordType(String name, String doc, List<Field> fields) implements SchemaNode {
        public RecordType {
            fields = List.copyOf(fields);
        }
    }

    record EnumType(String name, List<String> symbols) implements SchemaNode {
        public EnumType {
            symbols = List.copyOf(symbols);
        }
    }

    record Logical(PrimitiveKind base, String logicalType) implements SchemaNode {}

    record Unsupported(String reason) implements SchemaNode {}

    /**
     * A record field. {@code defaultValue} is Java {@code null} when the field declares
     * no default; an explicit JSON {@code null} default is a {@code NullNode}.
     */
    record Field(String name, String doc, SchemaNode type, JsonNode defaultValue) {

        public boolean hasDefault() {
            return defaultValue != null;
        }
    }
}
