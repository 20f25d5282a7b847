package tech.schemadesk.documentation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.schemadesk.registry.client.SchemaRegistryClient;
import tech.schemadesk.registry.dto.SchemaVersion;
import tech.schemadesk.translator.DescriptiveNode;
import tech.schemadesk.translator.SchemaTranslator;
import tech.schemadesk.translator.TranslatedSchema;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Generates schema documentation by combining registry metadata with the
 * translated shape of each schema.
 *
 * <p>Subjects are matched to topics by the {@code <topic>-value} / {@code <topic>-key}
 * naming convention.
 */
@ApplicationScoped
public class SchemaDocumentationService {

    private static final Logger LOG = Logger.getLogger(SchemaDocumentationService.class);

    static final String VALUE_SUFFIX = "-value";
    static final String KEY_SUFFIX = "-key";

    private final SchemaRegistryClient client;
    private final SchemaTranslator translator;
    private final ObjectMapper objectMapper;

    @Inject
    public SchemaDocumentationService(SchemaRegistryClient client, SchemaTranslator translator) {
        this.client = client;
        this.translator = translator;
        this.objectMapper = client.getObjectMapper();
    }

    /**
     * Document the latest version of a subject.
     *
     * @throws DocumentationException when the subject does not exist
     */
    public SubjectDocumentation generateDocumentation(String subject) {
        SchemaVersion latest = client.getLatestVersion(subject)
            .orElseThrow(() -> DocumentationException.subjectNotFound(subject));
        return document(latest);
    }

    /**
     * Document one schema version. Avro is translated; JSON Schema is passed through;
     * Protobuf is described generically.
     */
    public SubjectDocumentation document(SchemaVersion version) {
        return switch (version.schemaType()) {
            case JSON -> documentation(version, parseJsonSchema(version), objectMapper.createObjectNode());
            case PROTOBUF -> documentation(version,
                objectMapper.valueToTree(DescriptiveNode.ofType(DescriptiveNode.OBJECT)
                    .withDescription("Protobuf schema " + version.subject() + " is not translated")),
                objectMapper.createObjectNode());
            default -> {
                TranslatedSchema translated = translator.translate(version.schema());
                yield documentation(version, objectMapper.valueToTree(translated.schema()), translated.example());
            }
        };
    }

    /**
     * Group subjects by topic, in order of first appearance.
     */
    public List<TopicSubjects> groupSubjectsByTopic(List<String> subjects) {
        Map<String, List<String>> byTopic = new LinkedHashMap<>();
        for (String subject : subjects) {
            byTopic.computeIfAbsent(topicOf(subject), topic -> new ArrayList<>()).add(subject);
        }
        return byTopic.entrySet().stream()
            .map(entry -> new TopicSubjects(
                entry.getKey(),
                List.copyOf(entry.getValue()),
                entry.getValue().stream().anyMatch(s -> s.endsWith(VALUE_SUFFIX)),
                entry.getValue().stream().anyMatch(s -> s.endsWith(KEY_SUFFIX))))
            .toList();
    }

    /**
     * Latest schemas of a topic, trying {@code <topic>-value}, {@code <topic>-key} and
     * {@code <topic>} in that order. Names that do not exist are skipped.
     */
    public List<SchemaVersion> discoverTopicSchemas(String topic) {
        List<SchemaVersion> found = new ArrayList<>();
        for (String candidate : List.of(topic + VALUE_SUFFIX, topic + KEY_SUFFIX, topic)) {
            client.getLatestVersion(candidate).ifPresentOrElse(
                found::add,
                () -> LOG.debugf("No subject %s for topic %s", candidate, topic));
        }
        LOG.infof("Found %d schemas for topic %s", found.size(), topic);
        return found;
    }

    /**
     * Document every schema of a topic.
     *
     * @throws DocumentationException when no schema is found under any naming convention
     */
    public TopicDocumentation documentTopic(String topic) {
        List<SchemaVersion> versions = discoverTopicSchemas(topic);
        if (versions.isEmpty()) {
            throw DocumentationException.noSchemasForTopic(topic);
        }
        List<SubjectDocumentation> schemas = versions.stream()
            .map(this::document)
            .toList();
        return new TopicDocumentation(topic, schemas, schemas.get(0).example());
    }

    private static SubjectDocumentation documentation(SchemaVersion version, JsonNode schema, JsonNode example) {
        return new SubjectDocumentation(version.subject(), version.version(), version.id(),
            version.schemaType(), schema, example, version.references());
    }

    static String topicOf(String subject) {
        if (subject.endsWith(VALUE_SUFFIX)) {
            return subject.substring(0, subject.length() - VALUE_SUFFIX.length());
        }
        if (subject.endsWith(KEY_SUFFIX)) {
            return subject.substring(0, subject.length() - KEY_SUFFIX.length());
        }
        return subject;
    }

    private JsonNode parseJsonSchema(SchemaVersion version) {
        try {
            JsonNode schema = objectMapper.readTree(version.schema());
            if (schema == null || schema.isMissingNode()) {
                return objectMapper.valueToTree(DescriptiveNode.conversionError("Schema conversion error: empty schema"));
            }
            return schema;
        } catch (JsonProcessingException e) {
            LOG.warnf("JSON schema of %s is not valid JSON: %s", version.subject(), e.getOriginalMessage());
            return objectMapper.valueToTree(
                DescriptiveNode.conversionError("Schema conversion error: " + e.getOriginalMessage()));
        }
    }
}
