package tech.schemadesk.documentation;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * Documentation of every schema found for a topic.
 *
 * @param example example payload of the first schema found, the value schema when there is one
 */
public record TopicDocumentation(
    String topic,
    List<SubjectDocumentation> schemas,
    JsonNode example
) {}
