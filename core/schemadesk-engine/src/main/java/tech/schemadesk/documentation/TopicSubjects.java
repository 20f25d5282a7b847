package tech.schemadesk.documentation;

import java.util.List;

/**
 * Subjects that belong to one topic by naming convention.
 */
public record TopicSubjects(
    String topic,
    List<String> subjects,
    boolean hasValueSchema,
    boolean hasKeySchema
) {}
