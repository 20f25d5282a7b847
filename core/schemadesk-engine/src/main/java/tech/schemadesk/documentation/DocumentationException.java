package tech.schemadesk.documentation;

/**
 * Exception thrown when there is nothing to document.
 */
public class DocumentationException extends RuntimeException {

    private final String target;

    public DocumentationException(String message, String target) {
        super(message);
        this.target = target;
    }

    public static DocumentationException subjectNotFound(String subject) {
        return new DocumentationException("Subject not found: " + subject, subject);
    }

    public static DocumentationException noSchemasForTopic(String topic) {
        return new DocumentationException("No schemas found for topic " + topic, topic);
    }

    /**
     * The subject or topic that could not be documented.
     */
    public String getTarget() {
        return target;
    }
}
