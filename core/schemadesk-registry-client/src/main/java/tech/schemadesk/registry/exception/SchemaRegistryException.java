package tech.schemadesk.registry.exception;

/**
 * Base exception for Schema Registry client errors.
 *
 * <p>Carries the HTTP status (0 when no response was received) and an excerpt
 * of the response body when one is available.
 */
public class SchemaRegistryException extends RuntimeException {

    static final int MAX_BODY_EXCERPT = 500;

    private final int statusCode;
    private final String responseBody;

    public SchemaRegistryException(String message) {
        this(message, 0, null, null);
    }

    public SchemaRegistryException(String message, Throwable cause) {
        this(message, 0, null, cause);
    }

    public SchemaRegistryException(String message, int statusCode, String responseBody, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
        this.responseBody = excerpt(responseBody);
    }

    public static SchemaRegistryException fromResponse(int statusCode, String body) {
        String excerpt = excerpt(body);
        return new SchemaRegistryException(
            "HTTP " + statusCode + ": " + (excerpt != null ? excerpt : ""),
            statusCode, excerpt, null
        );
    }

    public int getStatusCode() {
        return statusCode;
    }

    public String getResponseBody() {
        return responseBody;
    }

    static String excerpt(String body) {
        if (body == null) {
            return null;
        }
        return body.length() > MAX_BODY_EXCERPT ? body.substring(0, MAX_BODY_EXCERPT) + "..." : body;
    }
}
