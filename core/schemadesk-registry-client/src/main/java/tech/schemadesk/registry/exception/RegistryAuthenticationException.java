package tech.schemadesk.registry.exception;

/**
 * Exception thrown when the registry rejects the configured credentials.
 */
public class RegistryAuthenticationException extends SchemaRegistryException {

    public RegistryAuthenticationException(String message, int statusCode, String responseBody) {
        super(message, statusCode, responseBody, null);
    }

    public static RegistryAuthenticationException rejected(int statusCode, String body) {
        String reason = statusCode == 403 ? "Access forbidden" : "Invalid API key or secret";
        return new RegistryAuthenticationException(
            "HTTP " + statusCode + ": " + reason, statusCode, body
        );
    }
}
