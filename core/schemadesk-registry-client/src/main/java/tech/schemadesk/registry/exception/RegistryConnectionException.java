package tech.schemadesk.registry.exception;

/**
 * Exception thrown when the registry cannot be reached at all.
 */
public class RegistryConnectionException extends SchemaRegistryException {

    public RegistryConnectionException(String message, Throwable cause) {
        super(message, cause);
    }

    public static RegistryConnectionException unreachable(String url, Throwable cause) {
        String reason = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        return new RegistryConnectionException("Connection error: " + url + " (" + reason + ")", cause);
    }
}
