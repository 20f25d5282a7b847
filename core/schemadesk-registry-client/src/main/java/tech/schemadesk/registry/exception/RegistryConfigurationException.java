package tech.schemadesk.registry.exception;

/**
 * Exception thrown when the client is used without a usable configuration.
 */
public class RegistryConfigurationException extends SchemaRegistryException {

    public RegistryConfigurationException(String message) {
        super(message);
    }

    public static RegistryConfigurationException missingEndpoint() {
        return new RegistryConfigurationException(
            "Schema Registry endpoint not configured. Set schema-registry.url"
        );
    }

    public static RegistryConfigurationException incompleteCredentials() {
        return new RegistryConfigurationException(
            "Both schema-registry.api-key and schema-registry.api-secret must be set"
        );
    }
}
