package tech.schemadesk.registry.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

import java.util.Optional;

/**
 * Configuration for the Schema Registry client.
 *
 * <p>Configure in application.properties:
 * <pre>
 * schema-registry.url=https://psrc-xxxxx.europe-west1.gcp.confluent.cloud
 * schema-registry.api-key=your_api_key
 * schema-registry.api-secret=your_api_secret
 * schema-registry.http.timeout=10
 * </pre>
 */
@ConfigMapping(prefix = "schema-registry")
public interface SchemaRegistryConfig {

    /**
     * Base URL of the registry REST API.
     */
    Optional<String> url();

    /**
     * API key used as the basic auth user name.
     */
    @WithName("api-key")
    Optional<String> apiKey();

    /**
     * API secret used as the basic auth password. Never logged.
     */
    @WithName("api-secret")
    Optional<String> apiSecret();

    /**
     * HTTP client configuration.
     */
    HttpConfig http();

    interface HttpConfig {
        /**
         * Connect and request timeout in seconds.
         */
        @WithDefault("10")
        int timeout();
    }
}
