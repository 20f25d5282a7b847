package tech.schemadesk.registry.client.auth;

import tech.schemadesk.registry.config.SchemaRegistryConfig;
import tech.schemadesk.registry.exception.RegistryConfigurationException;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Optional;

/**
 * HTTP basic auth credentials built from the registry API key and secret.
 */
public final class BasicCredentials {

    private final String apiKey;
    private final String authorizationHeader;

    private BasicCredentials(String apiKey, String apiSecret) {
        this.apiKey = apiKey;
        String token = apiKey + ":" + apiSecret;
        this.authorizationHeader = "Basic " + Base64.getEncoder()
            .encodeToString(token.getBytes(StandardCharsets.UTF_8));
    }

    public static BasicCredentials of(String apiKey, String apiSecret) {
        return new BasicCredentials(apiKey, apiSecret);
    }

    /**
     * Resolve credentials from configuration. Returns empty for an anonymous registry,
     * fails when only one half of the pair is set.
     */
    public static Optional<BasicCredentials> from(SchemaRegistryConfig config) {
        Optional<String> key = config.apiKey().filter(k -> !k.isBlank());
        Optional<String> secret = config.apiSecret().filter(s -> !s.isBlank());

        if (key.isEmpty() && secret.isEmpty()) {
            return Optional.empty();
        }
        if (key.isEmpty() || secret.isEmpty()) {
            throw RegistryConfigurationException.incompleteCredentials();
        }
        return Optional.of(new BasicCredentials(key.get(), secret.get()));
    }

    public String authorizationHeader() {
        return authorizationHeader;
    }

    @Override
    public String toString() {
        return "BasicCredentials[apiKey=" + apiKey + ", apiSecret=****]";
    }
}
