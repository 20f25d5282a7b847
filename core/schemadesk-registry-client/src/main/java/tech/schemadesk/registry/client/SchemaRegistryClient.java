package tech.schemadesk.registry.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.schemadesk.registry.client.auth.BasicCredentials;
import tech.schemadesk.registry.config.SchemaRegistryConfig;
import tech.schemadesk.registry.dto.CompatibilityConfig;
import tech.schemadesk.registry.dto.SchemaVersion;
import tech.schemadesk.registry.exception.RegistryAuthenticationException;
import tech.schemadesk.registry.exception.RegistryConfigurationException;
import tech.schemadesk.registry.exception.RegistryConnectionException;
import tech.schemadesk.registry.exception.RegistryTimeoutException;
import tech.schemadesk.registry.exception.SchemaRegistryException;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Client for the Schema Registry REST API.
 *
 * <p>Every call carries the configured timeout and, when credentials are configured,
 * an HTTP basic Authorization header. No retries are performed here: callers decide
 * whether a failure is fatal.
 *
 * <p>Read calls scoped to one subject return {@link Optional#empty()} on 404. Every
 * other non-2xx response is raised as a {@link SchemaRegistryException} carrying the
 * status and an excerpt of the body.
 *
 * <p>Example usage:
 * <pre>{@code
 * @Inject
 * SchemaRegistryClient client;
 *
 * List<String> subjects = client.listSubjects(false);
 * Optional<SchemaVersion> latest = client.getLatestVersion("orders-value");
 * }</pre>
 */
@ApplicationScoped
public class SchemaRegistryClient {

    private static final Logger LOG = Logger.getLogger(SchemaRegistryClient.class);

    private static final String CONTENT_TYPE = "application/vnd.schemaregistry.v1+json";

    private final SchemaRegistryConfig config;
    private final Optional<BasicCredentials> credentials;
    private final Duration timeout;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    @Inject
    public SchemaRegistryClient(SchemaRegistryConfig config) {
        this.config = config;
        this.credentials = BasicCredentials.from(config);
        this.timeout = Duration.ofSeconds(config.http().timeout());
        this.httpClient = HttpClient.newBuilder()
            .connectTimeout(timeout)
            .build();
        this.objectMapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false)
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .configure(DeserializationFeature.READ_UNKNOWN_ENUM_VALUES_AS_NULL, true);
    }

    /**
     * List subject names, in the order the registry returns them.
     *
     * @param includeDeleted also return soft-deleted subjects
     */
    public List<String> listSubjects(boolean includeDeleted) {
        String path = includeDeleted ? "/subjects?deleted=true" : "/subjects";
        List<String> subjects = send("GET", path, new TypeReference<List<String>>() {});
        return subjects != null ? subjects : List.of();
    }

    /**
     * List the version numbers of a subject, or empty if the subject does not exist.
     */
    public Optional<List<Integer>> getVersions(String subject) {
        return find(subjectPath(subject) + "/versions", new TypeReference<List<Integer>>() {});
    }

    /**
     * Get the latest version of a subject, or empty if the subject does not exist.
     */
    public Optional<SchemaVersion> getLatestVersion(String subject) {
        return find(subjectPath(subject) + "/versions/latest", new TypeReference<SchemaVersion>() {});
    }

    /**
     * Get one version of a subject, or empty if subject or version does not exist.
     */
    public Optional<SchemaVersion> getVersion(String subject, int version) {
        return find(subjectPath(subject) + "/versions/" + version, new TypeReference<SchemaVersion>() {});
    }

    /**
     * Get the global compatibility configuration.
     */
    public CompatibilityConfig getConfig() {
        return send("GET", "/config", new TypeReference<CompatibilityConfig>() {});
    }

    /**
     * Get the compatibility configuration of one subject, or empty when the subject
     * has no override and inherits the global level.
     */
    public Optional<CompatibilityConfig> getConfig(String subject) {
        return find("/config/" + encode(subject), new TypeReference<CompatibilityConfig>() {});
    }

    /**
     * Delete every version of a subject.
     *
     * @param permanent hard delete; the registry requires a prior soft delete
     * @return the deleted version numbers
     */
    public List<Integer> deleteSubject(String subject, boolean permanent) {
        String path = subjectPath(subject) + (permanent ? "?permanent=true" : "");
        List<Integer> deleted = send("DELETE", path, new TypeReference<List<Integer>>() {});
        return deleted != null ? deleted : List.of();
    }

    /**
     * Delete a single version of a subject.
     *
     * @return the deleted version number
     */
    public int deleteVersion(String subject, int version) {
        Integer deleted = send("DELETE", subjectPath(subject) + "/versions/" + version,
            new TypeReference<Integer>() {});
        return deleted != null ? deleted : version;
    }

    /**
     * Base URL of the registry, without trailing slash.
     */
    public String endpoint() {
        return config.url()
            .filter(url -> !url.isBlank())
            .map(url -> url.replaceAll("/+$", ""))
            .orElseThrow(RegistryConfigurationException::missingEndpoint);
    }

    public ObjectMapper getObjectMapper() {
        return objectMapper;
    }

    private <T> T send(String method, String path, TypeReference<T> responseType) {
        HttpResponse<String> response = execute(method, path);
        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            throw failure(status, response.body());
        }
        return decode(response.body(), responseType);
    }

    private <T> Optional<T> find(String path, TypeReference<T> responseType) {
        HttpResponse<String> response = execute("GET", path);
        int status = response.statusCode();
        if (status == 404) {
            LOG.debugf("GET %s -> 404 (absent)", path);
            return Optional.empty();
        }
        if (status < 200 || status >= 300) {
            throw failure(status, response.body());
        }
        return Optional.ofNullable(decode(response.body(), responseType));
    }

    private HttpResponse<String> execute(String method, String path) {
        String url = endpoint() + path;

        HttpRequest.Builder requestBuilder = HttpRequest.newBuilder()
            .uri(URI.create(url))
            .header("Accept", CONTENT_TYPE + ", application/json")
            .timeout(timeout)
            .method(method, HttpRequest.BodyPublishers.noBody());
        credentials.ifPresent(c -> requestBuilder.header("Authorization", c.authorizationHeader()));

        LOG.debugf("%s %s", method, path);
        try {
            return httpClient.send(requestBuilder.build(), HttpResponse.BodyHandlers.ofString());
        } catch (HttpTimeoutException e) {
            throw RegistryTimeoutException.after(timeout, method, path, e);
        } catch (IOException e) {
            throw RegistryConnectionException.unreachable(url, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SchemaRegistryException("Interrupted during " + method + " " + path, e);
        }
    }

    private SchemaRegistryException failure(int status, String body) {
        if (status == 401 || status == 403) {
            return RegistryAuthenticationException.rejected(status, body);
        }
        return SchemaRegistryException.fromResponse(status, body);
    }

    private <T> T decode(String body, TypeReference<T> responseType) {
        if (body == null || body.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readValue(body, responseType);
        } catch (JsonProcessingException e) {
            throw new SchemaRegistryException("Failed to parse response: " + e.getOriginalMessage(), e);
        }
    }

    private static String subjectPath(String subject) {
        return "/subjects/" + encode(subject);
    }

    private static String encode(String segment) {
        return URLEncoder.encode(segment, StandardCharsets.UTF_8).replace("+", "%20");
    }
}
