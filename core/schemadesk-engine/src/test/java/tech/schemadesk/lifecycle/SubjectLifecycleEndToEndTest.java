package tech.schemadesk.lifecycle;

import com.github.tomakehurst.wiremock.WireMockServer;
import com.github.tomakehurst.wiremock.stubbing.Scenario;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import tech.schemadesk.registry.client.SchemaRegistryClient;
import tech.schemadesk.support.StubRegistryConfig;

import java.util.List;

import static com.github.tomakehurst.wiremock.client.WireMock.*;
import static com.github.tomakehurst.wiremock.core.WireMockConfiguration.options;
import static org.assertj.core.api.Assertions.*;

/**
 * Lifecycle operations against a WireMock registry holding
 * orders-value, orders-key and users-value.
 */
class SubjectLifecycleEndToEndTest {

    private static final String GHOST_NOT_FOUND = "{\"error_code\":40401,\"message\":\"Subject 'ghost' not found.\"}";

    private WireMockServer registry;
    private SubjectLifecycleManager manager;

    @BeforeEach
    void setUp() {
        registry = new WireMockServer(options().dynamicPort());
        registry.start();
        manager = new SubjectLifecycleManager(
            new SchemaRegistryClient(StubRegistryConfig.of(registry.baseUrl())), () -> 100);

        registry.stubFor(get(urlEqualTo("/subjects"))
            .willReturn(okJson("[\"orders-value\",\"orders-key\",\"users-value\"]")));
        registry.stubFor(get(urlEqualTo("/subjects/orders-value/versions")).willReturn(okJson("[1,2,3,4,5]")));
        registry.stubFor(get(urlEqualTo("/subjects/orders-key/versions")).willReturn(okJson("[1,2]")));
        registry.stubFor(get(urlEqualTo("/subjects/users-value/versions")).willReturn(okJson("[1,2,3]")));
    }

    @AfterEach
    void tearDown() {
        registry.stop();
    }

    @Test
    @DisplayName("listing keeps registry order and the pattern filter keeps matching subjects")
    void listAndFilter_shouldKeepRegistryOrder() {
        assertThat(manager.listSubjects(false)).containsExactly("orders-value", "orders-key", "users-value");
        assertThat(manager.filterSubjects(null, "orders")).containsExactly("orders-value", "orders-key");
        assertThat(manager.filterSubjects(3, "orders")).containsExactly("orders-value");
    }

    @Test
    void detailedListing_shouldIncludeLatestSchemaMetadata() {
        registry.stubFor(get(urlEqualTo("/subjects/users-value/versions/latest"))
            .willReturn(okJson("{\"subject\":\"users-value\",\"version\":3,\"id\":7,\"schema\":\"\\\"string\\\"\"}")));

        SubjectListing listing = manager.listSubjectDetails(false, null, "users");

        assertThat(listing.totalCount()).isEqualTo(1);
        SubjectDetails details = listing.subjects().get(0);
        assertThat(details.versions()).containsExactly(1, 2, 3);
        assertThat(details.latestVersion()).isEqualTo(3);
        assertThat(details.id()).isEqualTo(7);
        assertThat(details.error()).isNull();
    }

    @Test
    void bulkSoftDelete_shouldReportRegistryErrorForMissingSubject() {
        registry.stubFor(delete(urlEqualTo("/subjects/users-value")).willReturn(okJson("[1,2,3]")));
        registry.stubFor(delete(urlEqualTo("/subjects/ghost"))
            .willReturn(aResponse().withStatus(404).withBody(GHOST_NOT_FOUND)));

        BulkOperationResult result = manager.bulkSoftDelete(List.of("users-value", "ghost"));

        assertThat(result.total()).isEqualTo(2);
        assertThat(result.successCount()).isEqualTo(1);
        assertThat(result.failureCount()).isEqualTo(1);
        assertThat(result.outcomes().get(0).deletedVersions()).containsExactly(1, 2, 3);
        assertThat(result.outcomes().get(1).error()).isEqualTo("HTTP 404: " + GHOST_NOT_FOUND);
    }

    @Test
    void deleteVersion_shouldCallVersionEndpoint() {
        registry.stubFor(delete(urlEqualTo("/subjects/orders-value/versions/2")).willReturn(okJson("2")));

        assertThat(manager.deleteVersion("orders-value", 2).success()).isTrue();
        registry.verify(deleteRequestedFor(urlEqualTo("/subjects/orders-value/versions/2")));
    }

    @Test
    @DisplayName("purge hard-deletes soft-deleted subjects once, then finds nothing")
    void purge_shouldBeIdempotentAgainstRegistry() {
        registry.stubFor(get(urlEqualTo("/subjects?deleted=true")).inScenario("purge")
            .whenScenarioStateIs(Scenario.STARTED)
            .willReturn(okJson("[\"orders-value\",\"orders-key\",\"legacy-value\",\"users-value\"]")));
        registry.stubFor(get(urlEqualTo("/subjects?deleted=true")).inScenario("purge")
            .whenScenarioStateIs("purged")
            .willReturn(okJson("[\"orders-value\",\"orders-key\",\"users-value\"]")));
        registry.stubFor(delete(urlEqualTo("/subjects/legacy-value"))
            .willReturn(aResponse().withStatus(404)
                .withBody("{\"error_code\":40404,\"message\":\"Subject 'legacy-value' was soft deleted.\"}")));
        registry.stubFor(delete(urlEqualTo("/subjects/legacy-value?permanent=true")).inScenario("purge")
            .willReturn(okJson("[1,2]"))
            .willSetStateTo("purged"));

        BulkOperationResult first = manager.purgeSoftDeleted();
        BulkOperationResult second = manager.purgeSoftDeleted();

        assertThat(first.total()).isEqualTo(1);
        assertThat(first.successCount()).isEqualTo(1);
        DeletionResult purged = first.outcomes().get(0);
        assertThat(purged.subject()).isEqualTo("legacy-value");
        assertThat(purged.deletedVersions()).containsExactly(1, 2);
        assertThat(purged.softDelete().success()).isFalse();
        assertThat(second.total()).isZero();
        assertThat(second.message()).isEqualTo("No soft-deleted subjects found");
        registry.verify(1, deleteRequestedFor(urlEqualTo("/subjects/legacy-value?permanent=true")));
    }
}
