package tech.schemadesk.lifecycle;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.schemadesk.registry.client.SchemaRegistryClient;
import tech.schemadesk.registry.dto.SchemaVersion;
import tech.schemadesk.registry.enums.SchemaType;
import tech.schemadesk.registry.exception.RegistryConfigurationException;
import tech.schemadesk.registry.exception.SchemaRegistryException;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Listing and deletion of registry subjects.
 *
 * <p>Per-subject registry failures are returned as data ({@link DeletionResult},
 * {@link SubjectDetails#error()}), never thrown. Only listing failures and an
 * unusable client configuration propagate.
 *
 * <p>Bulk operations run sequentially and are not transactional: subjects deleted
 * before a later failure stay deleted, and every outcome is reported.
 */
@ApplicationScoped
public class SubjectLifecycleManager {

    private static final Logger LOG = Logger.getLogger(SubjectLifecycleManager.class);

    private final SchemaRegistryClient client;
    private final LifecycleConfig config;

    @Inject
    public SubjectLifecycleManager(SchemaRegistryClient client, LifecycleConfig config) {
        this.client = client;
        this.config = config;
    }

    // ========================================
    // LISTING
    // ========================================

    /**
     * Subjects in registry order.
     *
     * @throws SchemaRegistryException when the registry cannot be listed
     */
    public List<String> listSubjects(boolean includeDeleted) {
        return client.listSubjects(includeDeleted);
    }

    public List<String> filterSubjects(Integer minVersions, String pattern) {
        return filterSubjects(new SubjectFilter(minVersions, pattern));
    }

    /**
     * Active subjects that satisfy every criterion of the filter, in registry order.
     * A subject whose versions cannot be read counts as having none.
     */
    public List<String> filterSubjects(SubjectFilter filter) {
        List<String> filtered = new ArrayList<>();
        for (String subject : client.listSubjects(false)) {
            if (!filter.matchesName(subject)) {
                continue;
            }
            int versionCount = filter.needsVersionCount() ? versionCount(subject) : 0;
            if (filter.matches(subject, versionCount)) {
                filtered.add(subject);
            }
        }
        return filtered;
    }

    /**
     * Version list and latest schema of a subject. A subject that does not exist
     * yields empty versions and no latest version.
     */
    public SubjectDetails subjectDetails(String subject) {
        try {
            List<Integer> versions = client.getVersions(subject).orElse(List.of());
            Optional<SchemaVersion> latest = client.getLatestVersion(subject);

            return new SubjectDetails(
                subject,
                versions,
                versions.size(),
                latest.map(SchemaVersion::version).orElse(null),
                latest.map(SchemaVersion::schemaType).orElse(SchemaType.AVRO),
                sizeKb(latest.map(SchemaVersion::schemaSizeBytes).orElse(0)),
                latest.map(SchemaVersion::id).orElse(null),
                null
            );
        } catch (RegistryConfigurationException e) {
            throw e;
        } catch (SchemaRegistryException e) {
            LOG.warnf("Could not read details of %s: %s", subject, e.getMessage());
            return SubjectDetails.failed(subject, e.getMessage());
        }
    }

    /**
     * Filtered (when a criterion is given) or plain listing, with details for at most
     * {@code schemadesk.lifecycle.details-limit} subjects.
     */
    public SubjectListing listSubjectDetails(boolean includeDeleted, Integer minVersions, String pattern) {
        SubjectFilter filter = new SubjectFilter(minVersions, pattern);
        List<String> subjects = filter.isEmpty() ? listSubjects(includeDeleted) : filterSubjects(filter);

        List<SubjectDetails> details = subjects.stream()
            .limit(config.detailsLimit())
            .map(this::subjectDetails)
            .toList();
        return new SubjectListing(subjects.size(), details.size(), details);
    }

    // ========================================
    // DELETION
    // ========================================

    /**
     * Soft delete every version of a subject. Recoverable.
     */
    public DeletionResult softDelete(String subject) {
        try {
            List<Integer> versions = client.deleteSubject(subject, false);
            LOG.infof("Soft-deleted subject %s, versions %s", subject, versions);
            return DeletionResult.softDeleted(subject, versions);
        } catch (RegistryConfigurationException e) {
            throw e;
        } catch (SchemaRegistryException e) {
            LOG.warnf("Soft delete of %s failed: %s", subject, e.getMessage());
            return DeletionResult.failed(subject, e.getMessage());
        }
    }

    /**
     * Permanently delete a subject. A soft delete is issued first because the registry
     * only hard-deletes soft-deleted subjects. Its outcome is reported in
     * {@link DeletionResult#softDelete()} but only the permanent delete decides success,
     * so subjects that are already soft-deleted can be hard-deleted too.
     */
    public DeletionResult hardDelete(String subject) {
        StageResult softStage = softDeleteStage(subject);
        try {
            List<Integer> versions = client.deleteSubject(subject, true);
            LOG.infof("Permanently deleted subject %s, versions %s", subject, versions);
            return DeletionResult.hardDeleted(subject, versions, softStage);
        } catch (RegistryConfigurationException e) {
            throw e;
        } catch (SchemaRegistryException e) {
            LOG.warnf("Hard delete of %s failed: %s", subject, e.getMessage());
            return DeletionResult.failed(subject, e.getMessage(), softStage);
        }
    }

    /**
     * Delete a single version, independently of subject-level deletion.
     */
    public DeletionResult deleteVersion(String subject, int version) {
        try {
            client.deleteVersion(subject, version);
            LOG.infof("Deleted version %d of subject %s", version, subject);
            return DeletionResult.versionDeleted(subject, version);
        } catch (RegistryConfigurationException e) {
            throw e;
        } catch (SchemaRegistryException e) {
            LOG.warnf("Delete of %s version %d failed: %s", subject, version, e.getMessage());
            return DeletionResult.versionFailed(subject, version, e.getMessage());
        }
    }

    public BulkOperationResult bulkSoftDelete(List<String> subjects) {
        LOG.infof("Bulk soft delete of %d subjects", subjects.size());
        List<DeletionResult> outcomes = new ArrayList<>(subjects.size());
        for (String subject : subjects) {
            outcomes.add(softDelete(subject));
        }
        return logged("Bulk soft delete", BulkOperationResult.of(outcomes));
    }

    public BulkOperationResult bulkHardDelete(List<String> subjects) {
        LOG.infof("Bulk hard delete of %d subjects", subjects.size());
        List<DeletionResult> outcomes = new ArrayList<>(subjects.size());
        for (String subject : subjects) {
            outcomes.add(hardDelete(subject));
        }
        return logged("Bulk hard delete", BulkOperationResult.of(outcomes));
    }

    /**
     * Permanently delete every soft-deleted subject.
     *
     * <p>The registry has no endpoint listing soft-deleted subjects, so they are
     * computed as the listing that includes deleted subjects minus the active listing.
     */
    public BulkOperationResult purgeSoftDeleted() {
        List<String> softDeleted;
        try {
            List<String> withDeleted = client.listSubjects(true);
            Set<String> active = new HashSet<>(client.listSubjects(false));
            softDeleted = withDeleted.stream()
                .filter(subject -> !active.contains(subject))
                .toList();
        } catch (RegistryConfigurationException e) {
            throw e;
        } catch (SchemaRegistryException e) {
            LOG.errorf("Purge aborted, subjects could not be listed: %s", e.getMessage());
            return BulkOperationResult.failed("Failed to get subjects: " + e.getMessage());
        }

        if (softDeleted.isEmpty()) {
            LOG.info("No soft-deleted subjects to purge");
            return BulkOperationResult.empty("No soft-deleted subjects found");
        }
        LOG.infof("Purging %d soft-deleted subjects", softDeleted.size());
        return bulkHardDelete(softDeleted);
    }

    private StageResult softDeleteStage(String subject) {
        try {
            return StageResult.succeeded(client.deleteSubject(subject, false));
        } catch (RegistryConfigurationException e) {
            throw e;
        } catch (SchemaRegistryException e) {
            LOG.debugf("Soft delete before hard delete of %s failed: %s", subject, e.getMessage());
            return StageResult.failed(e.getMessage());
        }
    }

    private int versionCount(String subject) {
        try {
            return client.getVersions(subject).map(List::size).orElse(0);
        } catch (RegistryConfigurationException e) {
            throw e;
        } catch (SchemaRegistryException e) {
            LOG.warnf("Could not count versions of %s: %s", subject, e.getMessage());
            return 0;
        }
    }

    private static BulkOperationResult logged(String operation, BulkOperationResult result) {
        LOG.infof("%s finished: %d succeeded, %d failed of %d",
            operation, result.successCount(), result.failureCount(), result.total());
        return result;
    }

    static double sizeKb(int bytes) {
        return BigDecimal.valueOf(bytes / 1024.0).setScale(2, RoundingMode.HALF_UP).doubleValue();
    }
}
