package tech.schemadesk.lifecycle;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Outcome of deleting one subject or one version. Failures carry the registry's
 * own error text.
 *
 * @param softDelete for hard deletes, the outcome of the preceding soft delete;
 *                   it does not affect {@code success}
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DeletionResult(
    boolean success,
    String subject,
    Integer version,
    List<Integer> deletedVersions,
    String message,
    String error,
    StageResult softDelete
) {
    public static DeletionResult softDeleted(String subject, List<Integer> versions) {
        return new DeletionResult(true, subject, null, List.copyOf(versions),
            "Soft-deleted " + versions.size() + " versions", null, null);
    }

    public static DeletionResult hardDeleted(String subject, List<Integer> versions, StageResult softDelete) {
        return new DeletionResult(true, subject, null, List.copyOf(versions),
            "Permanently deleted " + versions.size() + " versions", null, softDelete);
    }

    public static DeletionResult versionDeleted(String subject, int version) {
        return new DeletionResult(true, subject, version, null, "Deleted version " + version, null, null);
    }

    public static DeletionResult failed(String subject, String error) {
        return new DeletionResult(false, subject, null, null, null, error, null);
    }

    public static DeletionResult failed(String subject, String error, StageResult softDelete) {
        return new DeletionResult(false, subject, null, null, null, error, softDelete);
    }

    public static DeletionResult versionFailed(String subject, int version, String error) {
        return new DeletionResult(false, subject, version, null, null, error, null);
    }
}
