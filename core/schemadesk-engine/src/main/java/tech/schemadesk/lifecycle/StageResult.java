package tech.schemadesk.lifecycle;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Outcome of one registry call inside a multi-step deletion.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record StageResult(
    boolean success,
    List<Integer> deletedVersions,
    String error
) {
    public static StageResult succeeded(List<Integer> deletedVersions) {
        return new StageResult(true, List.copyOf(deletedVersions), null);
    }

    public static StageResult failed(String error) {
        return new StageResult(false, null, error);
    }
}
