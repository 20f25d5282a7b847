package tech.schemadesk.lifecycle;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/**
 * Accounting of a sequential, best-effort operation over many subjects.
 *
 * <p>Counts are derived from {@code outcomes}, one entry per requested subject in
 * request order, so {@code successCount + failureCount == total} always holds.
 * {@code error} is set only when the operation could not start, in which case there
 * are no outcomes.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record BulkOperationResult(
    List<DeletionResult> outcomes,
    Instant timestamp,
    String message,
    String error
) {
    public BulkOperationResult {
        outcomes = outcomes != null ? List.copyOf(outcomes) : List.of();
    }

    public static BulkOperationResult of(List<DeletionResult> outcomes) {
        return new BulkOperationResult(outcomes, Instant.now(), null, null);
    }

    public static BulkOperationResult empty(String message) {
        return new BulkOperationResult(List.of(), Instant.now(), message, null);
    }

    public static BulkOperationResult failed(String error) {
        return new BulkOperationResult(List.of(), Instant.now(), null, error);
    }

    @JsonProperty("success")
    public boolean success() {
        return error == null;
    }

    @JsonProperty("total")
    public int total() {
        return outcomes.size();
    }

    @JsonProperty("successCount")
    public int successCount() {
        return (int) outcomes.stream().filter(DeletionResult::success).count();
    }

    @JsonProperty("failureCount")
    public int failureCount() {
        return total() - successCount();
    }

    public List<DeletionResult> successes() {
        return outcomes.stream().filter(DeletionResult::success).toList();
    }

    public List<DeletionResult> failures() {
        return outcomes.stream().filter(outcome -> !outcome.success()).toList();
    }
}
