package tech.schemadesk.audit;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of one audit check as it appears in the report.
 *
 * @param status   severity of this check
 * @param message  human readable summary
 * @param coverage for sampling checks, e.g. {@code "sampled 50 of 1200 subjects"}
 * @param details  check specific data (counts, offending subjects)
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record CheckResult(
    CheckStatus status,
    String message,
    String coverage,
    Map<String, Object> details
) {
    public CheckResult {
        details = details != null ? Collections.unmodifiableMap(new LinkedHashMap<>(details)) : Map.of();
    }

    public static CheckResult of(CheckStatus status, String message) {
        return new CheckResult(status, message, null, Map.of());
    }

    public static CheckResult ok(String message) {
        return of(CheckStatus.OK, message);
    }

    public static CheckResult error(String message) {
        return of(CheckStatus.ERROR, message);
    }

    public CheckResult withDetail(String key, Object value) {
        Map<String, Object> copy = new LinkedHashMap<>(details);
        copy.put(key, value);
        return new CheckResult(status, message, coverage, copy);
    }

    public CheckResult sampled(int sampled, int total) {
        return new CheckResult(status, message, "sampled " + sampled + " of " + total + " subjects", details);
    }
}
