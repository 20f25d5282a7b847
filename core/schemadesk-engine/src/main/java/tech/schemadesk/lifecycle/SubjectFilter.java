package tech.schemadesk.lifecycle;

/**
 * Conjunctive subject filter. Unset criteria match everything.
 *
 * <p>{@code pattern} is a literal substring, not a glob or regular expression.
 *
 * @param minVersions minimum number of versions, or null
 * @param pattern     substring the subject name must contain, or null
 */
public record SubjectFilter(
    Integer minVersions,
    String pattern
) {
    public SubjectFilter {
        pattern = pattern != null && pattern.isEmpty() ? null : pattern;
    }

    public boolean isEmpty() {
        return minVersions == null && pattern == null;
    }

    public boolean needsVersionCount() {
        return minVersions != null;
    }

    public boolean matchesName(String subject) {
        return pattern == null || subject.contains(pattern);
    }

    public boolean matches(String subject, int versionCount) {
        return matchesName(subject) && (minVersions == null || versionCount >= minVersions);
    }
}
