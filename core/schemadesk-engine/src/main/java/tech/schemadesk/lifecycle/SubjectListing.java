package tech.schemadesk.lifecycle;

import java.util.List;

/**
 * Subject listing with per-subject details.
 *
 * @param totalCount    number of subjects that matched
 * @param returnedCount number of subjects for which details were fetched
 */
public record SubjectListing(
    int totalCount,
    int returnedCount,
    List<SubjectDetails> subjects
) {}
