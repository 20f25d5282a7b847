package tech.schemadesk.lifecycle;

import com.fasterxml.jackson.annotation.JsonInclude;
import tech.schemadesk.registry.enums.SchemaType;

import java.util.List;

/**
 * Best-effort description of one subject. When the registry could not be read for
 * this subject, only {@code subject} and {@code error} are set.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SubjectDetails(
    String subject,
    List<Integer> versions,
    Integer versionCount,
    Integer latestVersion,
    SchemaType schemaType,
    Double sizeKb,
    Integer id,
    String error
) {
    public static SubjectDetails failed(String subject, String error) {
        return new SubjectDetails(subject, null, null, null, null, null, null, error);
    }

    public boolean hasError() {
        return error != null;
    }
}
