package tech.schemadesk.registry.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnore;
import tech.schemadesk.registry.enums.CompatibilityLevel;

/**
 * Compatibility configuration, either global or for a single subject.
 */
public record CompatibilityConfig(
    @JsonAlias("compatibility")
    CompatibilityLevel compatibilityLevel
) {
    @JsonIgnore
    public boolean isNone() {
        return compatibilityLevel == CompatibilityLevel.NONE;
    }
}
