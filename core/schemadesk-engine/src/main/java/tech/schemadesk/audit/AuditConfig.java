package tech.schemadesk.audit;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Thresholds and sampling caps of the registry health audit.
 *
 * <p>Configure in application.properties:
 * <pre>
 * schemadesk.audit.subject-count.warning-threshold=1000
 * schemadesk.audit.versions.critical-threshold=100
 * schemadesk.audit.large-schema.sample-size=100
 * </pre>
 */
@ConfigMapping(prefix = "schemadesk.audit")
public interface AuditConfig {

    SubjectCountConfig subjectCount();

    VersionsConfig versions();

    LargeSchemaConfig largeSchema();

    SamplingConfig compatibility();

    SamplingConfig orphanedRefs();

    SoftDeletedConfig softDeleted();

    interface SubjectCountConfig {
        @WithDefault("1000")
        int warningThreshold();

        @WithDefault("5000")
        int criticalThreshold();

        /**
         * When false, every count above the warning threshold is reported as WARNING,
         * including counts above the critical threshold.
         */
        @WithDefault("false")
        boolean escalateCritical();
    }

    interface VersionsConfig {
        @WithDefault("50")
        int warningThreshold();

        @WithDefault("100")
        int criticalThreshold();
    }

    interface LargeSchemaConfig {
        @WithDefault("100")
        int thresholdKb();

        @WithDefault("100")
        int sampleSize();
    }

    interface SamplingConfig {
        /**
         * Number of subjects inspected, taken from the start of the listing.
         */
        @WithDefault("50")
        int sampleSize();
    }

    interface SoftDeletedConfig {
        /**
         * Number of soft-deleted subject names included in the report.
         */
        @WithDefault("10")
        int listingLimit();
    }
}
