package tech.schemadesk.lifecycle;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration for subject lifecycle operations.
 */
@ConfigMapping(prefix = "schemadesk.lifecycle")
public interface LifecycleConfig {

    /**
     * Maximum number of subjects for which a detailed listing fetches details.
     */
    @WithDefault("100")
    int detailsLimit();
}
