package villagecompute.curator.config;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import villagecompute.curator.plugins.DistributorConfig;
import villagecompute.curator.plugins.TransformConfig;

/**
 * Recap output of a feed: when to run and which pipeline to push the batch through.
 */
@JsonIgnoreProperties(
        ignoreUnknown = true)
public record RecapConfig(boolean enabled, String schedule, List<TransformConfig> transform,
        List<TransformConfig> batchTransform, List<DistributorConfig> distribute) {

    /** Weekly, Sunday at midnight UTC. */
    public static final String DEFAULT_SCHEDULE = "0 0 * * 0";

    public RecapConfig {
        transform = transform != null ? transform : List.of();
        batchTransform = batchTransform != null ? batchTransform : List.of();
        distribute = distribute != null ? distribute : List.of();
    }

    public String scheduleOrDefault() {
        return schedule != null && !schedule.isBlank() ? schedule : DEFAULT_SCHEDULE;
    }
}
