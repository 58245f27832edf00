package villagecompute.curator.jobs;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import villagecompute.curator.plugins.DistributorConfig;
import villagecompute.curator.plugins.TransformConfig;

/**
 * Shape of {@code scheduled_jobs.config} for RECAP jobs. {@code fromDate} and {@code toDate} are optional ISO-8601
 * instants overriding the default recap window.
 */
@JsonIgnoreProperties(
        ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RecapJobConfig(List<TransformConfig> transform, List<TransformConfig> batchTransform,
        List<DistributorConfig> distribute, String fromDate, String toDate) {

    public RecapJobConfig {
        transform = transform != null ? transform : List.of();
        batchTransform = batchTransform != null ? batchTransform : List.of();
        distribute = distribute != null ? distribute : List.of();
    }
}
