package villagecompute.curator.services;

import java.util.List;

import villagecompute.curator.plugins.DistributorConfig;
import villagecompute.curator.plugins.TransformConfig;

/**
 * Pipeline settings for one {@link ProcessorService} call. Null lists are normalised to empty lists.
 *
 * @param transform
 *            steps applied to each item (GLOBAL stage)
 * @param batchTransform
 *            steps applied once to the collected batch (BATCH stage), ignored for single items
 * @param distribute
 *            distribution targets, at least one required
 */
public record ProcessConfig(List<TransformConfig> transform, List<TransformConfig> batchTransform,
        List<DistributorConfig> distribute) {

    public ProcessConfig {
        transform = transform != null ? transform : List.of();
        batchTransform = batchTransform != null ? batchTransform : List.of();
        distribute = distribute != null ? distribute : List.of();
    }
}
