package villagecompute.curator.plugins;

import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * One distribution target: plugin name, its settings, and transform steps applied only to the content sent to this
 * target.
 */
@JsonIgnoreProperties(
        ignoreUnknown = true)
public record DistributorConfig(String plugin, Map<String, Object> config, List<TransformConfig> transform) {

    public DistributorConfig {
        config = config != null ? config : Map.of();
        transform = transform != null ? transform : List.of();
    }

    public static DistributorConfig of(String plugin) {
        return new DistributorConfig(plugin, Map.of(), List.of());
    }
}
