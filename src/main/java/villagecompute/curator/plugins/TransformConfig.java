package villagecompute.curator.plugins;

import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * One transform step: plugin name plus its opaque settings.
 */
@JsonIgnoreProperties(
        ignoreUnknown = true)
public record TransformConfig(String plugin, Map<String, Object> config) {

    public TransformConfig {
        config = config != null ? config : Map.of();
    }

    public static TransformConfig of(String plugin) {
        return new TransformConfig(plugin, Map.of());
    }
}
