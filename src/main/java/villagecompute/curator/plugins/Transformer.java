package villagecompute.curator.plugins;

import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Content transform plugin.
 *
 * <p>
 * Implementations are CDI beans indexed by {@link #name()} in {@link PluginRegistry}. A transform receives a private
 * copy of the current content and returns the new value; an object result is shallow-merged over an object input by
 * the pipeline, so a transform may return only the keys it adds or changes. Returning null is an error.
 */
public interface Transformer {

    /**
     * Name feed configurations use to reference this plugin, e.g. {@code "ai-summary"}.
     */
    String name();

    JsonNode transform(JsonNode input, Map<String, Object> config) throws Exception;
}
