package villagecompute.curator.plugins;

import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Content distribution plugin (publishes to an external target such as a chat channel, a repository or a webhook).
 *
 * <p>
 * Implementations are CDI beans indexed by {@link #name()} in {@link PluginRegistry}. A thrown exception marks this
 * distributor failed without affecting the others configured for the same feed.
 */
public interface Distributor {

    String name();

    void distribute(JsonNode input, Map<String, Object> config) throws Exception;
}
