package villagecompute.curator.config;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * One curated feed from the configuration file. Only the parts the scheduler needs are modelled; other output kinds
 * are ignored.
 */
@JsonIgnoreProperties(
        ignoreUnknown = true)
public record FeedConfig(String id, String name, String description, Outputs outputs) {

    @JsonIgnore
    public RecapConfig recap() {
        return outputs != null ? outputs.recap() : null;
    }

    @JsonIgnore
    public boolean isRecapEnabled() {
        RecapConfig recap = recap();
        return recap != null && recap.enabled();
    }

    @JsonIgnoreProperties(
            ignoreUnknown = true)
    public record Outputs(RecapConfig recap) {
    }
}
