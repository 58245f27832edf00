package villagecompute.curator.config;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import villagecompute.curator.exceptions.ValidationException;

/**
 * {@link FeedConfigProvider} reading a JSON file of the form {@code {"feeds": [...]}} from
 * {@code curator.config.path}.
 *
 * <p>
 * The file is read on first use and cached until {@link #reload()}. A missing file yields no feeds; a file that cannot
 * be parsed fails with {@link ValidationException}.
 */
@ApplicationScoped
public class FileFeedConfigProvider implements FeedConfigProvider {

    private static final Logger LOG = Logger.getLogger(FileFeedConfigProvider.class);

    @ConfigProperty(
            name = "curator.config.path",
            defaultValue = "curate.config.json")
    String configPath;

    @Inject
    ObjectMapper objectMapper;

    private volatile List<FeedConfig> cached;

    @Override
    public List<FeedConfig> getFeeds() {
        List<FeedConfig> feeds = cached;
        if (feeds == null) {
            feeds = load();
            cached = feeds;
        }
        return feeds;
    }

    @Override
    public void reload() {
        cached = null;
    }

    private List<FeedConfig> load() {
        Path path = Path.of(configPath);
        if (!Files.exists(path)) {
            LOG.warnf("Feed configuration %s not found, no feeds configured", path.toAbsolutePath());
            return List.of();
        }
        try {
            ConfigFile file = objectMapper.readValue(path.toFile(), ConfigFile.class);
            List<FeedConfig> feeds = file.feeds() != null ? List.copyOf(file.feeds()) : List.of();
            LOG.infof("Loaded %d feeds from %s", feeds.size(), path);
            return feeds;
        } catch (IOException e) {
            throw new ValidationException("Invalid feed configuration " + path + ": " + e.getMessage(), e);
        }
    }

    @JsonIgnoreProperties(
            ignoreUnknown = true)
    record ConfigFile(List<FeedConfig> feeds) {
    }
}
