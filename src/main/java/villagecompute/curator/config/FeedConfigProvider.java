package villagecompute.curator.config;

import java.util.List;
import java.util.Optional;

/**
 * Source of feed definitions.
 */
public interface FeedConfigProvider {

    List<FeedConfig> getFeeds();

    default Optional<FeedConfig> getFeed(String feedId) {
        return getFeeds().stream().filter(feed -> feed.id() != null && feed.id().equals(feedId)).findFirst();
    }

    /**
     * Discards any cached definitions so the next read sees the current source.
     */
    default void reload() {
    }
}
