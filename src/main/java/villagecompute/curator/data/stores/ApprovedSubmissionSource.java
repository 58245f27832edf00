package villagecompute.curator.data.stores;

import java.time.Instant;
import java.util.List;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Read-only view of moderated submissions, consumed by the recap handler.
 */
public interface ApprovedSubmissionSource {

    /**
     * Content of submissions approved for {@code feedId} in {@code [from, to)}, oldest first.
     */
    List<JsonNode> findApproved(String feedId, Instant from, Instant to);
}
