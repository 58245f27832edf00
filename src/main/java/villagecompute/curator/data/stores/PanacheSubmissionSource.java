package villagecompute.curator.data.stores;

import java.time.Instant;
import java.util.List;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;
import villagecompute.curator.data.models.Submission;

/**
 * {@link ApprovedSubmissionSource} reading the {@code feed_submissions} table shared with the moderation service.
 */
@ApplicationScoped
public class PanacheSubmissionSource implements ApprovedSubmissionSource {

    @Inject
    ObjectMapper objectMapper;

    @Override
    @Transactional
    public List<JsonNode> findApproved(String feedId, Instant from, Instant to) {
        return Submission.findApproved(feedId, from, to).stream()
                .map(submission -> (JsonNode) objectMapper.valueToTree(submission.content)).toList();
    }
}
