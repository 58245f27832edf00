package villagecompute.curator.jobs;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import villagecompute.curator.config.FeedConfig;
import villagecompute.curator.config.FeedConfigProvider;
import villagecompute.curator.data.models.ScheduledJob;
import villagecompute.curator.data.stores.ApprovedSubmissionSource;
import villagecompute.curator.exceptions.ResourceNotFoundException;
import villagecompute.curator.exceptions.ValidationException;
import villagecompute.curator.services.DistributionReport;
import villagecompute.curator.services.ProcessConfig;
import villagecompute.curator.services.ProcessorService;

/**
 * Builds a feed recap: collects the submissions approved since the previous run and pushes them through the recap
 * pipeline as one batch.
 *
 * <p>
 * <b>Window:</b> {@code config.fromDate}, else the job's {@code lastRunAt}, else now minus
 * {@code curator.recap.default-lookback}; up to {@code config.toDate}, else now. An empty window completes without
 * distributing anything.
 *
 * <p>
 * <b>Result:</b> {@code feedId}, {@code fromDate}, {@code toDate}, {@code itemCount}, {@code distributed} and
 * {@code failedDistributors}.
 */
@ApplicationScoped
public class RecapJobHandler implements JobHandler {

    private static final Logger LOG = Logger.getLogger(RecapJobHandler.class);

    @Inject
    FeedConfigProvider feedConfigProvider;

    @Inject
    ApprovedSubmissionSource submissionSource;

    @Inject
    ProcessorService processorService;

    @Inject
    ObjectMapper objectMapper;

    @Inject
    Clock clock;

    @ConfigProperty(
            name = "curator.recap.default-lookback",
            defaultValue = "P7D")
    Duration defaultLookback;

    @Override
    public JobType handlesType() {
        return JobType.RECAP;
    }

    @Override
    public Map<String, Object> execute(ScheduledJob job) {
        if (job.feedId == null || job.feedId.isBlank()) {
            throw new ValidationException("Recap job requires a feed ID");
        }
        FeedConfig feed = feedConfigProvider.getFeed(job.feedId)
                .orElseThrow(() -> new ResourceNotFoundException("Feed not found: " + job.feedId));
        if (!feed.isRecapEnabled()) {
            throw new ValidationException("Recap is not enabled for feed " + job.feedId);
        }

        RecapJobConfig config = job.config != null
                ? objectMapper.convertValue(job.config, RecapJobConfig.class)
                : new RecapJobConfig(null, null, null, null, null);

        Instant now = clock.instant();
        Instant toDate = config.toDate() != null ? parseDate("toDate", config.toDate()) : now;
        Instant fromDate;
        if (config.fromDate() != null) {
            fromDate = parseDate("fromDate", config.fromDate());
        } else if (job.lastRunAt != null) {
            fromDate = job.lastRunAt;
        } else {
            fromDate = toDate.minus(defaultLookback);
        }

        List<JsonNode> items = submissionSource.findApproved(job.feedId, fromDate, toDate);
        LOG.infof("Recap for feed %s: %d approved submissions between %s and %s", job.feedId, items.size(), fromDate,
                toDate);

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("feedId", job.feedId);
        result.put("fromDate", fromDate.toString());
        result.put("toDate", toDate.toString());
        result.put("itemCount", items.size());

        if (items.isEmpty()) {
            result.put("distributed", List.of());
            result.put("failedDistributors", Map.of());
            return result;
        }

        DistributionReport report = processorService.processBatch(items,
                new ProcessConfig(config.transform(), config.batchTransform(), config.distribute()));
        result.put("distributed", report.succeeded());
        result.put("failedDistributors", report.failed());
        return result;
    }

    private static Instant parseDate(String field, String value) {
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            throw new ValidationException("Invalid " + field + " in recap job config: " + value, e);
        }
    }
}
