package villagecompute.curator.services;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import org.jboss.logging.Logger;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import villagecompute.curator.config.FeedConfig;
import villagecompute.curator.config.FeedConfigProvider;
import villagecompute.curator.config.RecapConfig;
import villagecompute.curator.data.models.ScheduledJob;
import villagecompute.curator.data.stores.JobStore;
import villagecompute.curator.data.stores.JobStore.JobFilter;
import villagecompute.curator.jobs.JobSchedule;
import villagecompute.curator.jobs.JobType;
import villagecompute.curator.jobs.RecapJobConfig;

/**
 * Mirrors each feed's recap configuration into a {@code recap-<feedId>} scheduled job.
 *
 * <p>
 * Feeds with recap enabled get their job created or refreshed (name, schedule, pipeline config). An unchanged schedule
 * keeps the pending {@code nextRunAt}, so restarts neither delay nor repeat runs, and a one-time recap that already ran
 * stays disabled. Recap jobs whose feed no longer enables recap are disabled. A feed that fails to sync is logged and
 * counted; the others still sync.
 */
@ApplicationScoped
public class ConfigSyncService {

    private static final Logger LOG = Logger.getLogger(ConfigSyncService.class);

    static final String RECAP_JOB_PREFIX = "recap-";

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    @Inject
    FeedConfigProvider feedConfigProvider;

    @Inject
    JobStore jobStore;

    @Inject
    ObjectMapper objectMapper;

    @Inject
    Clock clock;

    public static String recapJobId(String feedId) {
        return RECAP_JOB_PREFIX + feedId;
    }

    /**
     * Synchronizes all recap jobs with the current feed configuration.
     */
    public SyncResult syncRecapJobs() {
        List<FeedConfig> feeds = feedConfigProvider.getFeeds();
        int created = 0;
        int updated = 0;
        int disabled = 0;
        int failed = 0;

        for (FeedConfig feed : feeds) {
            try {
                switch (syncFeed(feed)) {
                    case CREATED -> created++;
                    case UPDATED -> updated++;
                    case DISABLED -> disabled++;
                    case UNCHANGED -> {
                    }
                }
            } catch (RuntimeException e) {
                failed++;
                LOG.errorf(e, "Error syncing recap job for feed %s", feed.id());
            }
        }

        for (ScheduledJob orphan : jobStore.list(new JobFilter(true, JobType.RECAP, null))) {
            boolean configured = feeds.stream().anyMatch(feed -> recapJobId(feed.id()).equals(orphan.id));
            if (!configured && orphan.id.startsWith(RECAP_JOB_PREFIX)) {
                try {
                    disable(orphan);
                    disabled++;
                } catch (RuntimeException e) {
                    failed++;
                    LOG.errorf(e, "Error disabling recap job %s for removed feed", orphan.id);
                }
            }
        }

        SyncResult result = new SyncResult(created, updated, disabled, failed);
        LOG.infof("Recap config sync finished: %d created, %d updated, %d disabled, %d failed", created, updated,
                disabled, failed);
        return result;
    }

    private Outcome syncFeed(FeedConfig feed) {
        String jobId = recapJobId(feed.id());
        ScheduledJob existing = jobStore.findById(jobId).orElse(null);

        if (!feed.isRecapEnabled()) {
            if (existing != null && existing.enabled) {
                disable(existing);
                return Outcome.DISABLED;
            }
            return Outcome.UNCHANGED;
        }

        RecapConfig recap = feed.recap();
        JobSchedule schedule = JobSchedule.parse(recap.scheduleOrDefault());
        Map<String, Object> config = objectMapper.convertValue(
                new RecapJobConfig(recap.transform(), recap.batchTransform(), recap.distribute(), null, null),
                MAP_TYPE);
        String name = feed.name() + " Recap";
        String description = "Recap for " + feed.name();
        Instant now = clock.instant();

        if (existing == null) {
            ScheduledJob job = new ScheduledJob();
            job.id = jobId;
            job.name = name;
            job.description = description;
            job.jobType = JobType.RECAP;
            job.feedId = feed.id();
            job.schedule = schedule.getExpression();
            job.isOneTime = schedule.isOneTime();
            job.enabled = true;
            job.config = config;
            job.nextRunAt = schedule.nextRunAfter(now).orElse(null);
            job.createdAt = now;
            job.updatedAt = now;
            jobStore.create(job);
            LOG.infof("Created recap job for feed %s with schedule %s, next run at %s", feed.id(), job.schedule,
                    job.nextRunAt);
            return Outcome.CREATED;
        }

        boolean scheduleChanged = !schedule.getExpression().equals(existing.schedule);
        boolean finishedOneTime = schedule.isOneTime() && !scheduleChanged && existing.lastRunAt != null;

        existing.name = name;
        existing.description = description;
        existing.feedId = feed.id();
        existing.schedule = schedule.getExpression();
        existing.isOneTime = schedule.isOneTime();
        existing.config = config;
        if (finishedOneTime) {
            existing.enabled = false;
            existing.nextRunAt = null;
        } else if (scheduleChanged || !existing.enabled || existing.nextRunAt == null) {
            existing.enabled = true;
            existing.nextRunAt = schedule.nextRunAfter(now).orElse(null);
        }
        existing.updatedAt = now;
        jobStore.update(existing);
        LOG.infof("Updated recap job for feed %s with schedule %s, next run at %s", feed.id(), existing.schedule,
                existing.nextRunAt);
        return Outcome.UPDATED;
    }

    private void disable(ScheduledJob job) {
        job.enabled = false;
        job.nextRunAt = null;
        job.updatedAt = clock.instant();
        jobStore.update(job);
        LOG.infof("Disabled recap job %s", job.id);
    }

    private enum Outcome {
        CREATED, UPDATED, DISABLED, UNCHANGED
    }
}
