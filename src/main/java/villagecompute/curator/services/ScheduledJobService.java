package villagecompute.curator.services;

import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import org.jboss.logging.Logger;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import villagecompute.curator.data.models.JobExecution;
import villagecompute.curator.data.models.ScheduledJob;
import villagecompute.curator.data.stores.JobStore;
import villagecompute.curator.data.stores.JobStore.JobFilter;
import villagecompute.curator.exceptions.DuplicateResourceException;
import villagecompute.curator.exceptions.ValidationException;
import villagecompute.curator.jobs.JobSchedule;
import villagecompute.curator.jobs.JobType;

/**
 * Management operations on scheduled jobs.
 *
 * <p>
 * Schedules are validated before anything is written. An ISO timestamp schedule always makes the job one-time. The
 * next run time is recalculated whenever the schedule changes or the job is enabled, and cleared when it is disabled.
 */
@ApplicationScoped
public class ScheduledJobService {

    private static final Logger LOG = Logger.getLogger(ScheduledJobService.class);

    public static final int DEFAULT_EXECUTION_LIMIT = 10;
    public static final int MAX_EXECUTION_LIMIT = 100;

    @Inject
    JobStore jobStore;

    @Inject
    Clock clock;

    public List<ScheduledJob> listJobs(JobFilter filter) {
        return jobStore.list(filter);
    }

    public Optional<ScheduledJob> getJob(String id) {
        return jobStore.findById(id);
    }

    /**
     * Creates a job.
     *
     * @throws ValidationException
     *             if a required field is missing or the schedule is invalid
     * @throws DuplicateResourceException
     *             if a job with the requested id exists
     */
    public ScheduledJob createJob(JobDefinition definition) {
        if (definition.name() == null || definition.name().isBlank()) {
            throw new ValidationException("Job name is required");
        }
        if (definition.jobType() == null) {
            throw new ValidationException("Job type is required");
        }
        if (definition.jobType() == JobType.RECAP && isBlank(definition.feedId())) {
            throw new ValidationException("Recap jobs require a feed ID");
        }
        JobSchedule schedule = JobSchedule.parse(definition.schedule());

        String id = isBlank(definition.id()) ? UUID.randomUUID().toString() : definition.id();
        if (jobStore.findById(id).isPresent()) {
            throw new DuplicateResourceException("Job already exists: " + id);
        }

        Instant now = clock.instant();
        ScheduledJob job = new ScheduledJob();
        job.id = id;
        job.name = definition.name();
        job.description = definition.description();
        job.jobType = definition.jobType();
        job.feedId = definition.feedId();
        job.schedule = schedule.getExpression();
        job.isOneTime = schedule.isOneTime() || Boolean.TRUE.equals(definition.isOneTime());
        job.enabled = definition.enabled() == null || definition.enabled();
        job.config = definition.config() != null ? new HashMap<>(definition.config()) : new HashMap<>();
        job.nextRunAt = job.enabled ? schedule.nextRunAfter(now).orElse(null) : null;
        job.createdAt = now;
        job.updatedAt = now;
        return jobStore.create(job);
    }

    /**
     * Applies a partial update.
     *
     * @return the updated job, or empty if no job has this id
     * @throws ValidationException
     *             if the new schedule is invalid
     */
    public Optional<ScheduledJob> updateJob(String id, JobUpdate update) {
        Optional<ScheduledJob> existing = jobStore.findById(id);
        if (existing.isEmpty()) {
            return Optional.empty();
        }
        ScheduledJob job = existing.get();
        Instant now = clock.instant();

        boolean scheduleChanged = false;
        JobSchedule schedule = null;
        if (update.schedule() != null) {
            schedule = JobSchedule.parse(update.schedule());
            scheduleChanged = !schedule.getExpression().equals(job.schedule);
            job.schedule = schedule.getExpression();
        }
        if (update.name() != null) {
            if (update.name().isBlank()) {
                throw new ValidationException("Job name must not be blank");
            }
            job.name = update.name();
        }
        if (update.description() != null) {
            job.description = update.description();
        }
        if (update.feedId() != null) {
            job.feedId = update.feedId();
        }
        if (update.config() != null) {
            job.config = new HashMap<>(update.config());
        }
        if (update.isOneTime() != null) {
            job.isOneTime = update.isOneTime();
        }
        if (JobSchedule.isIsoTimestamp(job.schedule)) {
            job.isOneTime = true;
        }

        boolean enabling = Boolean.TRUE.equals(update.enabled()) && !job.enabled;
        if (update.enabled() != null) {
            job.enabled = update.enabled();
        }

        if (!job.enabled) {
            job.nextRunAt = null;
        } else if (scheduleChanged || enabling || job.nextRunAt == null) {
            JobSchedule effective = schedule != null ? schedule : JobSchedule.parse(job.schedule);
            job.nextRunAt = effective.nextRunAfter(now).orElse(null);
        }
        job.updatedAt = now;

        ScheduledJob saved = jobStore.update(job);
        LOG.infof("Updated job %s (enabled: %s, next run: %s)", saved.id, saved.enabled, saved.nextRunAt);
        return Optional.of(saved);
    }

    public boolean deleteJob(String id) {
        return jobStore.delete(id);
    }

    /**
     * Executions of a job, newest first. The limit defaults to {@value #DEFAULT_EXECUTION_LIMIT} and is capped at
     * {@value #MAX_EXECUTION_LIMIT}.
     */
    public List<JobExecution> listExecutions(String jobId, Integer limit) {
        int effective = limit == null || limit <= 0 ? DEFAULT_EXECUTION_LIMIT : Math.min(limit, MAX_EXECUTION_LIMIT);
        return jobStore.listExecutions(jobId, effective);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
