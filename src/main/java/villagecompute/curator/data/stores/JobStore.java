package villagecompute.curator.data.stores;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import villagecompute.curator.data.models.JobExecution;
import villagecompute.curator.data.models.ScheduledJob;
import villagecompute.curator.jobs.JobType;

/**
 * Persistence for scheduled jobs and their execution history.
 *
 * <p>
 * Returned entities are detached snapshots. Callers change them and hand them back through {@link #update}, which
 * rejects the write if the row changed in between.
 */
public interface JobStore {

    ScheduledJob create(ScheduledJob job);

    Optional<ScheduledJob> findById(String id);

    List<ScheduledJob> list(JobFilter filter);

    /**
     * Jobs with {@code enabled = true} and {@code nextRunAt <= now}, ordered by {@code nextRunAt}.
     */
    List<ScheduledJob> findDue(Instant now);

    /**
     * Writes back a modified job.
     *
     * @throws jakarta.persistence.OptimisticLockException
     *             if the row was changed since {@code job} was read
     */
    ScheduledJob update(ScheduledJob job);

    /**
     * Deletes a job together with its execution history.
     *
     * @return false if no such job exists
     */
    boolean delete(String id);

    /**
     * Records the run bookkeeping after an execution against the current row, so changes made while the job was
     * running are kept. See {@link ScheduledJob#applyRun}.
     *
     * @return the updated job, or empty if it was deleted meanwhile
     */
    Optional<ScheduledJob> recordRun(String jobId, Instant lastRunAt, Instant now);

    /**
     * Inserts a RUNNING execution row.
     */
    JobExecution startExecution(String jobId, Instant startedAt);

    /**
     * Moves a RUNNING execution to its terminal status.
     */
    JobExecution completeExecution(UUID executionId, JobExecution.JobStatus status, Instant completedAt,
            Map<String, Object> result, String error, long durationMs);

    /**
     * Executions of a job, newest first.
     */
    List<JobExecution> listExecutions(String jobId, int limit);

    /**
     * Optional filter for {@link #list}; null fields match everything.
     */
    record JobFilter(Boolean enabled, JobType jobType, String feedId) {

        public static JobFilter all() {
            return new JobFilter(null, null, null);
        }

        public boolean matches(ScheduledJob job) {
            return (enabled == null || enabled == job.enabled) && (jobType == null || jobType == job.jobType)
                    && (feedId == null || feedId.equals(job.feedId));
        }
    }
}
