package villagecompute.curator.data.stores;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import org.jboss.logging.Logger;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.persistence.LockModeType;
import jakarta.transaction.Transactional;
import villagecompute.curator.data.models.JobExecution;
import villagecompute.curator.data.models.ScheduledJob;
import villagecompute.curator.exceptions.ResourceNotFoundException;

/**
 * {@link JobStore} backed by the {@code scheduled_jobs} and {@code job_executions} tables.
 */
@ApplicationScoped
public class PanacheJobStore implements JobStore {

    private static final Logger LOG = Logger.getLogger(PanacheJobStore.class);

    @Override
    @Transactional
    public ScheduledJob create(ScheduledJob job) {
        job.persist();
        LOG.infof("Created scheduled job %s (type: %s, schedule: %s)", job.id, job.jobType, job.schedule);
        return job;
    }

    @Override
    @Transactional
    public Optional<ScheduledJob> findById(String id) {
        return ScheduledJob.findByIdOptional(id);
    }

    @Override
    @Transactional
    public List<ScheduledJob> list(JobFilter filter) {
        JobFilter effective = filter != null ? filter : JobFilter.all();
        return ScheduledJob.findFiltered(effective.enabled(), effective.jobType(), effective.feedId());
    }

    @Override
    @Transactional
    public List<ScheduledJob> findDue(Instant now) {
        return ScheduledJob.findDue(now);
    }

    @Override
    @Transactional
    public ScheduledJob update(ScheduledJob job) {
        ScheduledJob merged = ScheduledJob.getEntityManager().merge(job);
        ScheduledJob.flush();
        return merged;
    }

    @Override
    @Transactional
    public boolean delete(String id) {
        long executions = JobExecution.deleteByJob(id);
        boolean deleted = ScheduledJob.deleteById(id);
        if (deleted) {
            LOG.infof("Deleted scheduled job %s and %d executions", id, executions);
        }
        return deleted;
    }

    @Override
    @Transactional
    public Optional<ScheduledJob> recordRun(String jobId, Instant lastRunAt, Instant now) {
        ScheduledJob job = ScheduledJob.findById(jobId, LockModeType.PESSIMISTIC_WRITE);
        if (job == null) {
            LOG.warnf("Job %s was deleted while running, skipping reschedule", jobId);
            return Optional.empty();
        }
        job.applyRun(lastRunAt, now);
        return Optional.of(job);
    }

    @Override
    @Transactional
    public JobExecution startExecution(String jobId, Instant startedAt) {
        JobExecution execution = new JobExecution();
        execution.jobId = jobId;
        execution.startedAt = startedAt;
        execution.status = JobExecution.JobStatus.RUNNING;
        execution.createdAt = startedAt;
        execution.persist();
        return execution;
    }

    @Override
    @Transactional
    public JobExecution completeExecution(UUID executionId, JobExecution.JobStatus status, Instant completedAt,
            Map<String, Object> result, String error, long durationMs) {
        JobExecution execution = JobExecution.findById(executionId);
        if (execution == null) {
            throw new ResourceNotFoundException("Execution not found: " + executionId);
        }
        execution.status = status;
        execution.completedAt = completedAt;
        execution.result = result;
        execution.error = error;
        execution.durationMs = durationMs;
        return execution;
    }

    @Override
    @Transactional
    public List<JobExecution> listExecutions(String jobId, int limit) {
        return JobExecution.findByJob(jobId, limit);
    }
}
