package villagecompute.curator.jobs;

import java.util.Map;

import villagecompute.curator.data.models.ScheduledJob;

/**
 * Contract for scheduled job handlers.
 *
 * <p>
 * Implementations are CDI beans; {@link villagecompute.curator.services.JobExecutorService} discovers them at startup
 * and builds a {@link JobType} to handler registry. Registering two handlers for the same type fails startup.
 *
 * <p>
 * <b>Thread Safety:</b> {@link #execute(ScheduledJob)} runs on the executor's worker pool and may be called
 * concurrently for different jobs.
 */
public interface JobHandler {

    /**
     * Returns the job type this handler processes.
     *
     * @return the job type enum value
     */
    JobType handlesType();

    /**
     * Executes one run of the job.
     *
     * <p>
     * The returned map is stored as the execution's JSON result. Any exception marks the execution FAILED; the job is
     * still rescheduled from its cron expression. Handlers should honour thread interruption, which is how a run that
     * exceeds the configured timeout is cancelled.
     *
     * @param job
     *            snapshot of the job row at dispatch time
     * @return result summary to record, may be empty
     * @throws Exception
     *             any error during execution
     */
    Map<String, Object> execute(ScheduledJob job) throws Exception;
}
