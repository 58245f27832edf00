package villagecompute.curator.services;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import io.micrometer.core.instrument.MeterRegistry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;
import villagecompute.curator.data.models.JobExecution;
import villagecompute.curator.data.models.JobExecution.JobStatus;
import villagecompute.curator.data.models.ScheduledJob;
import villagecompute.curator.data.stores.JobStore;
import villagecompute.curator.exceptions.JobAlreadyRunningException;
import villagecompute.curator.exceptions.ResourceNotFoundException;
import villagecompute.curator.jobs.JobHandler;
import villagecompute.curator.jobs.JobSchedule;
import villagecompute.curator.jobs.JobType;
import villagecompute.curator.observability.LoggingConfig;

/**
 * Runs scheduled jobs and keeps their bookkeeping.
 *
 * <p>
 * One run follows {@code RUNNING -> SUCCESS | FAILED}: an execution row is inserted before the handler is invoked and
 * completed afterwards with the result or error and the duration. Whatever the outcome, {@code lastRunAt} becomes the
 * start time and {@code nextRunAt} is recalculated from the schedule; one-time jobs are disabled instead. The
 * bookkeeping is applied to the row as it is when the run ends, so an edit made through the API during the run (a
 * new schedule or {@code enabled = false}) is kept.
 *
 * <p>
 * <b>Dispatch:</b> {@link #dispatch} is fire-and-forget for the due-job poller. At most
 * {@code curator.scheduler.max-concurrent-jobs} runs execute at once and a job already running in this process is not
 * started again; a job that is refused a slot keeps its {@code nextRunAt} and is picked up by a later poll.
 * {@link #runNow} executes synchronously on the caller's thread through the same record and reschedule path.
 *
 * <p>
 * <b>Timeout:</b> each handler call is bounded by {@code curator.scheduler.job-timeout}. On expiry the worker is
 * interrupted and the run is recorded FAILED. The execution slot and the running marker stay taken until the handler
 * thread actually returns, so a handler that ignores the interrupt still counts against the limit and its job is not
 * started again meanwhile.
 *
 * <p>
 * <b>Telemetry:</b> span {@code job.execute} with {@code job.id}, {@code job.type} and {@code job.status} attributes,
 * counter {@code curator_job_executions_total{job_type,status}} and timer
 * {@code curator_job_execution_duration{job_type}}.
 */
@ApplicationScoped
public class JobExecutorService {

    private static final Logger LOG = Logger.getLogger(JobExecutorService.class);

    private final Map<JobType, JobHandler> handlerRegistry;

    private final Set<String> inFlight = ConcurrentHashMap.newKeySet();

    @Inject
    JobStore jobStore;

    @Inject
    Tracer tracer;

    @Inject
    MeterRegistry meterRegistry;

    @Inject
    Clock clock;

    @ConfigProperty(
            name = "curator.scheduler.max-concurrent-jobs",
            defaultValue = "4")
    int maxConcurrentJobs;

    @ConfigProperty(
            name = "curator.scheduler.job-timeout",
            defaultValue = "10m")
    Duration jobTimeout;

    private Semaphore slots;

    private ExecutorService dispatchPool;

    private ExecutorService handlerPool;

    @Inject
    public JobExecutorService(Instance<JobHandler> handlers) {
        this((Iterable<JobHandler>) handlers);
    }

    public JobExecutorService(Iterable<JobHandler> handlers) {
        this.handlerRegistry = buildHandlerRegistry(handlers);
        LOG.infof("Initialized JobExecutorService with %d registered handlers", handlerRegistry.size());
    }

    /**
     * Builds the type to handler map.
     *
     * @throws IllegalStateException
     *             if two handlers register for the same JobType
     */
    private static Map<JobType, JobHandler> buildHandlerRegistry(Iterable<JobHandler> handlers) {
        Map<JobType, JobHandler> registry = new EnumMap<>(JobType.class);
        for (JobHandler handler : handlers) {
            JobType type = handler.handlesType();
            if (registry.containsKey(type)) {
                throw new IllegalStateException("Duplicate handlers registered for JobType." + type + ": "
                        + registry.get(type).getClass().getName() + " and " + handler.getClass().getName());
            }
            registry.put(type, handler);
            LOG.debugf("Registered handler %s for JobType.%s", handler.getClass().getSimpleName(), type);
        }
        return registry;
    }

    @PostConstruct
    void init() {
        slots = new Semaphore(Math.max(1, maxConcurrentJobs));
        dispatchPool = Executors.newFixedThreadPool(Math.max(1, maxConcurrentJobs), namedThreads("job-dispatch"));
        handlerPool = Executors.newFixedThreadPool(Math.max(1, maxConcurrentJobs), namedThreads("job-worker"));
    }

    @PreDestroy
    void shutdown() {
        if (dispatchPool != null) {
            dispatchPool.shutdownNow();
        }
        if (handlerPool != null) {
            handlerPool.shutdownNow();
        }
    }

    /**
     * Starts a due job in the background.
     *
     * @return false if the job is already running here or no execution slot is free
     */
    public boolean dispatch(ScheduledJob job) {
        if (!inFlight.add(job.id)) {
            LOG.debugf("Job %s is still running, not dispatching again", job.id);
            return false;
        }
        if (!slots.tryAcquire()) {
            inFlight.remove(job.id);
            LOG.infof("No free execution slot for job %s (limit %d), leaving it due for the next poll", job.id,
                    maxConcurrentJobs);
            return false;
        }

        RunCompletion completion = new RunCompletion(() -> {
            slots.release();
            inFlight.remove(job.id);
        });
        try {
            CompletableFuture.runAsync(() -> {
                try {
                    execute(job, completion);
                } catch (RuntimeException e) {
                    LOG.errorf(e, "Job %s could not be executed", job.id);
                }
            }, dispatchPool);
            return true;
        } catch (RejectedExecutionException e) {
            slots.release();
            inFlight.remove(job.id);
            LOG.warnf("Executor is shutting down, job %s not dispatched", job.id);
            return false;
        }
    }

    /**
     * Executes a job immediately, ignoring its next run time.
     *
     * @return the completed execution record
     * @throws ResourceNotFoundException
     *             if no job has this id
     * @throws JobAlreadyRunningException
     *             if the job is executing in this process
     */
    public JobExecution runNow(String jobId) {
        ScheduledJob job = jobStore.findById(jobId)
                .orElseThrow(() -> new ResourceNotFoundException("Job not found: " + jobId));
        if (!inFlight.add(job.id)) {
            throw new JobAlreadyRunningException("Job " + jobId + " is already running");
        }
        LOG.infof("Manually running job %s", jobId);
        return execute(job, new RunCompletion(() -> inFlight.remove(job.id)));
    }

    /**
     * Executes one run of {@code job}, records the outcome and reschedules it. Handler failures are recorded, not
     * thrown; store failures propagate.
     */
    JobExecution execute(ScheduledJob job) {
        return execute(job, new RunCompletion(() -> {
        }));
    }

    private JobExecution execute(ScheduledJob job, RunCompletion completion) {
        boolean handedToWorker = false;
        Instant startedAt = clock.instant();
        long startNanos = System.nanoTime();

        Span span = tracer.spanBuilder("job.execute").setAttribute("job.id", job.id)
                .setAttribute("job.type", String.valueOf(job.jobType)).startSpan();

        try (Scope scope = span.makeCurrent()) {
            LoggingConfig.enrichWithTraceContext();
            LoggingConfig.setJobId(job.id);
            LoggingConfig.setFeedId(job.feedId);
            LoggingConfig.setRequestOrigin("JobType." + job.jobType);

            JobExecution execution = jobStore.startExecution(job.id, startedAt);
            LOG.infof("Executing job %s (%s, type: %s)", job.id, job.name, job.jobType);

            JobStatus status;
            Map<String, Object> result = null;
            String error = null;
            try {
                handedToWorker = true;
                result = invokeHandler(job, completion);
                status = JobStatus.SUCCESS;
                span.addEvent("job.completed");
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                status = JobStatus.FAILED;
                error = "Interrupted";
                span.recordException(e);
                span.setStatus(StatusCode.ERROR);
                LOG.warnf(e, "Job %s interrupted during execution", job.id);
            } catch (Exception e) {
                status = JobStatus.FAILED;
                error = describe(e);
                span.recordException(e);
                span.setStatus(StatusCode.ERROR);
                LOG.errorf(e, "Job %s (type: %s) failed", job.id, job.jobType);
            }

            Duration elapsed = Duration.ofNanos(System.nanoTime() - startNanos);
            JobExecution completed = jobStore.completeExecution(execution.id, status, clock.instant(), result,
                    truncate(error), elapsed.toMillis());
            reschedule(job, startedAt);

            span.setAttribute("job.status", status.name());
            String jobType = String.valueOf(job.jobType);
            meterRegistry.counter("curator_job_executions_total", "job_type", jobType, "status", status.name())
                    .increment();
            meterRegistry.timer("curator_job_execution_duration", "job_type", jobType).record(elapsed);
            LOG.infof("Job %s finished with %s in %d ms", job.id, status, elapsed.toMillis());
            return completed;
        } finally {
            span.end();
            LoggingConfig.clearMDC();
            if (!handedToWorker) {
                completion.handlerExited();
            }
            completion.bookkeepingDone();
        }
    }

    /**
     * Runs the handler on a worker thread and waits up to the job timeout. {@code completion} is told exactly once
     * when the worker is done with the handler, or right away if the handler never starts.
     */
    private Map<String, Object> invokeHandler(ScheduledJob job, RunCompletion completion) throws Exception {
        JobHandler handler = job.jobType != null ? handlerRegistry.get(job.jobType) : null;
        if (handler == null) {
            completion.handlerExited();
            throw new IllegalStateException("No handler registered for JobType." + job.jobType);
        }

        AtomicBoolean claimed = new AtomicBoolean();
        Future<Map<String, Object>> future;
        try {
            future = handlerPool.submit(() -> {
                if (!claimed.compareAndSet(false, true)) {
                    return null;
                }
                LoggingConfig.setJobId(job.id);
                LoggingConfig.setFeedId(job.feedId);
                try {
                    return handler.execute(job);
                } finally {
                    LoggingConfig.clearMDC();
                    completion.handlerExited();
                }
            });
        } catch (RejectedExecutionException e) {
            completion.handlerExited();
            throw e;
        }
        try {
            return future.get(jobTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            abandon(future, claimed, completion);
            LOG.warnf("Job %s exceeded its timeout of %s, its slot stays taken until the handler returns", job.id,
                    jobTimeout);
            throw new TimeoutException("Job timed out after " + jobTimeout);
        } catch (InterruptedException e) {
            abandon(future, claimed, completion);
            throw e;
        } catch (ExecutionException e) {
            if (e.getCause() instanceof Exception cause) {
                throw cause;
            }
            throw e;
        }
    }

    private static void abandon(Future<?> future, AtomicBoolean claimed, RunCompletion completion) {
        future.cancel(true);
        if (claimed.compareAndSet(false, true)) {
            // never started, so the worker will not report back
            completion.handlerExited();
        }
    }

    private void reschedule(ScheduledJob job, Instant startedAt) {
        jobStore.recordRun(job.id, startedAt, clock.instant()).ifPresent(current -> {
            if (current.isOneTime) {
                LOG.infof("One-time job %s disabled after execution", job.id);
            } else {
                LOG.debugf("Job %s next run at %s", job.id, current.nextRunAt);
            }
        });
    }

    private static String describe(Exception e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }

    private static String truncate(String error) {
        if (error == null || error.length() <= JobExecution.MAX_ERROR_LENGTH) {
            return error;
        }
        return error.substring(0, JobExecution.MAX_ERROR_LENGTH);
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger count = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + count.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    /**
     * Runs its release action once both the bookkeeping of a run and the worker thread running the handler are done.
     */
    private static final class RunCompletion {

        private final AtomicBoolean handlerExited = new AtomicBoolean();
        private final AtomicInteger pending = new AtomicInteger(2);
        private final Runnable release;

        RunCompletion(Runnable release) {
            this.release = release;
        }

        void handlerExited() {
            if (handlerExited.compareAndSet(false, true)) {
                countDown();
            }
        }

        void bookkeepingDone() {
            countDown();
        }

        private void countDown() {
            if (pending.decrementAndGet() == 0) {
                release.run();
            }
        }
    }

    public boolean isRunning(String jobId) {
        return inFlight.contains(jobId);
    }

    public int getInFlightCount() {
        return inFlight.size();
    }

    public int getAvailableSlots() {
        return slots != null ? slots.availablePermits() : 0;
    }
}
