package villagecompute.curator.api.rest;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.jboss.logging.Logger;

import jakarta.inject.Inject;
import jakarta.persistence.OptimisticLockException;
import jakarta.validation.Valid;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.PATCH;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import villagecompute.curator.api.types.CreateJobRequestType;
import villagecompute.curator.api.types.JobExecutionType;
import villagecompute.curator.api.types.ScheduledJobType;
import villagecompute.curator.api.types.SyncResultType;
import villagecompute.curator.api.types.UpdateJobRequestType;
import villagecompute.curator.config.FeedConfigProvider;
import villagecompute.curator.data.models.JobExecution;
import villagecompute.curator.data.models.ScheduledJob;
import villagecompute.curator.data.stores.JobStore.JobFilter;
import villagecompute.curator.exceptions.DuplicateResourceException;
import villagecompute.curator.exceptions.JobAlreadyRunningException;
import villagecompute.curator.exceptions.ResourceNotFoundException;
import villagecompute.curator.exceptions.ValidationException;
import villagecompute.curator.jobs.JobType;
import villagecompute.curator.services.ConfigSyncService;
import villagecompute.curator.services.JobDefinition;
import villagecompute.curator.services.JobExecutorService;
import villagecompute.curator.services.JobUpdate;
import villagecompute.curator.services.ScheduledJobService;
import villagecompute.curator.services.SyncResult;

/**
 * REST endpoints for scheduled job management.
 *
 * <p>
 * Responsibilities:
 * <ul>
 * <li>{@code GET /api/jobs} - list jobs, filtered by {@code enabled}, {@code job_type}, {@code feed_id}</li>
 * <li>{@code GET /api/jobs/{id}} - get single job</li>
 * <li>{@code POST /api/jobs} - create job</li>
 * <li>{@code PATCH /api/jobs/{id}} - partial update</li>
 * <li>{@code DELETE /api/jobs/{id}} - delete job and its executions</li>
 * <li>{@code GET /api/jobs/{id}/executions} - execution history, newest first</li>
 * <li>{@code POST /api/jobs/{id}/run} - run immediately and return the execution</li>
 * <li>{@code POST /api/jobs/sync} - re-read the feed configuration and sync recap jobs</li>
 * </ul>
 *
 * <p>
 * Errors are returned as {@code {"error": "..."}}.
 */
@Path("/api/jobs")
@Tag(
        name = "Jobs",
        description = "Scheduled job management")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class JobResource {

    private static final Logger LOG = Logger.getLogger(JobResource.class);

    @Inject
    ScheduledJobService jobService;

    @Inject
    JobExecutorService jobExecutorService;

    @Inject
    ConfigSyncService configSyncService;

    @Inject
    FeedConfigProvider feedConfigProvider;

    @GET
    @Operation(
            summary = "List scheduled jobs")
    public Response listJobs(@QueryParam("enabled") Boolean enabled, @QueryParam("job_type") String jobType,
            @QueryParam("feed_id") String feedId) {
        JobType type = null;
        if (jobType != null && !jobType.isBlank()) {
            try {
                type = JobType.valueOf(jobType.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                return Response.status(Response.Status.BAD_REQUEST)
                        .entity(new ErrorResponse("Unknown job type: " + jobType)).build();
            }
        }

        List<ScheduledJobType> jobs = jobService.listJobs(new JobFilter(enabled, type, feedId)).stream()
                .map(ScheduledJobType::fromEntity).toList();
        return Response.ok(jobs).build();
    }

    @GET
    @Path("/{id}")
    @Operation(
            summary = "Get a scheduled job")
    public Response getJob(@PathParam("id") String id) {
        Optional<ScheduledJob> job = jobService.getJob(id);
        if (job.isEmpty()) {
            return notFound(id);
        }
        return Response.ok(ScheduledJobType.fromEntity(job.get())).build();
    }

    /**
     * Creates a job. The schedule is validated before anything is stored.
     *
     * @return 201 with the created job, 400 on invalid input, 409 if the id is taken
     */
    @POST
    @Operation(
            summary = "Create a scheduled job")
    public Response createJob(@Valid CreateJobRequestType request) {
        if (request == null) {
            return Response.status(Response.Status.BAD_REQUEST).entity(new ErrorResponse("Request body required"))
                    .build();
        }

        try {
            ScheduledJob created = jobService.createJob(new JobDefinition(request.id(), request.name(),
                    request.description(), request.jobType(), request.feedId(), request.schedule(),
                    request.isOneTime(), request.enabled(), request.config()));
            LOG.infof("Created job: id=%s, type=%s, schedule=%s", created.id, created.jobType, created.schedule);
            return Response.status(Response.Status.CREATED).entity(ScheduledJobType.fromEntity(created)).build();
        } catch (ValidationException e) {
            return Response.status(Response.Status.BAD_REQUEST).entity(new ErrorResponse(e.getMessage())).build();
        } catch (DuplicateResourceException e) {
            return Response.status(Response.Status.CONFLICT).entity(new ErrorResponse(e.getMessage())).build();
        } catch (Exception e) {
            LOG.errorf(e, "Failed to create job %s", request.name());
            return Response.status(Response.Status.INTERNAL_SERVER_ERROR)
                    .entity(new ErrorResponse("Failed to create job")).build();
        }
    }

    @PATCH
    @Path("/{id}")
    @Operation(
            summary = "Update a scheduled job")
    public Response updateJob(@PathParam("id") String id, @Valid UpdateJobRequestType request) {
        if (request == null) {
            return Response.status(Response.Status.BAD_REQUEST).entity(new ErrorResponse("Request body required"))
                    .build();
        }

        try {
            Optional<ScheduledJob> updated = jobService.updateJob(id,
                    new JobUpdate(request.name(), request.description(), request.feedId(), request.schedule(),
                            request.isOneTime(), request.enabled(), request.config()));
            if (updated.isEmpty()) {
                return notFound(id);
            }
            return Response.ok(ScheduledJobType.fromEntity(updated.get())).build();
        } catch (ValidationException e) {
            return Response.status(Response.Status.BAD_REQUEST).entity(new ErrorResponse(e.getMessage())).build();
        } catch (OptimisticLockException e) {
            return Response.status(Response.Status.CONFLICT)
                    .entity(new ErrorResponse("Job was modified concurrently, retry the update")).build();
        } catch (Exception e) {
            LOG.errorf(e, "Failed to update job %s", id);
            return Response.status(Response.Status.INTERNAL_SERVER_ERROR)
                    .entity(new ErrorResponse("Failed to update job")).build();
        }
    }

    @DELETE
    @Path("/{id}")
    @Operation(
            summary = "Delete a scheduled job and its execution history")
    public Response deleteJob(@PathParam("id") String id) {
        if (!jobService.deleteJob(id)) {
            return notFound(id);
        }
        LOG.infof("Deleted job: id=%s", id);
        return Response.noContent().build();
    }

    /**
     * Lists executions of a job.
     *
     * @param limit
     *            maximum number of executions (default 10, max 100)
     */
    @GET
    @Path("/{id}/executions")
    @Operation(
            summary = "List executions of a job, newest first")
    public Response listExecutions(@PathParam("id") String id, @QueryParam("limit") Integer limit) {
        if (jobService.getJob(id).isEmpty()) {
            return notFound(id);
        }
        List<JobExecutionType> executions = jobService.listExecutions(id, limit).stream()
                .map(JobExecutionType::fromEntity).toList();
        return Response.ok(executions).build();
    }

    /**
     * Runs a job now, regardless of its schedule. Blocks until the run completes.
     *
     * @return the execution record (SUCCESS or FAILED), 404 if absent, 409 if the job is already running
     */
    @POST
    @Path("/{id}/run")
    @Operation(
            summary = "Run a job immediately")
    public Response runJob(@PathParam("id") String id) {
        try {
            JobExecution execution = jobExecutorService.runNow(id);
            return Response.ok(JobExecutionType.fromEntity(execution)).build();
        } catch (ResourceNotFoundException e) {
            return Response.status(Response.Status.NOT_FOUND).entity(new ErrorResponse(e.getMessage())).build();
        } catch (JobAlreadyRunningException e) {
            return Response.status(Response.Status.CONFLICT).entity(new ErrorResponse(e.getMessage())).build();
        } catch (Exception e) {
            LOG.errorf(e, "Failed to run job %s", id);
            return Response.status(Response.Status.INTERNAL_SERVER_ERROR)
                    .entity(new ErrorResponse("Failed to run job")).build();
        }
    }

    @POST
    @Path("/sync")
    @Operation(
            summary = "Sync recap jobs from the feed configuration")
    public Response syncJobs() {
        try {
            feedConfigProvider.reload();
            SyncResult result = configSyncService.syncRecapJobs();
            return Response.ok(SyncResultType.from(result)).build();
        } catch (ValidationException e) {
            return Response.status(Response.Status.BAD_REQUEST).entity(new ErrorResponse(e.getMessage())).build();
        } catch (Exception e) {
            LOG.errorf(e, "Failed to sync recap jobs");
            return Response.status(Response.Status.INTERNAL_SERVER_ERROR)
                    .entity(new ErrorResponse("Failed to sync recap jobs")).build();
        }
    }

    private static Response notFound(String id) {
        return Response.status(Response.Status.NOT_FOUND).entity(new ErrorResponse("Job not found: " + id)).build();
    }

    /**
     * Error response record.
     */
    public record ErrorResponse(String error) {
    }
}
