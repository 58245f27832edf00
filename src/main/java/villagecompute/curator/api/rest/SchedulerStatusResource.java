package villagecompute.curator.api.rest;

import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;

import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import villagecompute.curator.api.types.SchedulerStatusType;
import villagecompute.curator.services.JobExecutorService;
import villagecompute.curator.services.LeaderElectionService;

/**
 * Reports the scheduler state of the node answering the request. Behind a load balancer, repeated calls may reach
 * different nodes.
 */
@Path("/api/scheduler")
@Tag(
        name = "Scheduler",
        description = "Leader election state")
@Produces(MediaType.APPLICATION_JSON)
public class SchedulerStatusResource {

    @Inject
    LeaderElectionService leaderElectionService;

    @Inject
    JobExecutorService jobExecutorService;

    @GET
    @Path("/status")
    @Operation(
            summary = "Node id and leadership flag of this node")
    public Response status() {
        return Response.ok(new SchedulerStatusType(leaderElectionService.getNodeId(), leaderElectionService.getLockId(),
                leaderElectionService.isLeader(), jobExecutorService.getInFlightCount(),
                jobExecutorService.getAvailableSlots())).build();
    }
}
