package villagecompute.curator.api.types;

import org.eclipse.microprofile.openapi.annotations.media.Schema;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Leadership and load of the answering node.
 */
@Schema(
        description = "Scheduler state of the node serving the request")
public record SchedulerStatusType(@Schema(
        description = "Node identifier",
        example = "node-1a2b3c4d") @JsonProperty("node_id") String nodeId,

        @Schema(
                description = "Lease name contended for") @JsonProperty("lock_id") String lockId,

        @Schema(
                description = "Whether this node is the scheduler leader") boolean leader,

        @Schema(
                description = "Jobs executing on this node") @JsonProperty("jobs_in_flight") int jobsInFlight,

        @Schema(
                description = "Free execution slots on this node") @JsonProperty("available_slots") int availableSlots) {
}
