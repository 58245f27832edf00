package villagecompute.curator.api.types;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

import org.eclipse.microprofile.openapi.annotations.media.Schema;

import com.fasterxml.jackson.annotation.JsonProperty;

import villagecompute.curator.data.models.JobExecution;
import villagecompute.curator.data.models.JobExecution.JobStatus;

/**
 * API type representing one job execution.
 */
@Schema(
        description = "One run of a scheduled job")
public record JobExecutionType(@Schema(
        description = "Execution identifier",
        required = true) UUID id,

        @Schema(
                description = "Job identifier",
                required = true) @JsonProperty("job_id") String jobId,

        @Schema(
                description = "Run start time",
                required = true) @JsonProperty("started_at") Instant startedAt,

        @Schema(
                description = "Run end time, null while running",
                nullable = true) @JsonProperty("completed_at") Instant completedAt,

        @Schema(
                description = "Execution status",
                example = "SUCCESS",
                required = true) JobStatus status,

        @Schema(
                description = "Error message for failed runs",
                nullable = true) String error,

        @Schema(
                description = "Handler result summary",
                nullable = true) Map<String, Object> result,

        @Schema(
                description = "Run duration in milliseconds",
                nullable = true) @JsonProperty("duration_ms") Long durationMs) {

    public static JobExecutionType fromEntity(JobExecution execution) {
        return new JobExecutionType(execution.id, execution.jobId, execution.startedAt, execution.completedAt,
                execution.status, execution.error, execution.result, execution.durationMs);
    }
}
