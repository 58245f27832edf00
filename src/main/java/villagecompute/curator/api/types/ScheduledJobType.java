package villagecompute.curator.api.types;

import java.time.Instant;
import java.util.Map;

import org.eclipse.microprofile.openapi.annotations.media.Schema;

import com.fasterxml.jackson.annotation.JsonProperty;

import jakarta.validation.constraints.NotNull;
import villagecompute.curator.data.models.ScheduledJob;
import villagecompute.curator.jobs.JobType;

/**
 * API type representing a scheduled job.
 *
 * @param id
 *            job identifier ({@code recap-<feedId>} for config-synced recaps)
 * @param name
 *            display name
 * @param description
 *            optional description
 * @param jobType
 *            handler kind
 * @param feedId
 *            owning feed, if any
 * @param schedule
 *            cron expression or ISO-8601 timestamp
 * @param isOneTime
 *            whether the job disables itself after one run
 * @param enabled
 *            whether the job is picked up by the poller
 * @param lastRunAt
 *            start of the most recent execution
 * @param nextRunAt
 *            next due time (null when disabled)
 * @param config
 *            handler-specific settings
 * @param createdAt
 *            creation timestamp
 * @param updatedAt
 *            last modification timestamp
 */
@Schema(
        description = "Scheduled job with its schedule and run bookkeeping")
public record ScheduledJobType(@Schema(
        description = "Job identifier",
        example = "recap-ethereum",
        required = true) @NotNull String id,

        @Schema(
                description = "Display name",
                example = "Ethereum Recap",
                required = true) @NotNull String name,

        @Schema(
                description = "Optional description",
                nullable = true) String description,

        @Schema(
                description = "Job type",
                example = "RECAP",
                required = true) @JsonProperty("job_type") @NotNull JobType jobType,

        @Schema(
                description = "Feed the job belongs to",
                example = "ethereum",
                nullable = true) @JsonProperty("feed_id") String feedId,

        @Schema(
                description = "Five-field cron expression (UTC) or ISO-8601 timestamp",
                example = "0 0 * * 0",
                required = true) @NotNull String schedule,

        @Schema(
                description = "Whether the job is disabled after a single run",
                required = true) @JsonProperty("is_one_time") boolean isOneTime,

        @Schema(
                description = "Whether the job is scheduled",
                required = true) boolean enabled,

        @Schema(
                description = "Start time of the most recent run",
                nullable = true) @JsonProperty("last_run_at") Instant lastRunAt,

        @Schema(
                description = "Next due time, null when disabled",
                nullable = true) @JsonProperty("next_run_at") Instant nextRunAt,

        @Schema(
                description = "Handler-specific configuration") Map<String, Object> config,

        @Schema(
                description = "Creation timestamp",
                required = true) @JsonProperty("created_at") @NotNull Instant createdAt,

        @Schema(
                description = "Last modification timestamp",
                required = true) @JsonProperty("updated_at") @NotNull Instant updatedAt) {

    public static ScheduledJobType fromEntity(ScheduledJob job) {
        return new ScheduledJobType(job.id, job.name, job.description, job.jobType, job.feedId, job.schedule,
                job.isOneTime, job.enabled, job.lastRunAt, job.nextRunAt, job.config, job.createdAt, job.updatedAt);
    }
}
