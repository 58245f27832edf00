package villagecompute.curator.api.types;

import java.util.Map;

import com.fasterxml.jackson.annotation.JsonProperty;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import villagecompute.curator.jobs.JobType;

/**
 * API type for creating a scheduled job ({@code POST /api/jobs}).
 *
 * @param id
 *            optional job id, generated when absent
 * @param name
 *            display name (1-255 characters)
 * @param description
 *            optional description
 * @param jobType
 *            handler kind
 * @param feedId
 *            owning feed (required for RECAP)
 * @param schedule
 *            cron expression or ISO-8601 timestamp
 * @param isOneTime
 *            disable after one run (implied by a timestamp schedule)
 * @param enabled
 *            defaults to true
 * @param config
 *            handler-specific settings
 */
public record CreateJobRequestType(@Size(
        max = 255) String id,
        @NotBlank @Size(
                max = 255) String name,
        String description, @JsonProperty("job_type") @NotNull JobType jobType, @JsonProperty("feed_id") String feedId,
        @NotBlank String schedule, @JsonProperty("is_one_time") Boolean isOneTime, Boolean enabled,
        Map<String, Object> config) {
}
