package villagecompute.curator.api.types;

import java.util.Map;

import com.fasterxml.jackson.annotation.JsonProperty;

import jakarta.validation.constraints.Size;

/**
 * API type for partially updating a scheduled job ({@code PATCH /api/jobs/{id}}). Null fields are left unchanged.
 */
public record UpdateJobRequestType(@Size(
        max = 255) String name,
        String description, @JsonProperty("feed_id") String feedId, String schedule,
        @JsonProperty("is_one_time") Boolean isOneTime, Boolean enabled, Map<String, Object> config) {
}
