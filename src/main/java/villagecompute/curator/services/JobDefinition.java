package villagecompute.curator.services;

import java.util.Map;

import villagecompute.curator.jobs.JobType;

/**
 * Fields of a job to create. {@code id} may be null to generate one; {@code enabled} defaults to true.
 */
public record JobDefinition(String id, String name, String description, JobType jobType, String feedId,
        String schedule, Boolean isOneTime, Boolean enabled, Map<String, Object> config) {
}
