package villagecompute.curator.services;

import java.util.Map;

/**
 * Partial job update; null fields are left unchanged.
 */
public record JobUpdate(String name, String description, String feedId, String schedule, Boolean isOneTime,
        Boolean enabled, Map<String, Object> config) {
}
