package villagecompute.curator.services;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of a fan-out: which distributors accepted the content and which failed (with their error messages).
 */
public record DistributionReport(List<String> succeeded, Map<String, String> failed) {

    public DistributionReport {
        succeeded = List.copyOf(succeeded);
        failed = Collections.unmodifiableMap(new LinkedHashMap<>(failed));
    }

    public boolean hasFailures() {
        return !failed.isEmpty();
    }
}
