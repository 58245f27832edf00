package villagecompute.curator.services;

/**
 * Counts from one config sync pass.
 */
public record SyncResult(int created, int updated, int disabled, int failed) {
}
