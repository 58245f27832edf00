package villagecompute.curator.api.types;

import villagecompute.curator.services.SyncResult;

/**
 * Response of {@code POST /api/jobs/sync}.
 */
public record SyncResultType(int created, int updated, int disabled, int failed) {

    public static SyncResultType from(SyncResult result) {
        return new SyncResultType(result.created(), result.updated(), result.disabled(), result.failed());
    }
}
