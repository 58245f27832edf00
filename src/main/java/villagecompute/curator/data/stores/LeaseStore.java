package villagecompute.curator.data.stores;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import villagecompute.curator.data.models.SchedulerLock;

/**
 * Persistent named leases used for mutual exclusion between process instances.
 *
 * <p>
 * Every mutating method is a compare-and-swap: it changes state only when the stated precondition holds at write time,
 * and reports through its return value whether it did. Implementations must never let two nodes hold the same
 * unexpired lease.
 */
public interface LeaseStore {

    /**
     * Acquires the lease when it is absent or expired, or extends it when {@code nodeId} already holds it.
     *
     * @return true if {@code nodeId} holds the lease afterwards; false if another node holds an unexpired lease
     */
    boolean tryAcquireOrRenew(String lockId, String nodeId, Duration ttl, Instant now);

    /**
     * Extends the lease only while {@code nodeId} is still its owner.
     *
     * @return false if ownership was lost; the caller must stop acting as leader
     */
    boolean renew(String lockId, String nodeId, Duration ttl, Instant now);

    /**
     * Deletes the lease if {@code nodeId} still owns it.
     *
     * @return true if a row was removed
     */
    boolean release(String lockId, String nodeId);

    Optional<SchedulerLock> find(String lockId);
}
