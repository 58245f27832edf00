package villagecompute.curator.data.models;

import java.time.Instant;

import io.quarkus.hibernate.orm.panache.PanacheEntityBase;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

/**
 * Named lease used for leader election. At most one unexpired row exists per {@code lock_id}; ownership only moves
 * through the conditional statements below.
 */
@Entity
@Table(
        name = "scheduler_locks")
public class SchedulerLock extends PanacheEntityBase {

    @Id
    @Column(
            name = "lock_id",
            nullable = false)
    public String lockId;

    @Column(
            name = "node_id",
            nullable = false)
    public String nodeId;

    @Column(
            name = "expires_at",
            nullable = false)
    public Instant expiresAt;

    @Column(
            name = "created_at",
            nullable = false)
    public Instant createdAt;

    @Column(
            name = "updated_at",
            nullable = false)
    public Instant updatedAt;

    /**
     * Takes the lease if it has expired or is already held by {@code nodeId}.
     *
     * @return number of rows updated (0 or 1)
     */
    public static int takeOver(String lockId, String nodeId, Instant expiresAt, Instant now) {
        return update("nodeId = ?1, expiresAt = ?2, updatedAt = ?3 WHERE lockId = ?4 AND (expiresAt < ?3 OR nodeId = ?1)",
                nodeId, expiresAt, now, lockId);
    }

    /**
     * Pushes the expiry forward only while {@code nodeId} still owns the lease.
     *
     * @return number of rows updated (0 or 1)
     */
    public static int extend(String lockId, String nodeId, Instant expiresAt, Instant now) {
        return update("expiresAt = ?1, updatedAt = ?2 WHERE lockId = ?3 AND nodeId = ?4", expiresAt, now, lockId,
                nodeId);
    }

    public static long releaseIfOwned(String lockId, String nodeId) {
        return delete("lockId = ?1 AND nodeId = ?2", lockId, nodeId);
    }

    public static SchedulerLock create(String lockId, String nodeId, Instant expiresAt, Instant now) {
        SchedulerLock lock = new SchedulerLock();
        lock.lockId = lockId;
        lock.nodeId = nodeId;
        lock.expiresAt = expiresAt;
        lock.createdAt = now;
        lock.updatedAt = now;
        return lock;
    }
}
