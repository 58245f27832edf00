package villagecompute.curator.data.stores;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import org.jboss.logging.Logger;

import io.quarkus.narayana.jta.QuarkusTransaction;
import io.quarkus.narayana.jta.QuarkusTransactionException;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.persistence.PersistenceException;
import villagecompute.curator.data.models.SchedulerLock;

/**
 * {@link LeaseStore} backed by the {@code scheduler_locks} table.
 *
 * <p>
 * Ownership changes go through a single conditional {@code UPDATE ... WHERE expires_at < now OR node_id = me}; the
 * row is only inserted when absent, and a concurrent insert by another node surfaces as a primary key violation, which
 * is reported as "not acquired". Each call runs in its own transaction so the outcome is committed before the caller
 * acts on it.
 */
@ApplicationScoped
public class PanacheLeaseStore implements LeaseStore {

    private static final Logger LOG = Logger.getLogger(PanacheLeaseStore.class);

    @Override
    public boolean tryAcquireOrRenew(String lockId, String nodeId, Duration ttl, Instant now) {
        Instant expiresAt = now.plus(ttl);
        int updated = QuarkusTransaction.requiringNew()
                .call(() -> SchedulerLock.takeOver(lockId, nodeId, expiresAt, now));
        if (updated > 0) {
            return true;
        }

        try {
            return QuarkusTransaction.requiringNew().call(() -> {
                if (SchedulerLock.findById(lockId) != null) {
                    return false;
                }
                SchedulerLock.create(lockId, nodeId, expiresAt, now).persistAndFlush();
                return true;
            });
        } catch (PersistenceException | QuarkusTransactionException e) {
            LOG.debugf("Lease %s was inserted concurrently by another node: %s", lockId, e.getMessage());
            return false;
        }
    }

    @Override
    public boolean renew(String lockId, String nodeId, Duration ttl, Instant now) {
        int updated = QuarkusTransaction.requiringNew()
                .call(() -> SchedulerLock.extend(lockId, nodeId, now.plus(ttl), now));
        return updated > 0;
    }

    @Override
    public boolean release(String lockId, String nodeId) {
        long deleted = QuarkusTransaction.requiringNew().call(() -> SchedulerLock.releaseIfOwned(lockId, nodeId));
        return deleted > 0;
    }

    @Override
    public Optional<SchedulerLock> find(String lockId) {
        return QuarkusTransaction.requiringNew().call(() -> SchedulerLock.<SchedulerLock> findByIdOptional(lockId));
    }
}
