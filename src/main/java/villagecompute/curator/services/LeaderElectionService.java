package villagecompute.curator.services;

import java.time.Clock;
import java.time.Duration;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import villagecompute.curator.data.stores.LeaseStore;

/**
 * Lease-based leader election among identical process instances.
 *
 * <p>
 * {@link #tick()} is invoked periodically (every {@code curator.scheduler.lease-renew-interval}, a third of the lease
 * ttl). A leader renews its lease and steps down as soon as a renewal is refused or cannot be confirmed; a follower
 * tries to acquire the lease. Only the leader executes due jobs.
 *
 * <p>
 * <b>Known limitation:</b> a leader that stalls (long GC pause, clock skew) without crashing keeps believing it leads
 * until its next tick, so two nodes may both act as leader for up to one ttl.
 */
@ApplicationScoped
public class LeaderElectionService {

    private static final Logger LOG = Logger.getLogger(LeaderElectionService.class);

    @Inject
    LeaseStore leaseStore;

    @Inject
    Clock clock;

    @ConfigProperty(
            name = "curator.scheduler.lock-id",
            defaultValue = "scheduler-leader")
    String lockId;

    @ConfigProperty(
            name = "curator.scheduler.lease-ttl",
            defaultValue = "30s")
    Duration leaseTtl;

    private final String nodeId = "node-" + UUID.randomUUID().toString().replace("-", "").substring(0, 8);

    private final AtomicBoolean leader = new AtomicBoolean(false);

    /**
     * Runs one election round.
     *
     * @return whether this node is leader after the round
     */
    public boolean tick() {
        try {
            if (leader.get()) {
                if (!leaseStore.renew(lockId, nodeId, leaseTtl, clock.instant())) {
                    leader.set(false);
                    LOG.warnf("Node %s lost lease %s, stepping down as scheduler leader", nodeId, lockId);
                }
            } else if (leaseStore.tryAcquireOrRenew(lockId, nodeId, leaseTtl, clock.instant())) {
                leader.set(true);
                LOG.infof("Node %s acquired lease %s and is now scheduler leader", nodeId, lockId);
            }
        } catch (RuntimeException e) {
            if (leader.compareAndSet(true, false)) {
                LOG.errorf(e, "Node %s could not renew lease %s, stepping down as scheduler leader", nodeId, lockId);
            } else {
                LOG.errorf(e, "Node %s failed to contend for lease %s", nodeId, lockId);
            }
        }
        return leader.get();
    }

    /**
     * Gives up leadership and deletes the lease so another node can take over without waiting for expiry.
     */
    public void resign() {
        if (!leader.getAndSet(false)) {
            return;
        }
        try {
            if (leaseStore.release(lockId, nodeId)) {
                LOG.infof("Node %s released lease %s", nodeId, lockId);
            }
        } catch (RuntimeException e) {
            LOG.warnf(e, "Node %s failed to release lease %s, it will expire after %s", nodeId, lockId, leaseTtl);
        }
    }

    public boolean isLeader() {
        return leader.get();
    }

    public String getNodeId() {
        return nodeId;
    }

    public String getLockId() {
        return lockId;
    }
}
