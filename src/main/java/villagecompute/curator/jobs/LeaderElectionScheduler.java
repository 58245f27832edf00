package villagecompute.curator.jobs;

import io.quarkus.scheduler.Scheduled;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import villagecompute.curator.observability.LoggingConfig;
import villagecompute.curator.services.LeaderElectionService;

/**
 * Timer driving leader election.
 *
 * <p>
 * <b>Execution Schedule:</b> every {@code curator.scheduler.lease-renew-interval} (default 10s, a third of the lease
 * ttl), first run at startup. Overlapping runs are skipped.
 */
@ApplicationScoped
public class LeaderElectionScheduler {

    private static final Logger LOG = Logger.getLogger(LeaderElectionScheduler.class);

    @Inject
    LeaderElectionService leaderElectionService;

    @Scheduled(
            identity = "leader-election",
            every = "{curator.scheduler.lease-renew-interval}",
            concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    void electLeader() {
        try {
            LoggingConfig.setNodeId(leaderElectionService.getNodeId());
            leaderElectionService.tick();
        } catch (Exception e) {
            LOG.errorf(e, "Leader election tick failed");
        } finally {
            LoggingConfig.clearMDC();
        }
    }
}
