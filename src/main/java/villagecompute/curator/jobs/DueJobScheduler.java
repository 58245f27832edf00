package villagecompute.curator.jobs;

import io.quarkus.scheduler.Scheduled;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import villagecompute.curator.observability.LoggingConfig;
import villagecompute.curator.services.DueJobPoller;
import villagecompute.curator.services.LeaderElectionService;

/**
 * Timer polling for due jobs.
 *
 * <p>
 * <b>Execution Schedule:</b> every {@code curator.scheduler.poll-interval} (default 60s), first run at startup. Runs on
 * every node; {@link DueJobPoller} returns immediately unless this node is leader.
 */
@ApplicationScoped
public class DueJobScheduler {

    private static final Logger LOG = Logger.getLogger(DueJobScheduler.class);

    @Inject
    DueJobPoller dueJobPoller;

    @Inject
    LeaderElectionService leaderElectionService;

    @Scheduled(
            identity = "due-job-poll",
            every = "{curator.scheduler.poll-interval}",
            concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    void pollDueJobs() {
        try {
            LoggingConfig.setNodeId(leaderElectionService.getNodeId());
            int dispatched = dueJobPoller.poll();
            if (dispatched > 0) {
                LOG.infof("Dispatched %d due jobs", dispatched);
            }
        } catch (Exception e) {
            LOG.errorf(e, "Due-job poll failed");
        } finally {
            LoggingConfig.clearMDC();
        }
    }
}
