package villagecompute.curator.services;

import java.time.Clock;
import java.util.List;

import org.jboss.logging.Logger;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import villagecompute.curator.data.models.ScheduledJob;
import villagecompute.curator.data.stores.JobStore;

/**
 * Finds due jobs and hands them to the {@link JobExecutorService}. Does nothing on nodes that are not the scheduler
 * leader.
 */
@ApplicationScoped
public class DueJobPoller {

    private static final Logger LOG = Logger.getLogger(DueJobPoller.class);

    @Inject
    LeaderElectionService leaderElectionService;

    @Inject
    JobStore jobStore;

    @Inject
    JobExecutorService jobExecutorService;

    @Inject
    Clock clock;

    /**
     * Runs one poll cycle.
     *
     * @return number of jobs dispatched
     */
    public int poll() {
        if (!leaderElectionService.isLeader()) {
            LOG.debugf("Node %s is not leader, skipping due-job poll", leaderElectionService.getNodeId());
            return 0;
        }

        List<ScheduledJob> due = jobStore.findDue(clock.instant());
        if (due.isEmpty()) {
            return 0;
        }

        LOG.infof("Found %d due jobs", due.size());
        int dispatched = 0;
        for (ScheduledJob job : due) {
            if (jobExecutorService.dispatch(job)) {
                dispatched++;
            }
        }
        return dispatched;
    }
}
