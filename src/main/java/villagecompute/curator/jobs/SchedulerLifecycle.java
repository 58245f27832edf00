package villagecompute.curator.jobs;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import io.quarkus.runtime.ShutdownEvent;
import io.quarkus.runtime.StartupEvent;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import villagecompute.curator.services.ConfigSyncService;
import villagecompute.curator.services.LeaderElectionService;

/**
 * Startup and shutdown hooks of the scheduler: syncs recap jobs from the feed configuration on start and releases the
 * leader lease on shutdown.
 */
@ApplicationScoped
public class SchedulerLifecycle {

    private static final Logger LOG = Logger.getLogger(SchedulerLifecycle.class);

    @Inject
    ConfigSyncService configSyncService;

    @Inject
    LeaderElectionService leaderElectionService;

    @ConfigProperty(
            name = "curator.scheduler.sync-on-startup",
            defaultValue = "true")
    boolean syncOnStartup;

    void onStart(@Observes StartupEvent event) {
        LOG.infof("Scheduler node %s starting", leaderElectionService.getNodeId());
        if (!syncOnStartup) {
            return;
        }
        try {
            configSyncService.syncRecapJobs();
        } catch (RuntimeException e) {
            LOG.errorf(e, "Recap config sync failed at startup");
        }
    }

    void onStop(@Observes ShutdownEvent event) {
        LOG.infof("Scheduler node %s shutting down", leaderElectionService.getNodeId());
        leaderElectionService.resign();
    }
}
