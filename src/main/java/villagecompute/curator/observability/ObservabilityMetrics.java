package villagecompute.curator.observability;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.quarkus.runtime.StartupEvent;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import villagecompute.curator.services.JobExecutorService;
import villagecompute.curator.services.LeaderElectionService;

/**
 * Registers the scheduler gauges at startup.
 *
 * <p>
 * <b>Metrics Catalog:</b>
 * <ul>
 * <li><b>Gauge:</b> {@code curator_scheduler_leader} - 1 while this node holds the leader lease, else 0</li>
 * <li><b>Gauge:</b> {@code curator_jobs_in_flight} - Jobs currently executing in this process</li>
 * <li><b>Gauge:</b> {@code curator_job_slots_available} - Free execution slots under the concurrency cap</li>
 * <li><b>Counter:</b> {@code curator_job_executions_total{job_type,status}} (JobExecutorService)</li>
 * <li><b>Timer:</b> {@code curator_job_execution_duration{job_type}} (JobExecutorService)</li>
 * <li><b>Counter:</b> {@code curator_distributions_total{plugin,result}} (DistributionService)</li>
 * <li><b>Counter:</b> {@code curator_transform_failures_total{stage}} (ProcessorService, DistributionService)</li>
 * </ul>
 *
 * <p>
 * Exported in Prometheus format at {@code /q/metrics}.
 */
@ApplicationScoped
public class ObservabilityMetrics {

    private static final Logger LOG = Logger.getLogger(ObservabilityMetrics.class);

    @Inject
    MeterRegistry registry;

    @Inject
    LeaderElectionService leaderElectionService;

    @Inject
    JobExecutorService jobExecutorService;

    void registerMetrics(@Observes StartupEvent event) {
        LOG.info("Registering scheduler metrics");

        Gauge.builder("curator_scheduler_leader", leaderElectionService, leader -> leader.isLeader() ? 1 : 0)
                .description("Whether this node currently holds the scheduler leader lease").register(registry);

        Gauge.builder("curator_jobs_in_flight", jobExecutorService, JobExecutorService::getInFlightCount)
                .description("Scheduled jobs currently executing in this process").register(registry);

        Gauge.builder("curator_job_slots_available", jobExecutorService, JobExecutorService::getAvailableSlots)
                .description("Free job execution slots under the concurrency cap").register(registry);
    }
}
