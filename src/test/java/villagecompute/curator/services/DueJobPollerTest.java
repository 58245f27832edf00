package villagecompute.curator.services;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import villagecompute.curator.data.models.ScheduledJob;
import villagecompute.curator.jobs.JobType;
import villagecompute.curator.testing.InMemoryJobStore;
import villagecompute.curator.testing.MutableClock;

class DueJobPollerTest {

    private static final Instant NOW = Instant.parse("2024-01-07T00:00:30Z");

    private DueJobPoller poller;
    private LeaderElectionService leaderElectionService;
    private JobExecutorService jobExecutorService;
    private InMemoryJobStore jobStore;
    private List<String> dispatched;

    @BeforeEach
    void setUp() {
        leaderElectionService = mock(LeaderElectionService.class);
        jobExecutorService = mock(JobExecutorService.class);
        jobStore = new InMemoryJobStore();
        dispatched = new ArrayList<>();
        when(leaderElectionService.getNodeId()).thenReturn("node-test");
        when(jobExecutorService.dispatch(any())).thenAnswer(invocation -> {
            ScheduledJob job = invocation.getArgument(0);
            dispatched.add(job.id);
            return true;
        });

        poller = new DueJobPoller();
        poller.leaderElectionService = leaderElectionService;
        poller.jobStore = jobStore;
        poller.jobExecutorService = jobExecutorService;
        poller.clock = new MutableClock(NOW);
    }

    private void saveJob(String id, Instant nextRunAt, boolean enabled) {
        ScheduledJob job = new ScheduledJob();
        job.id = id;
        job.name = id;
        job.jobType = JobType.RECAP;
        job.feedId = "tech";
        job.schedule = "0 0 * * 0";
        job.enabled = enabled;
        job.nextRunAt = nextRunAt;
        job.createdAt = NOW;
        job.updatedAt = NOW;
        jobStore.create(job);
    }

    @Test
    void testPoll_follower_doesNothing() {
        saveJob("due", NOW.minusSeconds(30), true);
        when(leaderElectionService.isLeader()).thenReturn(false);

        assertEquals(0, poller.poll());
        verify(jobExecutorService, never()).dispatch(any());
    }

    @Test
    void testPoll_leader_dispatchesOnlyDueEnabledJobsOldestFirst() {
        saveJob("later", NOW.minusSeconds(5), true);
        saveJob("earlier", NOW.minus(Duration.ofHours(1)), true);
        saveJob("exactly-now", NOW, true);
        saveJob("future", NOW.plusSeconds(60), true);
        saveJob("disabled", NOW.minusSeconds(60), false);
        saveJob("unscheduled", null, true);
        when(leaderElectionService.isLeader()).thenReturn(true);

        assertEquals(3, poller.poll());
        assertEquals(List.of("earlier", "later", "exactly-now"), dispatched);
    }

    @Test
    void testPoll_refusedDispatch_notCounted() {
        saveJob("a", NOW.minusSeconds(10), true);
        saveJob("b", NOW.minusSeconds(5), true);
        when(leaderElectionService.isLeader()).thenReturn(true);
        when(jobExecutorService.dispatch(any())).thenReturn(true, false);

        assertEquals(1, poller.poll());
    }

    @Test
    void testPoll_nothingDue() {
        saveJob("future", NOW.plusSeconds(60), true);
        when(leaderElectionService.isLeader()).thenReturn(true);

        assertEquals(0, poller.poll());
        verify(jobExecutorService, never()).dispatch(any());
    }
}
