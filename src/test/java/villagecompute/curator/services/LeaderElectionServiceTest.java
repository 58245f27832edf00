package villagecompute.curator.services;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import jakarta.persistence.PersistenceException;
import villagecompute.curator.data.models.SchedulerLock;
import villagecompute.curator.testing.InMemoryLeaseStore;
import villagecompute.curator.testing.MutableClock;

class LeaderElectionServiceTest {

    private static final Instant NOW = Instant.parse("2024-01-03T12:00:00Z");
    private static final Duration TTL = Duration.ofSeconds(30);

    private InMemoryLeaseStore leaseStore;
    private MutableClock clock;

    @BeforeEach
    void setUp() {
        leaseStore = new InMemoryLeaseStore();
        clock = new MutableClock(NOW);
    }

    private LeaderElectionService newNode() {
        LeaderElectionService node = new LeaderElectionService();
        node.leaseStore = leaseStore;
        node.clock = clock;
        node.lockId = "scheduler-leader";
        node.leaseTtl = TTL;
        return node;
    }

    @Test
    void testNodeId_uniquePerInstance() {
        LeaderElectionService a = newNode();
        LeaderElectionService b = newNode();

        assertTrue(a.getNodeId().matches("node-[0-9a-f]{8}"));
        assertNotEquals(a.getNodeId(), b.getNodeId());
    }

    @Test
    void testTick_freeLease_acquires() {
        LeaderElectionService node = newNode();

        assertTrue(node.tick());

        SchedulerLock lease = leaseStore.find("scheduler-leader").orElseThrow();
        assertEquals(node.getNodeId(), lease.nodeId);
        assertEquals(NOW.plus(TTL), lease.expiresAt);
    }

    @Test
    void testTick_leaseHeldByOther_staysFollower() {
        LeaderElectionService a = newNode();
        LeaderElectionService b = newNode();

        assertTrue(a.tick());
        assertFalse(b.tick());
        assertTrue(a.isLeader());
        assertFalse(b.isLeader());
    }

    @Test
    void testTick_leaderRenewsLease() {
        LeaderElectionService node = newNode();
        node.tick();
        clock.advance(Duration.ofSeconds(10));

        assertTrue(node.tick());

        assertEquals(NOW.plusSeconds(10).plus(TTL), leaseStore.find("scheduler-leader").orElseThrow().expiresAt);
    }

    @Test
    void testTick_expiredLease_takenOverByFollower() {
        LeaderElectionService a = newNode();
        LeaderElectionService b = newNode();
        a.tick();

        // a stalls past its ttl
        clock.advance(TTL.plusSeconds(1));
        assertTrue(b.tick());

        assertFalse(a.tick());
        assertFalse(a.isLeader());
        assertEquals(b.getNodeId(), leaseStore.find("scheduler-leader").orElseThrow().nodeId);
    }

    @Test
    void testTick_leaseStolen_leaderStepsDown() {
        LeaderElectionService node = newNode();
        node.tick();
        leaseStore.forceOwner("scheduler-leader", "node-intruder", NOW.plus(TTL));

        assertFalse(node.tick());
    }

    @Test
    void testTick_storeFailure_leaderStepsDown() {
        LeaderElectionService node = newNode();
        node.tick();
        leaseStore.failWith(new PersistenceException("connection reset"));

        assertFalse(node.tick());

        leaseStore.failWith(null);
        assertTrue(node.tick());
    }

    @Test
    void testTick_storeFailure_followerStaysFollower() {
        LeaderElectionService node = newNode();
        leaseStore.failWith(new PersistenceException("connection refused"));

        assertFalse(node.tick());
        assertFalse(node.isLeader());
    }

    @Test
    void testResign_releasesLeaseForOthers() {
        LeaderElectionService a = newNode();
        LeaderElectionService b = newNode();
        a.tick();

        a.resign();

        assertFalse(a.isLeader());
        assertTrue(leaseStore.find("scheduler-leader").isEmpty());
        assertTrue(b.tick());
    }

    @Test
    void testResign_follower_leavesLeaseAlone() {
        LeaderElectionService a = newNode();
        LeaderElectionService b = newNode();
        a.tick();
        b.tick();

        b.resign();

        assertEquals(a.getNodeId(), leaseStore.find("scheduler-leader").orElseThrow().nodeId);
    }

    @Test
    void testTick_concurrentNodes_singleLeader() throws Exception {
        int nodes = 8;
        List<LeaderElectionService> services = new ArrayList<>();
        for (int i = 0; i < nodes; i++) {
            services.add(newNode());
        }
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(nodes);
        try {
            List<Future<Boolean>> results = new ArrayList<>();
            for (LeaderElectionService service : services) {
                Callable<Boolean> round = () -> {
                    start.await();
                    return service.tick();
                };
                results.add(pool.submit(round));
            }
            start.countDown();

            int leaders = 0;
            for (Future<Boolean> result : results) {
                if (result.get()) {
                    leaders++;
                }
            }
            assertEquals(1, leaders);
            assertEquals(1, services.stream().filter(LeaderElectionService::isLeader).count());
        } finally {
            pool.shutdownNow();
        }
    }
}
