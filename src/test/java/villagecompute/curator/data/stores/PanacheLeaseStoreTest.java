package villagecompute.curator.data.stores;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import io.quarkus.test.common.QuarkusTestResource;
import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;
import villagecompute.curator.data.models.SchedulerLock;
import villagecompute.curator.testing.H2TestResource;

/**
 * Lease compare-and-swap against the database.
 */
@QuarkusTest
@QuarkusTestResource(H2TestResource.class)
public class PanacheLeaseStoreTest {

    private static final String LOCK = "test-lease";
    private static final Duration TTL = Duration.ofSeconds(30);
    private static final Instant NOW = Instant.parse("2024-01-03T12:00:00Z");

    @Inject
    PanacheLeaseStore leaseStore;

    @BeforeEach
    @Transactional
    void setUp() {
        SchedulerLock.deleteAll();
    }

    @Test
    public void testAcquire_absentRow_inserts() {
        assertTrue(leaseStore.tryAcquireOrRenew(LOCK, "node-a", TTL, NOW));

        SchedulerLock lease = leaseStore.find(LOCK).orElseThrow();
        assertEquals("node-a", lease.nodeId);
        assertEquals(NOW.plus(TTL), lease.expiresAt);
    }

    @Test
    public void testAcquire_heldByOther_refused() {
        leaseStore.tryAcquireOrRenew(LOCK, "node-a", TTL, NOW);

        assertFalse(leaseStore.tryAcquireOrRenew(LOCK, "node-b", TTL, NOW.plusSeconds(10)));
        assertEquals("node-a", leaseStore.find(LOCK).orElseThrow().nodeId);
    }

    @Test
    public void testAcquire_sameNode_extends() {
        leaseStore.tryAcquireOrRenew(LOCK, "node-a", TTL, NOW);

        assertTrue(leaseStore.tryAcquireOrRenew(LOCK, "node-a", TTL, NOW.plusSeconds(10)));
        assertEquals(NOW.plusSeconds(10).plus(TTL), leaseStore.find(LOCK).orElseThrow().expiresAt);
    }

    @Test
    public void testAcquire_expired_takenOver() {
        leaseStore.tryAcquireOrRenew(LOCK, "node-a", TTL, NOW);
        Instant later = NOW.plus(TTL).plusSeconds(1);

        assertTrue(leaseStore.tryAcquireOrRenew(LOCK, "node-b", TTL, later));

        SchedulerLock lease = leaseStore.find(LOCK).orElseThrow();
        assertEquals("node-b", lease.nodeId);
        assertEquals(later.plus(TTL), lease.expiresAt);
    }

    @Test
    public void testRenew_onlyByOwner() {
        leaseStore.tryAcquireOrRenew(LOCK, "node-a", TTL, NOW);

        assertFalse(leaseStore.renew(LOCK, "node-b", TTL, NOW.plusSeconds(5)));
        assertTrue(leaseStore.renew(LOCK, "node-a", TTL, NOW.plusSeconds(5)));
        assertEquals(NOW.plusSeconds(5).plus(TTL), leaseStore.find(LOCK).orElseThrow().expiresAt);
    }

    @Test
    public void testRenew_afterTakeover_refused() {
        leaseStore.tryAcquireOrRenew(LOCK, "node-a", TTL, NOW);
        leaseStore.tryAcquireOrRenew(LOCK, "node-b", TTL, NOW.plus(TTL).plusSeconds(1));

        assertFalse(leaseStore.renew(LOCK, "node-a", TTL, NOW.plus(TTL).plusSeconds(2)));
    }

    @Test
    public void testRelease_onlyByOwner() {
        leaseStore.tryAcquireOrRenew(LOCK, "node-a", TTL, NOW);

        assertFalse(leaseStore.release(LOCK, "node-b"));
        assertTrue(leaseStore.find(LOCK).isPresent());
        assertTrue(leaseStore.release(LOCK, "node-a"));
        assertTrue(leaseStore.find(LOCK).isEmpty());
        assertTrue(leaseStore.tryAcquireOrRenew(LOCK, "node-b", TTL, NOW.plusSeconds(1)));
    }

    @Test
    public void testAcquire_concurrentNodes_singleWinnerPerRound() throws Exception {
        int nodes = 8;
        ExecutorService pool = Executors.newFixedThreadPool(nodes);
        try {
            for (int round = 0; round < 5; round++) {
                String lockId = "race-" + round;
                CountDownLatch start = new CountDownLatch(1);
                List<Future<Boolean>> attempts = new ArrayList<>();
                for (int i = 0; i < nodes; i++) {
                    String nodeId = "node-" + i;
                    attempts.add(pool.submit(() -> {
                        start.await();
                        return leaseStore.tryAcquireOrRenew(lockId, nodeId, TTL, NOW);
                    }));
                }
                start.countDown();

                List<String> winners = new ArrayList<>();
                for (int i = 0; i < nodes; i++) {
                    if (attempts.get(i).get(10, TimeUnit.SECONDS)) {
                        winners.add("node-" + i);
                    }
                }

                assertEquals(1, winners.size(), "winners of " + lockId + ": " + winners);
                assertEquals(winners.get(0), leaseStore.find(lockId).orElseThrow().nodeId);
            }
        } finally {
            pool.shutdownNow();
        }
    }
}
