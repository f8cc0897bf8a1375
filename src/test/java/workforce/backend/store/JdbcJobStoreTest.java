package workforce.backend.store;

import workforce.backend.MutableClock;
import workforce.backend.model.FailOutcome;
import workforce.backend.model.Job;
import workforce.backend.model.JobStatus;
import org.junit.jupiter.api.*;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class JdbcJobStoreTest {

    private static final String QUEUE = "scoring";
    private static final String PAYLOAD = "{\"tenantId\":\"acme\",\"taskId\":\"t\",\"employeeId\":\"e\"}";

    private static Database db;
    private static MutableClock clock;
    private static JdbcJobStore store;

    @BeforeAll
    static void setup() {
        db = new Database("jdbc:h2:mem:test-jobs-" + System.nanoTime()
                + ";DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE", 10);
        clock = MutableClock.startingAt("2024-05-01T10:00:00Z");
        store = new JdbcJobStore(db, new Backoff(Duration.ofSeconds(5), Duration.ofMinutes(10)), clock);
    }

    @AfterAll
    static void teardown() {
        if (db != null)
            db.close();
    }

    @BeforeEach
    void cleanJobs() throws Exception {
        clock.set(Instant.parse("2024-05-01T10:00:00Z"));
        try (var conn = db.getConnection();
                var st = conn.createStatement()) {
            st.execute("DELETE FROM jobs");
            conn.commit();
        }
    }

    @Test
    void enqueueIsInsertIfAbsent() {
        assertTrue(store.enqueue(QUEUE, "score:task:1", PAYLOAD, 3));
        assertFalse(store.enqueue(QUEUE, "score:task:1", "{\"other\":true}", 3));

        Job job = store.findByDedupKey("score:task:1").orElseThrow();
        assertEquals(JobStatus.PENDING, job.status());
        assertEquals(0, job.attempts());
        assertEquals(3, job.maxAttempts());
        assertEquals(PAYLOAD, job.payload(), "duplicate enqueue must not overwrite the payload");
        assertEquals(1, pendingCount());
    }

    @Test
    void concurrentEnqueueOfOneKeyCreatesOneRow() throws Exception {
        int threads = 8;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<Boolean>> results = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                results.add(pool.submit(() -> {
                    start.await();
                    return store.enqueue(QUEUE, "score:task:race", PAYLOAD, 3);
                }));
            }
            start.countDown();

            int created = 0;
            for (Future<Boolean> result : results) {
                if (result.get(10, TimeUnit.SECONDS)) {
                    created++;
                }
            }
            assertEquals(1, created);
            assertEquals(1, pendingCount());
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void claimTakesOldestRunAtFirstAndMovesToProcessing() {
        store.enqueue(QUEUE, "k1", PAYLOAD, 3);
        clock.advance(Duration.ofSeconds(1));
        store.enqueue(QUEUE, "k2", PAYLOAD, 3);
        clock.advance(Duration.ofSeconds(1));
        store.enqueue(QUEUE, "k3", PAYLOAD, 3);
        store.enqueue("ledger", "other-queue", PAYLOAD, 3);

        List<Job> claimed = store.claim(QUEUE, 2, clock.instant());

        assertEquals(List.of("k1", "k2"), claimed.stream().map(Job::dedupKey).toList());
        for (Job job : claimed) {
            assertEquals(JobStatus.PROCESSING, job.status());
            assertEquals(1, job.attempts());
            Job stored = store.findById(job.id()).orElseThrow();
            assertEquals(JobStatus.PROCESSING, stored.status());
            assertEquals(1, stored.attempts());
            assertEquals(clock.instant(), stored.claimedAt());
        }

        List<Job> rest = store.claim(QUEUE, 10, clock.instant());
        assertEquals(1, rest.size());
        assertEquals("k3", rest.get(0).dedupKey());
        assertTrue(store.claim(QUEUE, 10, clock.instant()).isEmpty());
    }

    @Test
    void claimIgnoresJobsNotYetDue() {
        store.enqueue(QUEUE, "future", PAYLOAD, 3);

        assertTrue(store.claim(QUEUE, 10, clock.instant().minusSeconds(1)).isEmpty());
        assertEquals(1, store.claim(QUEUE, 10, clock.instant()).size());
    }

    @Test
    void concurrentClaimantsNeverShareAJob() throws Exception {
        int jobs = 40;
        for (int i = 0; i < jobs; i++) {
            store.enqueue(QUEUE, "bulk-" + i, PAYLOAD, 3);
        }
        Instant now = clock.instant();

        int claimants = 4;
        ExecutorService pool = Executors.newFixedThreadPool(claimants);
        CountDownLatch start = new CountDownLatch(1);
        List<String> allClaimed = Collections.synchronizedList(new ArrayList<>());
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < claimants; i++) {
                Callable<Void> claimant = () -> {
                    start.await();
                    while (true) {
                        List<Job> batch = store.claim(QUEUE, 3, now);
                        if (batch.isEmpty()) {
                            return null;
                        }
                        batch.forEach(job -> allClaimed.add(job.id()));
                    }
                };
                futures.add(pool.submit(claimant));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        Set<String> unique = new HashSet<>(allClaimed);
        assertEquals(allClaimed.size(), unique.size(), "a job was handed to two claimants");
        assertEquals(jobs, unique.size());
    }

    @Test
    void failReschedulesWithBackoffWhileAttemptsRemain() {
        store.enqueue(QUEUE, "flaky", PAYLOAD, 3);
        Job job = store.claim(QUEUE, 1, clock.instant()).get(0);

        FailOutcome outcome = store.fail(job.id(), job.claimToken(), "connection reset", clock.instant());

        assertEquals(FailOutcome.RESCHEDULED, outcome);
        Job stored = store.findById(job.id()).orElseThrow();
        assertEquals(JobStatus.PENDING, stored.status());
        assertEquals(1, stored.attempts());
        assertEquals(clock.instant().plusSeconds(5), stored.runAt());
        assertNull(stored.claimedAt());
        assertEquals("connection reset", stored.errorMessage());

        // Not eligible before the backoff elapses
        assertTrue(store.claim(QUEUE, 1, clock.instant().plusSeconds(4)).isEmpty());

        clock.advance(Duration.ofSeconds(5));
        Job second = store.claim(QUEUE, 1, clock.instant()).get(0);
        assertEquals(2, second.attempts());

        store.fail(second.id(), second.claimToken(), "still broken", clock.instant());
        assertEquals(clock.instant().plusSeconds(10), store.findById(job.id()).orElseThrow().runAt());
    }

    @Test
    void exhaustedJobBecomesFailedAndIsNeverClaimedAgain() {
        store.enqueue(QUEUE, "doomed", PAYLOAD, 2);

        Job first = store.claim(QUEUE, 1, clock.instant()).get(0);
        assertEquals(FailOutcome.RESCHEDULED, store.fail(first.id(), first.claimToken(), "boom", clock.instant()));

        clock.advance(Duration.ofMinutes(1));
        Job second = store.claim(QUEUE, 1, clock.instant()).get(0);
        assertEquals(FailOutcome.FAILED, store.fail(second.id(), second.claimToken(), "boom again", clock.instant()));

        Job dead = store.findById(first.id()).orElseThrow();
        assertEquals(JobStatus.FAILED, dead.status());
        assertEquals(2, dead.attempts());
        assertEquals(clock.instant(), dead.failedAt());
        assertEquals("boom again", dead.errorMessage());

        clock.advance(Duration.ofDays(1));
        assertTrue(store.claim(QUEUE, 10, clock.instant()).isEmpty());
        assertEquals(1, store.findFailed(QUEUE, 10).size());
        assertTrue(store.findFailed("ledger", 10).isEmpty());
    }

    @Test
    void failOnMissingOrUnclaimedJob() {
        assertEquals(FailOutcome.NOT_FOUND, store.fail("missing", "token", "x", clock.instant()));

        store.enqueue(QUEUE, "unclaimed", PAYLOAD, 3);
        Job pending = store.findByDedupKey("unclaimed").orElseThrow();
        assertEquals(FailOutcome.LEASE_LOST, store.fail(pending.id(), null, "late report", clock.instant()));

        Job unchanged = store.findById(pending.id()).orElseThrow();
        assertEquals(JobStatus.PENDING, unchanged.status());
        assertEquals(0, unchanged.attempts());
        assertNull(unchanged.errorMessage());
    }

    @Test
    void staleClaimCannotResolveAReclaimedJob() {
        store.enqueue(QUEUE, "reclaimed", PAYLOAD, 3);
        Job first = store.claim(QUEUE, 1, clock.instant()).get(0);

        clock.advance(Duration.ofMinutes(10));
        assertTrue(store.requeue(first.id(), clock.instant(), clock.instant()));
        Job second = store.claim(QUEUE, 1, clock.instant()).get(0);
        assertEquals(first.id(), second.id());
        assertNotEquals(first.claimToken(), second.claimToken());

        // The original claimant finishes late
        assertFalse(store.complete(first.id(), first.claimToken()));
        assertEquals(FailOutcome.LEASE_LOST, store.fail(first.id(), first.claimToken(), "late", clock.instant()));
        assertFalse(store.renewClaim(first.id(), first.claimToken(), clock.instant()));

        Job current = store.findById(first.id()).orElseThrow();
        assertEquals(JobStatus.PROCESSING, current.status());
        assertEquals(2, current.attempts());
        assertNull(current.errorMessage());

        assertTrue(store.complete(second.id(), second.claimToken()));
    }

    @Test
    void longErrorMessagesAreTruncated() {
        store.enqueue(QUEUE, "verbose", PAYLOAD, 1);
        Job job = store.claim(QUEUE, 1, clock.instant()).get(0);

        store.fail(job.id(), job.claimToken(), "x".repeat(5000), clock.instant());

        assertEquals(2048, store.findById(job.id()).orElseThrow().errorMessage().length());
    }

    @Test
    void completeDeletesAndIsIdempotent() {
        store.enqueue(QUEUE, "done", PAYLOAD, 3);
        Job job = store.claim(QUEUE, 1, clock.instant()).get(0);

        assertNotNull(job.claimToken());
        assertEquals(job.claimToken(), store.findById(job.id()).orElseThrow().claimToken());
        assertTrue(store.complete(job.id(), job.claimToken()));
        assertFalse(store.complete(job.id(), job.claimToken()));
        assertTrue(store.findById(job.id()).isEmpty());

        // The key is free again once the job is gone
        assertTrue(store.enqueue(QUEUE, "done", PAYLOAD, 3));
    }

    @Test
    void stuckJobsCanBeRequeuedOrMarkedFailed() {
        store.enqueue(QUEUE, "stuck-1", PAYLOAD, 3);
        store.enqueue(QUEUE, "stuck-2", PAYLOAD, 3);
        List<Job> claimed = store.claim(QUEUE, 2, clock.instant());
        Instant claimedAt = clock.instant();

        assertTrue(store.findStuckProcessing(claimedAt).isEmpty());
        List<Job> stuck = store.findStuckProcessing(claimedAt.plusSeconds(1));
        assertEquals(2, stuck.size());

        clock.advance(Duration.ofMinutes(10));
        Instant cutoff = clock.instant().minus(Duration.ofMinutes(5));
        assertTrue(store.requeue(claimed.get(0).id(), cutoff, clock.instant()));
        assertFalse(store.requeue(claimed.get(0).id(), cutoff, clock.instant()), "already PENDING");
        assertTrue(store.markFailed(claimed.get(1).id(), cutoff, "stuck", clock.instant()));
        assertFalse(store.markFailed(claimed.get(1).id(), cutoff, "stuck", clock.instant()), "already FAILED");

        Job requeued = store.findById(claimed.get(0).id()).orElseThrow();
        assertEquals(JobStatus.PENDING, requeued.status());
        assertEquals(clock.instant(), requeued.runAt());
        assertNull(requeued.claimToken());
        assertEquals(JobStatus.FAILED, store.findById(claimed.get(1).id()).orElseThrow().status());
    }

    @Test
    void renewedClaimIsNotReaped() {
        store.enqueue(QUEUE, "slow-start", PAYLOAD, 3);
        Job job = store.claim(QUEUE, 1, clock.instant()).get(0);

        clock.advance(Duration.ofMinutes(6));
        assertTrue(store.renewClaim(job.id(), job.claimToken(), clock.instant()));
        Instant cutoff = clock.instant().minus(Duration.ofMinutes(5));

        // The reaper listed the job before the renewal landed
        assertFalse(store.requeue(job.id(), cutoff, clock.instant()));
        assertFalse(store.markFailed(job.id(), cutoff, "stuck", clock.instant()));
        assertTrue(store.findStuckProcessing(cutoff).isEmpty());

        Job stored = store.findById(job.id()).orElseThrow();
        assertEquals(JobStatus.PROCESSING, stored.status());
        assertEquals(clock.instant(), stored.claimedAt());
        assertTrue(store.complete(job.id(), job.claimToken()));
    }

    @Test
    void retryFailedRevivesWithFreshAttempts() {
        store.enqueue(QUEUE, "revive", PAYLOAD, 1);
        Job job = store.claim(QUEUE, 1, clock.instant()).get(0);
        store.fail(job.id(), job.claimToken(), "boom", clock.instant());

        clock.advance(Duration.ofHours(1));
        assertTrue(store.retryFailed(job.id(), clock.instant()));
        assertFalse(store.retryFailed(job.id(), clock.instant()), "only FAILED jobs can be retried");

        Job revived = store.findById(job.id()).orElseThrow();
        assertEquals(JobStatus.PENDING, revived.status());
        assertEquals(0, revived.attempts());
        assertNull(revived.failedAt());
        assertNull(revived.errorMessage());
        assertEquals(1, store.claim(QUEUE, 1, clock.instant()).size());
    }

    @Test
    void cancelOnlyRemovesUnclaimedJobs() {
        store.enqueue(QUEUE, "running", PAYLOAD, 3);
        clock.advance(Duration.ofSeconds(1));
        store.enqueue(QUEUE, "cancel-me", PAYLOAD, 3);

        Job running = store.claim(QUEUE, 1, clock.instant()).get(0);
        assertEquals("running", running.dedupKey());
        assertFalse(store.cancel(running.id()));

        String pendingId = store.findByDedupKey("cancel-me").orElseThrow().id();
        assertTrue(store.cancel(pendingId));
        assertTrue(store.findById(pendingId).isEmpty());
        assertTrue(store.findById(running.id()).isPresent());
    }

    @Test
    void countsByQueueAndStatus() {
        store.enqueue(QUEUE, "c1", PAYLOAD, 3);
        store.enqueue(QUEUE, "c2", PAYLOAD, 3);
        store.enqueue("ledger", "c3", PAYLOAD, 1);
        store.claim(QUEUE, 1, clock.instant());
        Job ledgerJob = store.claim("ledger", 1, clock.instant()).get(0);
        store.fail(ledgerJob.id(), ledgerJob.claimToken(), "boom", clock.instant());

        Map<String, Map<JobStatus, Integer>> counts = store.countByQueueAndStatus();

        assertEquals(1, counts.get(QUEUE).get(JobStatus.PENDING));
        assertEquals(1, counts.get(QUEUE).get(JobStatus.PROCESSING));
        assertEquals(0, counts.get(QUEUE).get(JobStatus.FAILED));
        assertEquals(1, counts.get("ledger").get(JobStatus.FAILED));
        assertEquals(0, counts.get("ledger").get(JobStatus.PENDING));
    }

    @Test
    void rejectsInvalidArguments() {
        assertThrows(IllegalArgumentException.class, () -> store.enqueue(QUEUE, "bad", PAYLOAD, 0));
        assertThrows(IllegalArgumentException.class, () -> store.claim(QUEUE, 0, clock.instant()));
    }

    private int pendingCount() {
        return store.countByQueueAndStatus().getOrDefault(QUEUE, Map.of()).getOrDefault(JobStatus.PENDING, 0);
    }
}
