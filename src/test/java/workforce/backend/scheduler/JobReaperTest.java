package workforce.backend.scheduler;

import workforce.backend.MutableClock;
import workforce.backend.model.Job;
import workforce.backend.model.JobStatus;
import workforce.backend.store.Backoff;
import workforce.backend.store.Database;
import workforce.backend.store.JdbcJobStore;
import org.junit.jupiter.api.*;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class JobReaperTest {

    private static final String PAYLOAD = "{\"tenantId\":\"acme\",\"taskId\":\"t1\"}";

    private static Database db;
    private static MutableClock clock;
    private static JdbcJobStore store;
    private static JobReaper reaper;

    @BeforeAll
    static void setup() {
        db = new Database("jdbc:h2:mem:test-reaper-" + System.nanoTime()
                + ";DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE", 5);
        clock = MutableClock.startingAt("2024-05-01T10:00:00Z");
        store = new JdbcJobStore(db, new Backoff(Duration.ofSeconds(5), Duration.ofMinutes(10)), clock);
        reaper = new JobReaper(store, Duration.ofMinutes(5), clock);
    }

    @AfterAll
    static void teardown() {
        if (db != null)
            db.close();
    }

    @BeforeEach
    void cleanJobs() throws Exception {
        try (var conn = db.getConnection();
                var st = conn.createStatement()) {
            st.execute("DELETE FROM jobs");
            conn.commit();
        }
    }

    @Test
    void freshClaimsAreLeftAlone() {
        store.enqueue("ledger", "ledger:task:t1", PAYLOAD, 3);
        store.claim("ledger", 1, clock.instant());

        clock.advance(Duration.ofMinutes(4));

        assertEquals(0, reaper.reapStuckJobs());
        assertEquals(JobStatus.PROCESSING, store.findByDedupKey("ledger:task:t1").orElseThrow().status());
    }

    @Test
    void stuckJobWithAttemptsLeftIsRequeued() {
        store.enqueue("ledger", "ledger:task:t1", PAYLOAD, 3);
        store.claim("ledger", 1, clock.instant());

        clock.advance(Duration.ofMinutes(6));

        assertEquals(1, reaper.reapStuckJobs());
        Job job = store.findByDedupKey("ledger:task:t1").orElseThrow();
        assertEquals(JobStatus.PENDING, job.status());
        assertEquals(1, job.attempts(), "the lost attempt still counts");

        // Claimable again right away
        assertEquals(1, store.claim("ledger", 1, clock.instant()).size());
    }

    @Test
    void stuckJobOnLastAttemptIsMarkedFailed() {
        store.enqueue("ledger", "ledger:task:t1", PAYLOAD, 1);
        store.claim("ledger", 1, clock.instant());

        clock.advance(Duration.ofMinutes(6));

        assertEquals(1, reaper.reapStuckJobs());
        Job job = store.findByDedupKey("ledger:task:t1").orElseThrow();
        assertEquals(JobStatus.FAILED, job.status());
        assertTrue(job.errorMessage().contains("stuck in PROCESSING"));
    }

    @Test
    void renewedClaimIsLeftAlone() {
        store.enqueue("ledger", "ledger:task:t1", PAYLOAD, 3);
        Job claimed = store.claim("ledger", 1, clock.instant()).get(0);

        clock.advance(Duration.ofMinutes(6));
        store.renewClaim(claimed.id(), claimed.claimToken(), clock.instant());

        assertEquals(0, reaper.reapStuckJobs());
        assertEquals(JobStatus.PROCESSING, store.findByDedupKey("ledger:task:t1").orElseThrow().status());
        assertTrue(store.complete(claimed.id(), claimed.claimToken()));
    }

    @Test
    void reapedClaimCannotCompleteAnymore() {
        store.enqueue("ledger", "ledger:task:t1", PAYLOAD, 3);
        Job claimed = store.claim("ledger", 1, clock.instant()).get(0);

        clock.advance(Duration.ofMinutes(6));
        assertEquals(1, reaper.reapStuckJobs());

        assertFalse(store.renewClaim(claimed.id(), claimed.claimToken(), clock.instant()));
        assertFalse(store.complete(claimed.id(), claimed.claimToken()));
        assertEquals(JobStatus.PENDING, store.findByDedupKey("ledger:task:t1").orElseThrow().status());
    }

    @Test
    void pendingAndFailedJobsAreNotTouched() {
        store.enqueue("ledger", "ledger:task:t1", PAYLOAD, 3);
        clock.advance(Duration.ofHours(1));

        assertEquals(0, reaper.reapStuckJobs());
        assertDoesNotThrow(reaper::run);
    }
}
