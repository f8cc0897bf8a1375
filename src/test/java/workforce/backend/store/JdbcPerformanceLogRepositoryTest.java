package workforce.backend.store;

import workforce.backend.MutableClock;
import workforce.backend.model.LedgerEntry;
import workforce.backend.model.PerformanceLog;
import workforce.backend.model.Task;
import workforce.backend.model.TaskStatus;
import org.junit.jupiter.api.*;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Append-only score history and the ledger entry table.
 */
class JdbcPerformanceLogRepositoryTest {

    private static Database db;
    private static MutableClock clock;
    private static JdbcPerformanceLogRepository logs;
    private static JdbcLedgerEntryRepository entries;

    @BeforeAll
    static void setup() {
        db = new Database("jdbc:h2:mem:test-history-" + System.nanoTime()
                + ";DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE", 5);
        clock = MutableClock.startingAt("2024-05-01T00:00:00Z");
        logs = new JdbcPerformanceLogRepository(db, clock);
        entries = new JdbcLedgerEntryRepository(db, clock);
    }

    @AfterAll
    static void teardown() {
        if (db != null)
            db.close();
    }

    @BeforeEach
    void clean() throws Exception {
        try (var conn = db.getConnection();
                var st = conn.createStatement()) {
            st.execute("DELETE FROM performance_logs");
            st.execute("DELETE FROM ledger_entries");
            st.execute("DELETE FROM tasks");
            conn.commit();
        }
    }

    @Test
    void appendKeepsEveryRowNewestFirst() {
        logs.append("acme", "emp-1", 70.0, 0.5, 1.0, 3.0);
        clock.advance(Duration.ofDays(1));
        logs.append("acme", "emp-1", 80.0, 0.75, null, 3.5);
        clock.advance(Duration.ofDays(1));
        PerformanceLog latest = logs.append("acme", "emp-1", null, null, null, null);
        logs.append("acme", "emp-2", 50.0, 0.1, 0.0, 1.0);
        logs.append("globex", "emp-1", 99.0, 1.0, 1.0, 5.0);

        List<PerformanceLog> recent = logs.findRecent("acme", "emp-1", 10);
        assertEquals(3, recent.size());
        assertEquals(latest.id(), recent.get(0).id());
        assertNull(recent.get(0).score());
        assertEquals(80.0, recent.get(1).score());
        assertNull(recent.get(1).onTimeRate());
        assertEquals(70.0, recent.get(2).score());

        assertEquals(2, logs.findRecent("acme", "emp-1", 2).size());
    }

    @Test
    void findSinceIsInclusive() {
        Instant start = clock.instant();
        logs.append("acme", "emp-1", 60.0, 0.5, null, 2.0);
        clock.advance(Duration.ofHours(1));
        logs.append("acme", "emp-1", 65.0, 0.5, null, 2.0);

        assertEquals(2, logs.findSince("acme", "emp-1", start).size());
        assertEquals(1, logs.findSince("acme", "emp-1", start.plusSeconds(1)).size());
    }

    @Test
    void latestScoresSkipUnscoredRows() {
        logs.append("acme", "emp-1", 70.0, 0.5, 1.0, 3.0);
        clock.advance(Duration.ofMinutes(1));
        logs.append("acme", "emp-1", 82.5, 0.75, 1.0, 3.0);
        clock.advance(Duration.ofMinutes(1));
        logs.append("acme", "emp-1", null, null, null, null);
        logs.append("acme", "emp-2", 40.0, 0.2, 0.0, 2.0);
        logs.append("acme", "emp-3", null, null, null, null);
        logs.append("globex", "emp-1", 99.0, 1.0, 1.0, 5.0);

        Map<String, Double> latest = logs.findLatestScores("acme");

        assertEquals(Map.of("emp-1", 82.5, "emp-2", 40.0), latest);
        assertTrue(logs.findLatestScores("initech").isEmpty());
    }

    @Test
    void recentScoredRowsAcrossTheTenant() {
        logs.append("acme", "emp-1", 70.0, 0.5, 1.0, 3.0);
        clock.advance(Duration.ofMinutes(1));
        logs.append("acme", "emp-2", null, null, null, null);
        clock.advance(Duration.ofMinutes(1));
        logs.append("acme", "emp-2", 60.0, 0.5, null, 2.0);
        logs.append("globex", "emp-9", 10.0, 0.1, null, 1.0);

        List<PerformanceLog> recent = logs.findRecentScored("acme", 10);

        assertEquals(List.of("emp-2", "emp-1"), recent.stream().map(PerformanceLog::employeeId).toList());
        assertEquals(1, logs.findRecentScored("acme", 1).size());
    }

    @Test
    void ledgerEntriesCountedPerAssignee() {
        JdbcTaskRepository tasks = new JdbcTaskRepository(db);
        Instant done = Instant.parse("2024-04-30T00:00:00Z");
        for (String[] row : new String[][] {{"t1", "emp-1"}, {"t2", "emp-1"}, {"t3", "emp-2"}, {"t4", null}}) {
            tasks.save(Task.builder().id(row[0]).tenantId("acme").assigneeId(row[1]).title(row[0])
                    .status(TaskStatus.COMPLETED).completedAt(done).build());
            entries.insert("acme", row[0], "0x" + row[0], LedgerEntry.TASK_COMPLETED);
        }
        tasks.save(Task.builder().id("t5").tenantId("acme").assigneeId("emp-2").title("t5").build());

        assertEquals(Map.of("emp-1", 2, "emp-2", 1), entries.countByAssignee("acme"));
        assertTrue(entries.countByAssignee("globex").isEmpty());
    }

    @Test
    void oneLedgerEntryPerTask() {
        assertTrue(entries.insert("acme", "task-1", "0xabc", LedgerEntry.TASK_COMPLETED));
        assertFalse(entries.insert("acme", "task-1", "0xdef", LedgerEntry.TASK_COMPLETED));

        LedgerEntry entry = entries.findByTaskId("task-1").orElseThrow();
        assertEquals("0xabc", entry.txReference());
        assertEquals("acme", entry.tenantId());
        assertEquals(clock.instant(), entry.loggedAt());
        assertEquals(1, entries.countAll());
    }

    @Test
    void ledgerEntriesAreListedPerTenantNewestFirst() {
        entries.insert("acme", "task-1", "0x1", null);
        clock.advance(Duration.ofMinutes(1));
        entries.insert("acme", "task-2", "0x2", LedgerEntry.TASK_COMPLETED);
        entries.insert("globex", "task-3", "0x3", LedgerEntry.TASK_COMPLETED);

        List<LedgerEntry> acme = entries.findByTenant("acme", 10);
        assertEquals(List.of("task-2", "task-1"), acme.stream().map(LedgerEntry::taskId).toList());
        assertEquals(LedgerEntry.TASK_COMPLETED, acme.get(1).eventKind());
        assertEquals(3, entries.countAll());
    }
}
