package workforce.backend.service;

import workforce.backend.MutableClock;
import workforce.backend.model.Employee;
import workforce.backend.model.LedgerEntry;
import workforce.backend.model.Task;
import workforce.backend.model.TaskStatus;
import workforce.backend.service.DashboardStats.EmployeeStats;
import workforce.backend.store.Database;
import workforce.backend.store.JdbcEmployeeRepository;
import workforce.backend.store.JdbcLedgerEntryRepository;
import workforce.backend.store.JdbcPerformanceLogRepository;
import workforce.backend.store.JdbcTaskRepository;
import org.junit.jupiter.api.*;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DashboardServiceTest {

    private static Database db;
    private static MutableClock clock;
    private static JdbcEmployeeRepository employees;
    private static JdbcTaskRepository tasks;
    private static JdbcPerformanceLogRepository logs;
    private static JdbcLedgerEntryRepository entries;
    private static DashboardService service;

    @BeforeAll
    static void setup() {
        db = new Database("jdbc:h2:mem:test-dashboard-" + System.nanoTime()
                + ";DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE", 5);
        clock = MutableClock.startingAt("2024-07-01T00:00:00Z");
        employees = new JdbcEmployeeRepository(db, clock);
        tasks = new JdbcTaskRepository(db);
        logs = new JdbcPerformanceLogRepository(db, clock);
        entries = new JdbcLedgerEntryRepository(db, clock);
        service = new DashboardService(employees, tasks, logs, entries, clock);
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
            st.execute("DELETE FROM employees");
            st.execute("DELETE FROM tasks");
            st.execute("DELETE FROM performance_logs");
            st.execute("DELETE FROM ledger_entries");
            conn.commit();
        }
    }

    @Test
    void aggregatesProfilesTasksScoresAndLedger() {
        employees.save(new Employee("e1", "acme", "Ada", "Engineer", "R&D", List.of("java"), true, null));
        employees.save(new Employee("e2", "acme", "Bob", "Analyst", "R&D", List.of(), false, null));
        task("a1", "e1", TaskStatus.COMPLETED);
        task("a2", "e1", TaskStatus.COMPLETED);
        task("a3", "e1", TaskStatus.IN_PROGRESS);
        task("a4", "e1", TaskStatus.ASSIGNED);
        task("a5", "e1", TaskStatus.COMPLETED);
        tasks.deactivate("acme", "a5");
        task("b1", "e2", TaskStatus.COMPLETED);
        task("x1", "e9", TaskStatus.ASSIGNED);
        task("u1", null, TaskStatus.ASSIGNED);
        entries.insert("acme", "a1", "0xa1", LedgerEntry.TASK_COMPLETED);

        logs.append("acme", "e1", 70.0, 0.5, 1.0, 3.0);
        clock.advance(Duration.ofMinutes(1));
        logs.append("acme", "e1", 82.46, 0.5, 1.0, 3.0);
        logs.append("acme", "e2", 60.0, 1.0, 1.0, 2.0);
        logs.append("acme", "e9", null, null, null, null);

        DashboardStats stats = service.stats("acme");

        assertEquals(2, stats.totalEmployees());
        assertEquals(1, stats.activeEmployees());
        assertEquals(6, stats.tasksAssigned());
        assertEquals(3, stats.tasksCompleted());
        assertEquals(0.5, stats.completionRate());
        // (82.46 + 60) / 2
        assertEquals(71.2, stats.averageScore());
        assertEquals("e1", stats.topPerformer().employeeId());
        assertEquals("Ada", stats.topPerformer().name());
        assertEquals(82.5, stats.topPerformer().score());
        assertEquals("Bob", stats.lowestPerformer().name());
        assertEquals(3, stats.recentPerformanceLogs().size());
        assertEquals(1, stats.recentLedgerEntries().size());
        assertEquals(clock.instant(), stats.generatedAt());

        List<EmployeeStats> rows = stats.employees();
        assertEquals(List.of("e2", "e1", "e9"), rows.stream().map(EmployeeStats::employeeId).toList());
        EmployeeStats ada = rows.get(1);
        assertEquals(4, ada.tasksAssigned());
        assertEquals(2, ada.tasksCompleted());
        assertEquals(0.5, ada.completionRate());
        assertEquals(82.46, ada.productivityScore());
        assertEquals(1, ada.verifiedTasks());
        EmployeeStats unprofiled = rows.get(2);
        assertEquals("e9", unprofiled.name());
        assertNull(unprofiled.jobTitle());
        assertNull(unprofiled.productivityScore());
        assertEquals(0, unprofiled.verifiedTasks());
    }

    @Test
    void emptyTenantHasZeroesAndNoPerformers() {
        DashboardStats stats = service.stats("acme");

        assertEquals(0, stats.totalEmployees());
        assertEquals(0, stats.tasksAssigned());
        assertEquals(0.0, stats.completionRate());
        assertNull(stats.averageScore());
        assertNull(stats.topPerformer());
        assertNull(stats.lowestPerformer());
        assertTrue(stats.employees().isEmpty());
    }

    @Test
    void otherTenantsAreInvisible() {
        employees.save(new Employee("e1", "globex", "Grace", null, null, List.of(), true, null));
        task("g1", "e1", TaskStatus.COMPLETED);

        DashboardStats stats = service.stats("initech");

        assertEquals(0, stats.totalEmployees());
        assertEquals(0, stats.tasksCompleted());
    }

    @Test
    void tenantIsRequired() {
        assertThrows(IllegalArgumentException.class, () -> service.stats(" "));
    }

    private static void task(String id, String assignee, TaskStatus status) {
        clock.advance(Duration.ofSeconds(1));
        tasks.save(Task.builder()
                .id(id)
                .tenantId(id.startsWith("g") ? "globex" : "acme")
                .assigneeId(assignee)
                .title(id)
                .status(status)
                .completedAt(status == TaskStatus.COMPLETED ? clock.instant() : null)
                .createdAt(clock.instant())
                .build());
    }
}
