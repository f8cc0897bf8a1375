package workforce.backend.service;

import workforce.backend.MutableClock;
import workforce.backend.model.Employee;
import workforce.backend.model.Task;
import workforce.backend.model.TaskStatus;
import workforce.backend.store.Database;
import workforce.backend.store.JdbcEmployeeRepository;
import workforce.backend.store.JdbcPerformanceLogRepository;
import workforce.backend.store.JdbcTaskRepository;
import org.junit.jupiter.api.*;

import java.time.Duration;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class SkillServiceTest {

    private static Database db;
    private static MutableClock clock;
    private static JdbcEmployeeRepository employees;
    private static JdbcTaskRepository tasks;
    private static JdbcPerformanceLogRepository logs;
    private static SkillService service;

    @BeforeAll
    static void setup() {
        db = new Database("jdbc:h2:mem:test-skills-" + System.nanoTime()
                + ";DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE", 5);
        clock = MutableClock.startingAt("2024-06-01T00:00:00Z");
        employees = new JdbcEmployeeRepository(db, clock);
        tasks = new JdbcTaskRepository(db);
        logs = new JdbcPerformanceLogRepository(db, clock);
        service = new SkillService(employees, tasks, logs);
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
            conn.commit();
        }
        employee("e1", "Ada", "Engineer", "R&D", true, "java", "sql", "docker");
        employee("e2", "Bob", "Engineer", "R&D", true, "java");
        employee("e3", "Cy", "Engineer", "Ops", true, "Java", "SQL", "docker", "go");
        employee("e4", "Dee", "Engineer", "R&D", false, "java", "sql", "docker", "go");
        employee("e5", "Eve", "Analyst", "R&D", true, "sql");
    }

    @Test
    void recommendsTopThreeByRank() {
        task("t1", null, TaskStatus.ASSIGNED, "Java", "SQL", "Go");
        task("e1-a", "e1", TaskStatus.IN_PROGRESS);
        task("e1-b", "e1", TaskStatus.ASSIGNED);
        task("e3-done", "e3", TaskStatus.COMPLETED);
        logs.append("acme", "e1", 60.0, 0.5, 0.5, 3.0);
        clock.advance(Duration.ofMinutes(1));
        logs.append("acme", "e1", 90.0, 1.0, 1.0, 3.0);
        logs.append("acme", "e3", 40.0, 0.2, 0.0, 2.0);

        List<Recommendation> ranked = service.recommend("acme", "t1");

        // e3: 50 + 30 + 8, e1: 33.3 + 24 + 18, e2 and e5 tie at 16.7 + 30 + 10
        assertEquals(List.of("e3", "e1", "e2"), ids(ranked));
        Recommendation best = ranked.get(0);
        assertEquals(3, best.matchedSkills());
        assertEquals(1.0, best.matchRate());
        assertEquals(0, best.openTasks(), "completed tasks are not open");
        assertEquals(88.0, best.rank(), 1e-9);
        assertEquals(2, ranked.get(1).openTasks());
        assertEquals(90.0, ranked.get(1).performanceScore());
        assertEquals(SkillService.DEFAULT_PERFORMANCE_SCORE, ranked.get(2).performanceScore());
    }

    @Test
    void assigneeDepartmentScopesCandidates() {
        task("t2", "e2", TaskStatus.ASSIGNED, "go", "docker");
        task("e1-a", "e1", TaskStatus.IN_PROGRESS);
        task("e1-b", "e1", TaskStatus.ASSIGNED);

        List<Recommendation> ranked = service.recommend("acme", "t2");

        // e1: 25 + 24 + 10, e5: 0 + 30 + 10, e2: 0 + 27 + 10; e3 is in Ops and e4 is inactive
        assertEquals(List.of("e1", "e5", "e2"), ids(ranked));
        assertEquals(59.0, ranked.get(0).rank(), 1e-9);
    }

    @Test
    void assigneeWithoutProfileDoesNotScope() {
        task("t3", "contractor", TaskStatus.ASSIGNED, "go");

        assertEquals(List.of("e3", "e1", "e2"), ids(service.recommend("acme", "t3")));
    }

    @Test
    void recommendForUnknownTaskIsNotFound() {
        assertThrows(NotFoundException.class, () -> service.recommend("acme", "missing"));
        task("t1", null, TaskStatus.ASSIGNED, "java");
        assertThrows(NotFoundException.class, () -> service.recommend("globex", "t1"));
    }

    @Test
    void gapsCoverTheWholeRole() {
        task("a", "e2", TaskStatus.ASSIGNED, "Java", "Kubernetes");
        task("b", "e3", TaskStatus.COMPLETED, "go");
        tasks.deactivate("acme", "b");
        task("c", "e4", TaskStatus.ASSIGNED, "rust");
        task("d", "e5", TaskStatus.ASSIGNED, "excel");

        SkillGapReport report = service.skillGaps("acme", "e1");

        assertEquals("Ada", report.name());
        assertEquals(Set.of("java", "kubernetes", "go"), Set.copyOf(report.requiredSkills()));
        assertEquals(Set.of("kubernetes", "go"), Set.copyOf(report.gapSkills()));
        assertEquals(0.333, report.coverageRate());
    }

    @Test
    void withoutJobTitleOnlyOwnTasksCount() {
        employee("e6", "Fay", null, "R&D", true, "Python");
        task("own", "e6", TaskStatus.IN_PROGRESS, "python", "Pandas");
        task("other", "e2", TaskStatus.ASSIGNED, "java");

        SkillGapReport report = service.skillGaps("acme", "e6");

        assertEquals(List.of("python", "pandas"), report.requiredSkills());
        assertEquals(List.of("pandas"), report.gapSkills());
        assertEquals(0.5, report.coverageRate());
    }

    @Test
    void nothingRequiredIsFullCoverage() {
        SkillGapReport report = service.skillGaps("acme", "e5");

        assertTrue(report.requiredSkills().isEmpty());
        assertTrue(report.gapSkills().isEmpty());
        assertEquals(1.0, report.coverageRate());
    }

    @Test
    void gapsOfInactiveOrUnknownEmployeeAreNotFound() {
        assertThrows(NotFoundException.class, () -> service.skillGaps("acme", "e4"));
        assertThrows(NotFoundException.class, () -> service.skillGaps("acme", "nobody"));
        assertThrows(NotFoundException.class, () -> service.skillGaps("globex", "e1"));
    }

    private static List<String> ids(List<Recommendation> ranked) {
        return ranked.stream().map(r -> r.employee().id()).toList();
    }

    private static void employee(String id, String name, String jobTitle, String department, boolean active,
            String... skills) {
        employees.save(new Employee(id, "acme", name, jobTitle, department, List.of(skills), active, null));
    }

    private static void task(String id, String assignee, TaskStatus status, String... skills) {
        clock.advance(Duration.ofSeconds(1));
        tasks.save(Task.builder()
                .id(id)
                .tenantId("acme")
                .assigneeId(assignee)
                .title(id)
                .status(status)
                .requiredSkills(List.of(skills))
                .completedAt(status == TaskStatus.COMPLETED ? clock.instant() : null)
                .createdAt(clock.instant())
                .build());
    }
}
