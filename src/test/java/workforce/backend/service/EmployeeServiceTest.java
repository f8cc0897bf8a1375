package workforce.backend.service;

import workforce.backend.MutableClock;
import workforce.backend.model.Employee;
import workforce.backend.store.Database;
import workforce.backend.store.JdbcEmployeeRepository;
import org.junit.jupiter.api.*;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class EmployeeServiceTest {

    private static Database db;
    private static EmployeeService service;

    @BeforeAll
    static void setup() {
        db = new Database("jdbc:h2:mem:test-employee-service-" + System.nanoTime()
                + ";DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE", 5);
        service = new EmployeeService(
                new JdbcEmployeeRepository(db, MutableClock.startingAt("2024-07-01T00:00:00Z")));
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
            conn.commit();
        }
    }

    @Test
    void saveCleansTheDraft() {
        Employee saved = service.save("acme", " emp-1 ", new EmployeeDraft(
                " Ada ", "", "R&D", Arrays.asList("java", " java", "", null, "SQL"), null));

        assertEquals("emp-1", saved.id());
        assertEquals("Ada", saved.name());
        assertNull(saved.jobTitle());
        assertEquals("R&D", saved.department());
        assertEquals(List.of("java", "SQL"), saved.skills());
        assertTrue(saved.active(), "a missing flag keeps the employee active");
        assertEquals(saved, service.get("acme", "emp-1"));
    }

    @Test
    void saveReplacesTheProfile() {
        service.save("acme", "emp-1", new EmployeeDraft("Ada", "Engineer", null, List.of("java"), true));
        Employee replaced = service.save("acme", "emp-1",
                new EmployeeDraft("Ada", "Lead", null, null, false));

        assertEquals("Lead", replaced.jobTitle());
        assertTrue(replaced.skills().isEmpty());
        assertFalse(replaced.active());
    }

    @Test
    void unknownProfileIsNotFound() {
        service.save("acme", "emp-1", new EmployeeDraft("Ada", null, null, null, null));

        assertThrows(NotFoundException.class, () -> service.get("acme", "emp-2"));
        assertThrows(NotFoundException.class, () -> service.get("globex", "emp-1"));
    }

    @Test
    void idsAreRequired() {
        EmployeeDraft draft = new EmployeeDraft("Ada", null, null, null, null);

        assertThrows(IllegalArgumentException.class, () -> service.save("acme", " ", draft));
        assertThrows(IllegalArgumentException.class, () -> service.save(null, "emp-1", draft));
        assertThrows(IllegalArgumentException.class, () -> service.get("acme", null));
    }
}
