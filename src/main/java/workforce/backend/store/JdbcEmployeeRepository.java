package workforce.backend.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import workforce.backend.model.Employee;
import workforce.backend.repository.EmployeeRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static workforce.backend.store.JdbcValues.setTimestamp;
import static workforce.backend.store.JdbcValues.toInstant;

public class JdbcEmployeeRepository implements EmployeeRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcEmployeeRepository.class);

    private static final TypeReference<List<String>> SKILLS_TYPE = new TypeReference<>() {
    };

    private final Database db;
    private final ObjectMapper mapper;
    private final Clock clock;

    public JdbcEmployeeRepository(Database db, Clock clock) {
        this(db, new ObjectMapper(), clock);
    }

    public JdbcEmployeeRepository(Database db, ObjectMapper mapper, Clock clock) {
        this.db = db;
        this.mapper = mapper;
        this.clock = clock;
    }

    @Override
    public void save(Employee employee) {
        String updateSql = """
                    UPDATE employees
                    SET name = ?, job_title = ?, department = ?, skills = ?, active = ?
                    WHERE tenant_id = ? AND id = ?
                """;

        String insertSql = """
                    INSERT INTO employees (id, tenant_id, name, job_title, department, skills, active, created_at)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?)
                """;

        String skills = writeSkills(employee.skills());

        db.inTransaction("save employee: " + employee.id(), conn -> {
            int updated;
            try (PreparedStatement ps = conn.prepareStatement(updateSql)) {
                ps.setString(1, employee.name());
                ps.setString(2, employee.jobTitle());
                ps.setString(3, employee.department());
                ps.setString(4, skills);
                ps.setBoolean(5, employee.active());
                ps.setString(6, employee.tenantId());
                ps.setString(7, employee.id());
                updated = ps.executeUpdate();
            }

            if (updated == 0) {
                try (PreparedStatement ps = conn.prepareStatement(insertSql)) {
                    ps.setString(1, employee.id());
                    ps.setString(2, employee.tenantId());
                    ps.setString(3, employee.name());
                    ps.setString(4, employee.jobTitle());
                    ps.setString(5, employee.department());
                    ps.setString(6, skills);
                    ps.setBoolean(7, employee.active());
                    setTimestamp(ps, 8, employee.createdAt() != null ? employee.createdAt() : clock.instant());
                    ps.executeUpdate();
                }
            }

            log.debug("{} employee {} for tenant {}", updated == 0 ? "Created" : "Updated",
                    employee.id(), employee.tenantId());
            return updated;
        });
    }

    @Override
    public Optional<Employee> findById(String tenantId, String employeeId) {
        String sql = "SELECT * FROM employees WHERE tenant_id = ? AND id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, tenantId);
            ps.setString(2, employeeId);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapRow(rs));
                }
            }
            return Optional.empty();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find employee: " + employeeId, e);
        }
    }

    @Override
    public List<Employee> findByTenant(String tenantId) {
        String sql = "SELECT * FROM employees WHERE tenant_id = ? ORDER BY name, id";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, tenantId);
            List<Employee> results = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    results.add(mapRow(rs));
                }
            }
            return results;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list employees for tenant: " + tenantId, e);
        }
    }

    private Employee mapRow(ResultSet rs) throws SQLException {
        return new Employee(
                rs.getString("id"),
                rs.getString("tenant_id"),
                rs.getString("name"),
                rs.getString("job_title"),
                rs.getString("department"),
                readSkills(rs.getString("skills")),
                rs.getBoolean("active"),
                toInstant(rs.getTimestamp("created_at")));
    }

    private String writeSkills(List<String> skills) {
        if (skills == null || skills.isEmpty()) {
            return null;
        }
        try {
            return mapper.writeValueAsString(skills);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Unserializable skills list", e);
        }
    }

    private List<String> readSkills(String json) {
        if (json == null || json.isBlank()) {
            return List.of();
        }
        try {
            return mapper.readValue(json, SKILLS_TYPE);
        } catch (JsonProcessingException e) {
            log.warn("Malformed skills column ignored: {}", e.getMessage());
            return List.of();
        }
    }
}
