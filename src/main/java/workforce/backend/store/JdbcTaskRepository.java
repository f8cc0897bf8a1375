package workforce.backend.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import workforce.backend.model.Task;
import workforce.backend.model.TaskPriority;
import workforce.backend.model.TaskStatus;
import workforce.backend.repository.TaskRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

import static workforce.backend.store.JdbcValues.setTimestamp;
import static workforce.backend.store.JdbcValues.toInstant;

/**
 * JDBC implementation of TaskRepository.
 * Every query is scoped by tenant id.
 */
public class JdbcTaskRepository implements TaskRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcTaskRepository.class);

    private static final TypeReference<List<String>> SKILLS_TYPE = new TypeReference<>() {
    };

    private final Database db;
    private final ObjectMapper mapper;

    public JdbcTaskRepository(Database db) {
        this(db, new ObjectMapper());
    }

    public JdbcTaskRepository(Database db, ObjectMapper mapper) {
        this.db = db;
        this.mapper = mapper;
    }

    @Override
    public void save(Task task) {
        String sql = """
                    INSERT INTO tasks (id, tenant_id, assignee_id, title, description, status, priority, complexity,
                                       required_skills, due_date, completed_at, active, created_at)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, task.id());
            ps.setString(2, task.tenantId());
            ps.setString(3, task.assigneeId());
            ps.setString(4, task.title());
            ps.setString(5, task.description());
            ps.setString(6, task.status().name());
            ps.setString(7, task.priority().name());
            ps.setInt(8, task.complexity());
            ps.setString(9, writeSkills(task.requiredSkills()));
            setTimestamp(ps, 10, task.dueDate());
            setTimestamp(ps, 11, task.completedAt());
            ps.setBoolean(12, task.active());
            setTimestamp(ps, 13, task.createdAt() != null ? task.createdAt() : Instant.now());

            ps.executeUpdate();
            conn.commit();

            log.debug("Saved task {} for tenant {}", task.id(), task.tenantId());
        } catch (SQLException e) {
            throw new RuntimeException("Failed to save task: " + task.id(), e);
        }
    }

    @Override
    public Optional<Task> findById(String tenantId, String taskId) {
        String sql = "SELECT * FROM tasks WHERE tenant_id = ? AND id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, tenantId);
            ps.setString(2, taskId);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapRow(rs));
                }
            }
            return Optional.empty();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find task: " + taskId, e);
        }
    }

    @Override
    public List<Task> findByTenant(String tenantId, TaskStatus status, String assigneeId, int limit) {
        StringBuilder sql = new StringBuilder("SELECT * FROM tasks WHERE tenant_id = ? AND active = TRUE");
        if (status != null) {
            sql.append(" AND status = ?");
        }
        if (assigneeId != null) {
            sql.append(" AND assignee_id = ?");
        }
        sql.append(" ORDER BY created_at DESC LIMIT ?");

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql.toString())) {

            int idx = 1;
            ps.setString(idx++, tenantId);
            if (status != null) {
                ps.setString(idx++, status.name());
            }
            if (assigneeId != null) {
                ps.setString(idx++, assigneeId);
            }
            ps.setInt(idx, limit);
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list tasks for tenant: " + tenantId, e);
        }
    }

    @Override
    public List<Task> findActiveByAssignee(String tenantId, String assigneeId) {
        String sql = "SELECT * FROM tasks WHERE tenant_id = ? AND assignee_id = ? AND active = TRUE ORDER BY created_at";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, tenantId);
            ps.setString(2, assigneeId);
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find tasks of assignee: " + assigneeId, e);
        }
    }

    @Override
    public List<Task> findByAssignees(String tenantId, Collection<String> assigneeIds) {
        if (assigneeIds.isEmpty()) {
            return List.of();
        }
        String placeholders = String.join(", ", Collections.nCopies(assigneeIds.size(), "?"));
        String sql = "SELECT * FROM tasks WHERE tenant_id = ? AND assignee_id IN (" + placeholders
                + ") ORDER BY created_at";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            int idx = 1;
            ps.setString(idx++, tenantId);
            for (String assigneeId : assigneeIds) {
                ps.setString(idx++, assigneeId);
            }
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find tasks of " + assigneeIds.size() + " assignees", e);
        }
    }

    @Override
    public Map<String, Map<TaskStatus, Integer>> countByAssigneeAndStatus(String tenantId) {
        String sql = """
                    SELECT assignee_id, status, COUNT(*) AS cnt FROM tasks
                    WHERE tenant_id = ? AND assignee_id IS NOT NULL AND active = TRUE
                    GROUP BY assignee_id, status
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, tenantId);
            Map<String, Map<TaskStatus, Integer>> counts = new TreeMap<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    counts.computeIfAbsent(rs.getString("assignee_id"), a -> new EnumMap<>(TaskStatus.class))
                            .put(TaskStatus.valueOf(rs.getString("status")), rs.getInt("cnt"));
                }
            }
            return counts;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to count tasks for tenant: " + tenantId, e);
        }
    }

    @Override
    public boolean updateStatus(String tenantId, String taskId, TaskStatus expected, TaskStatus next,
            Instant completedAt) {
        return db.inTransaction("update status of task: " + taskId,
                conn -> updateStatus(conn, tenantId, taskId, expected, next, completedAt));
    }

    @Override
    public boolean updateStatus(Connection conn, String tenantId, String taskId, TaskStatus expected,
            TaskStatus next, Instant completedAt) throws SQLException {
        String sql = """
                    UPDATE tasks
                    SET status = ?, completed_at = ?
                    WHERE tenant_id = ? AND id = ? AND status = ? AND active = TRUE
                """;

        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, next.name());
            setTimestamp(ps, 2, completedAt);
            ps.setString(3, tenantId);
            ps.setString(4, taskId);
            ps.setString(5, expected.name());

            int updated = ps.executeUpdate();
            if (updated > 0) {
                log.debug("Task {} moved {} -> {}", taskId, expected, next);
            }
            return updated > 0;
        }
    }

    @Override
    public boolean deactivate(String tenantId, String taskId) {
        String sql = "UPDATE tasks SET active = FALSE WHERE tenant_id = ? AND id = ? AND active = TRUE";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, tenantId);
            ps.setString(2, taskId);
            int updated = ps.executeUpdate();
            conn.commit();
            return updated > 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to deactivate task: " + taskId, e);
        }
    }

    // Helper methods

    private List<Task> executeQuery(PreparedStatement ps) throws SQLException {
        List<Task> results = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                results.add(mapRow(rs));
            }
        }
        return results;
    }

    private Task mapRow(ResultSet rs) throws SQLException {
        return Task.builder()
                .id(rs.getString("id"))
                .tenantId(rs.getString("tenant_id"))
                .assigneeId(rs.getString("assignee_id"))
                .title(rs.getString("title"))
                .description(rs.getString("description"))
                .status(TaskStatus.valueOf(rs.getString("status")))
                .priority(TaskPriority.valueOf(rs.getString("priority")))
                .complexity(rs.getInt("complexity"))
                .requiredSkills(readSkills(rs.getString("required_skills")))
                .dueDate(toInstant(rs.getTimestamp("due_date")))
                .completedAt(toInstant(rs.getTimestamp("completed_at")))
                .active(rs.getBoolean("active"))
                .createdAt(toInstant(rs.getTimestamp("created_at")))
                .build();
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
            log.warn("Malformed required_skills column ignored: {}", e.getMessage());
            return List.of();
        }
    }
}
