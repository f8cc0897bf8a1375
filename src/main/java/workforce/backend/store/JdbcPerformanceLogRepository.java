package workforce.backend.store;

import workforce.backend.model.PerformanceLog;
import workforce.backend.repository.PerformanceLogRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static workforce.backend.store.JdbcValues.getDoubleOrNull;
import static workforce.backend.store.JdbcValues.setDoubleOrNull;
import static workforce.backend.store.JdbcValues.setTimestamp;
import static workforce.backend.store.JdbcValues.toInstant;

public class JdbcPerformanceLogRepository implements PerformanceLogRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcPerformanceLogRepository.class);

    private final Database db;
    private final Clock clock;

    public JdbcPerformanceLogRepository(Database db) {
        this(db, Clock.systemUTC());
    }

    public JdbcPerformanceLogRepository(Database db, Clock clock) {
        this.db = db;
        this.clock = clock;
    }

    @Override
    public PerformanceLog append(String tenantId, String employeeId, Double score,
            Double completionRate, Double onTimeRate, Double avgComplexity) {
        String sql = """
                    INSERT INTO performance_logs (id, tenant_id, employee_id, score, completion_rate,
                                                  on_time_rate, avg_complexity, created_at)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?)
                """;

        PerformanceLog row = new PerformanceLog(UUID.randomUUID().toString(), tenantId, employeeId,
                score, completionRate, onTimeRate, avgComplexity, clock.instant());

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, row.id());
            ps.setString(2, tenantId);
            ps.setString(3, employeeId);
            setDoubleOrNull(ps, 4, score);
            setDoubleOrNull(ps, 5, completionRate);
            setDoubleOrNull(ps, 6, onTimeRate);
            setDoubleOrNull(ps, 7, avgComplexity);
            setTimestamp(ps, 8, row.createdAt());

            ps.executeUpdate();
            conn.commit();

            log.debug("Appended performance log {} for employee {} (score={})", row.id(), employeeId, score);
            return row;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to append performance log for employee: " + employeeId, e);
        }
    }

    @Override
    public List<PerformanceLog> findSince(String tenantId, String employeeId, Instant since) {
        String sql = """
                    SELECT * FROM performance_logs
                    WHERE tenant_id = ? AND employee_id = ? AND created_at >= ?
                    ORDER BY created_at DESC
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, tenantId);
            ps.setString(2, employeeId);
            setTimestamp(ps, 3, since);
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read performance logs of employee: " + employeeId, e);
        }
    }

    @Override
    public List<PerformanceLog> findRecent(String tenantId, String employeeId, int limit) {
        String sql = """
                    SELECT * FROM performance_logs
                    WHERE tenant_id = ? AND employee_id = ?
                    ORDER BY created_at DESC
                    LIMIT ?
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, tenantId);
            ps.setString(2, employeeId);
            ps.setInt(3, limit);
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read performance logs of employee: " + employeeId, e);
        }
    }

    @Override
    public Map<String, Double> findLatestScores(String tenantId) {
        String sql = """
                    SELECT employee_id, score FROM performance_logs
                    WHERE tenant_id = ? AND score IS NOT NULL
                    ORDER BY created_at DESC
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, tenantId);
            Map<String, Double> latest = new LinkedHashMap<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    // Newest first, so the first row per employee wins
                    latest.putIfAbsent(rs.getString("employee_id"), rs.getDouble("score"));
                }
            }
            return latest;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read latest scores for tenant: " + tenantId, e);
        }
    }

    @Override
    public List<PerformanceLog> findRecentScored(String tenantId, int limit) {
        String sql = """
                    SELECT * FROM performance_logs
                    WHERE tenant_id = ? AND score IS NOT NULL
                    ORDER BY created_at DESC
                    LIMIT ?
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, tenantId);
            ps.setInt(2, limit);
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read performance logs for tenant: " + tenantId, e);
        }
    }

    private List<PerformanceLog> executeQuery(PreparedStatement ps) throws SQLException {
        List<PerformanceLog> results = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                results.add(new PerformanceLog(
                        rs.getString("id"),
                        rs.getString("tenant_id"),
                        rs.getString("employee_id"),
                        getDoubleOrNull(rs, "score"),
                        getDoubleOrNull(rs, "completion_rate"),
                        getDoubleOrNull(rs, "on_time_rate"),
                        getDoubleOrNull(rs, "avg_complexity"),
                        toInstant(rs.getTimestamp("created_at"))));
            }
        }
        return results;
    }
}
