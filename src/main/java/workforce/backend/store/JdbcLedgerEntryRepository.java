package workforce.backend.store;

import workforce.backend.model.LedgerEntry;
import workforce.backend.repository.LedgerEntryRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static workforce.backend.store.JdbcValues.isUniqueViolation;
import static workforce.backend.store.JdbcValues.setTimestamp;
import static workforce.backend.store.JdbcValues.toInstant;

public class JdbcLedgerEntryRepository implements LedgerEntryRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcLedgerEntryRepository.class);

    private final Database db;
    private final Clock clock;

    public JdbcLedgerEntryRepository(Database db) {
        this(db, Clock.systemUTC());
    }

    public JdbcLedgerEntryRepository(Database db, Clock clock) {
        this.db = db;
        this.clock = clock;
    }

    @Override
    public boolean insert(String tenantId, String taskId, String txReference, String eventKind) {
        String sql = """
                    INSERT INTO ledger_entries (id, tenant_id, task_id, tx_reference, event_kind, logged_at)
                    VALUES (?, ?, ?, ?, ?, ?)
                """;

        try (Connection conn = db.getConnection()) {
            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                ps.setString(1, UUID.randomUUID().toString());
                ps.setString(2, tenantId);
                ps.setString(3, taskId);
                ps.setString(4, txReference);
                ps.setString(5, eventKind != null ? eventKind : LedgerEntry.TASK_COMPLETED);
                setTimestamp(ps, 6, clock.instant());

                ps.executeUpdate();
                conn.commit();

                log.info("Ledger entry stored for task {} (tx {})", taskId, txReference);
                return true;
            } catch (SQLException e) {
                conn.rollback();
                if (isUniqueViolation(e)) {
                    log.debug("Task {} already has a ledger entry", taskId);
                    return false;
                }
                throw e;
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to insert ledger entry for task: " + taskId, e);
        }
    }

    @Override
    public Optional<LedgerEntry> findByTaskId(String taskId) {
        String sql = "SELECT * FROM ledger_entries WHERE task_id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, taskId);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapRow(rs));
                }
            }
            return Optional.empty();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find ledger entry for task: " + taskId, e);
        }
    }

    @Override
    public List<LedgerEntry> findByTenant(String tenantId, int limit) {
        String sql = "SELECT * FROM ledger_entries WHERE tenant_id = ? ORDER BY logged_at DESC LIMIT ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, tenantId);
            ps.setInt(2, limit);

            List<LedgerEntry> results = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    results.add(mapRow(rs));
                }
            }
            return results;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list ledger entries for tenant: " + tenantId, e);
        }
    }

    @Override
    public int countAll() {
        String sql = "SELECT COUNT(*) FROM ledger_entries";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql);
                ResultSet rs = ps.executeQuery()) {

            return rs.next() ? rs.getInt(1) : 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to count ledger entries", e);
        }
    }

    @Override
    public Map<String, Integer> countByAssignee(String tenantId) {
        String sql = """
                    SELECT t.assignee_id, COUNT(*) AS cnt
                    FROM ledger_entries l
                    JOIN tasks t ON t.id = l.task_id AND t.tenant_id = l.tenant_id
                    WHERE l.tenant_id = ? AND t.assignee_id IS NOT NULL
                    GROUP BY t.assignee_id
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, tenantId);
            Map<String, Integer> counts = new HashMap<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    counts.put(rs.getString("assignee_id"), rs.getInt("cnt"));
                }
            }
            return counts;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to count ledger entries for tenant: " + tenantId, e);
        }
    }

    private LedgerEntry mapRow(ResultSet rs) throws SQLException {
        return new LedgerEntry(
                rs.getString("id"),
                rs.getString("tenant_id"),
                rs.getString("task_id"),
                rs.getString("tx_reference"),
                rs.getString("event_kind"),
                toInstant(rs.getTimestamp("logged_at")));
    }
}
