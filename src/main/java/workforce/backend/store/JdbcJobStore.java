package workforce.backend.store;

import workforce.backend.model.FailOutcome;
import workforce.backend.model.Job;
import workforce.backend.model.JobStatus;
import workforce.backend.repository.JobStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Savepoint;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.UUID;

import static workforce.backend.store.JdbcValues.isUniqueViolation;
import static workforce.backend.store.JdbcValues.setTimestamp;
import static workforce.backend.store.JdbcValues.toInstant;
import static workforce.backend.store.JdbcValues.truncate;

/**
 * JDBC implementation of JobStore.
 * Claims with SELECT ... FOR UPDATE SKIP LOCKED so concurrent workers never block on,
 * or double-claim, the same row.
 */
public class JdbcJobStore implements JobStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcJobStore.class);

    private static final int MAX_ERROR_LENGTH = 2048;

    private final Database db;
    private final Backoff backoff;
    private final Clock clock;

    public JdbcJobStore(Database db, Backoff backoff) {
        this(db, backoff, Clock.systemUTC());
    }

    public JdbcJobStore(Database db, Backoff backoff, Clock clock) {
        this.db = db;
        this.backoff = backoff;
        this.clock = clock;
    }

    @Override
    public boolean enqueue(String queue, String dedupKey, String payload, int maxAttempts) {
        return db.inTransaction("enqueue job: " + dedupKey,
                conn -> enqueue(conn, queue, dedupKey, payload, maxAttempts));
    }

    @Override
    public boolean enqueue(Connection conn, String queue, String dedupKey, String payload, int maxAttempts)
            throws SQLException {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be positive");
        }

        String sql = """
                    INSERT INTO jobs (id, dedup_key, queue, payload, status, attempts, max_attempts, run_at, created_at)
                    VALUES (?, ?, ?, ?, 'PENDING', 0, ?, ?, ?)
                """;

        // A unique violation must not abort the caller's transaction
        Savepoint savepoint = conn.setSavepoint();
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            Instant now = clock.instant();

            ps.setString(1, UUID.randomUUID().toString());
            ps.setString(2, dedupKey);
            ps.setString(3, queue);
            ps.setString(4, payload);
            ps.setInt(5, maxAttempts);
            setTimestamp(ps, 6, now);
            setTimestamp(ps, 7, now);

            ps.executeUpdate();
            conn.releaseSavepoint(savepoint);

            log.info("Enqueued key={} queue={}", dedupKey, queue);
            return true;
        } catch (SQLException e) {
            if (isUniqueViolation(e)) {
                conn.rollback(savepoint);
                log.debug("Job with key={} already exists, enqueue skipped", dedupKey);
                return false;
            }
            throw e;
        }
    }

    @Override
    public List<Job> claim(String queue, int batchSize, Instant now) {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive");
        }

        // Lock only the rows we read, skip rows another claimant holds
        String selectSql = """
                    SELECT * FROM jobs
                    WHERE queue = ? AND status = 'PENDING' AND run_at <= ?
                    ORDER BY run_at
                    LIMIT ?
                    FOR UPDATE SKIP LOCKED
                """;

        String updateSql = """
                    UPDATE jobs
                    SET status = 'PROCESSING', attempts = attempts + 1, claimed_at = ?, claim_token = ?
                    WHERE id = ? AND status = 'PENDING'
                """;

        List<Job> claimed = new ArrayList<>();

        try (Connection conn = db.getConnection()) {
            try (PreparedStatement selectPs = conn.prepareStatement(selectSql);
                    PreparedStatement updatePs = conn.prepareStatement(updateSql)) {

                selectPs.setString(1, queue);
                setTimestamp(selectPs, 2, now);
                selectPs.setInt(3, batchSize);

                List<Job> candidates = new ArrayList<>();
                try (ResultSet rs = selectPs.executeQuery()) {
                    while (rs.next()) {
                        candidates.add(mapRow(rs));
                    }
                }

                for (Job job : candidates) {
                    String token = UUID.randomUUID().toString();
                    setTimestamp(updatePs, 1, now);
                    updatePs.setString(2, token);
                    updatePs.setString(3, job.id());

                    // Zero rows means the status changed under us; not ours
                    if (updatePs.executeUpdate() == 1) {
                        claimed.add(Job.builder()
                                .id(job.id())
                                .dedupKey(job.dedupKey())
                                .queue(job.queue())
                                .payload(job.payload())
                                .status(JobStatus.PROCESSING)
                                .attempts(job.attempts() + 1)
                                .maxAttempts(job.maxAttempts())
                                .runAt(job.runAt())
                                .claimedAt(now)
                                .claimToken(token)
                                .errorMessage(job.errorMessage())
                                .createdAt(job.createdAt())
                                .build());
                    }
                }

                conn.commit();

                if (!claimed.isEmpty()) {
                    log.debug("Claimed {} jobs from queue {}", claimed.size(), queue);
                }

                return claimed;
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to claim jobs from queue: " + queue, e);
        }
    }

    @Override
    public boolean renewClaim(String jobId, String claimToken, Instant now) {
        String sql = """
                    UPDATE jobs
                    SET claimed_at = ?
                    WHERE id = ? AND status = 'PROCESSING' AND claim_token = ?
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            setTimestamp(ps, 1, now);
            ps.setString(2, jobId);
            ps.setString(3, claimToken);
            int updated = ps.executeUpdate();
            conn.commit();

            if (updated == 0) {
                log.debug("Job {} claim is no longer held by this claimant", jobId);
            }

            return updated > 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to renew claim of job: " + jobId, e);
        }
    }

    @Override
    public boolean complete(String jobId, String claimToken) {
        String sql = "DELETE FROM jobs WHERE id = ? AND status = 'PROCESSING' AND claim_token = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, jobId);
            ps.setString(2, claimToken);
            int deleted = ps.executeUpdate();
            conn.commit();

            if (deleted == 0) {
                log.debug("Job {} already gone or reclaimed on complete", jobId);
            }

            return deleted > 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to complete job: " + jobId, e);
        }
    }

    @Override
    public FailOutcome fail(String jobId, String claimToken, String errorMessage, Instant now) {
        String selectSql = "SELECT status, attempts, max_attempts, claim_token FROM jobs WHERE id = ? FOR UPDATE";

        String rescheduleSql = """
                    UPDATE jobs
                    SET status = 'PENDING', run_at = ?, claimed_at = NULL, claim_token = NULL, error_msg = ?
                    WHERE id = ?
                """;

        String failSql = """
                    UPDATE jobs
                    SET status = 'FAILED', failed_at = ?, claimed_at = NULL, claim_token = NULL, error_msg = ?
                    WHERE id = ?
                """;

        String error = truncate(errorMessage, MAX_ERROR_LENGTH);

        try (Connection conn = db.getConnection()) {
            try {
                JobStatus status;
                int attempts;
                int maxAttempts;
                String currentToken;

                try (PreparedStatement ps = conn.prepareStatement(selectSql)) {
                    ps.setString(1, jobId);
                    try (ResultSet rs = ps.executeQuery()) {
                        if (!rs.next()) {
                            conn.rollback();
                            log.debug("Job {} not found on fail", jobId);
                            return FailOutcome.NOT_FOUND;
                        }
                        status = JobStatus.valueOf(rs.getString("status"));
                        attempts = rs.getInt("attempts");
                        maxAttempts = rs.getInt("max_attempts");
                        currentToken = rs.getString("claim_token");
                    }
                }

                // Requeued by the reaper, reclaimed or resolved by someone else
                if (status != JobStatus.PROCESSING || !Objects.equals(currentToken, claimToken)) {
                    conn.rollback();
                    log.warn("Job {} is {} under another claim on fail, leaving it unchanged", jobId, status);
                    return FailOutcome.LEASE_LOST;
                }

                if (attempts < maxAttempts) {
                    Instant runAt = now.plus(backoff.delay(attempts));
                    try (PreparedStatement ps = conn.prepareStatement(rescheduleSql)) {
                        setTimestamp(ps, 1, runAt);
                        ps.setString(2, error);
                        ps.setString(3, jobId);
                        ps.executeUpdate();
                    }
                    conn.commit();
                    log.warn("Job {} failed (attempt {}/{}), retry at {}: {}",
                            jobId, attempts, maxAttempts, runAt, error);
                    return FailOutcome.RESCHEDULED;
                }

                try (PreparedStatement ps = conn.prepareStatement(failSql)) {
                    setTimestamp(ps, 1, now);
                    ps.setString(2, error);
                    ps.setString(3, jobId);
                    ps.executeUpdate();
                }
                conn.commit();
                log.error("Job {} permanently FAILED after {}/{} attempts: {}",
                        jobId, attempts, maxAttempts, error);
                return FailOutcome.FAILED;
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to record failure of job: " + jobId, e);
        }
    }

    @Override
    public List<Job> findStuckProcessing(Instant claimedBefore) {
        String sql = """
                    SELECT * FROM jobs
                    WHERE status = 'PROCESSING' AND claimed_at < ?
                    ORDER BY claimed_at
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            setTimestamp(ps, 1, claimedBefore);
            List<Job> jobs = executeQuery(ps);
            conn.commit();
            return jobs;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find stuck jobs", e);
        }
    }

    @Override
    public boolean requeue(String jobId, Instant claimedBefore, Instant now) {
        String sql = """
                    UPDATE jobs
                    SET status = 'PENDING', run_at = ?, claimed_at = NULL, claim_token = NULL
                    WHERE id = ? AND status = 'PROCESSING' AND claimed_at < ?
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            setTimestamp(ps, 1, now);
            ps.setString(2, jobId);
            setTimestamp(ps, 3, claimedBefore);
            int updated = ps.executeUpdate();
            conn.commit();

            if (updated > 0) {
                log.debug("Job {} requeued", jobId);
            }

            return updated > 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to requeue job: " + jobId, e);
        }
    }

    @Override
    public boolean markFailed(String jobId, Instant claimedBefore, String errorMessage, Instant now) {
        String sql = """
                    UPDATE jobs
                    SET status = 'FAILED', failed_at = ?, claimed_at = NULL, claim_token = NULL, error_msg = ?
                    WHERE id = ? AND status = 'PROCESSING' AND claimed_at < ?
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            setTimestamp(ps, 1, now);
            ps.setString(2, truncate(errorMessage, MAX_ERROR_LENGTH));
            ps.setString(3, jobId);
            setTimestamp(ps, 4, claimedBefore);

            int updated = ps.executeUpdate();
            conn.commit();

            if (updated > 0) {
                log.debug("Job {} marked as FAILED: {}", jobId, errorMessage);
            }

            return updated > 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to mark job as failed: " + jobId, e);
        }
    }

    @Override
    public boolean retryFailed(String jobId, Instant now) {
        String sql = """
                    UPDATE jobs
                    SET status = 'PENDING', attempts = 0, run_at = ?, failed_at = NULL, error_msg = NULL
                    WHERE id = ? AND status = 'FAILED'
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            setTimestamp(ps, 1, now);
            ps.setString(2, jobId);
            int updated = ps.executeUpdate();
            conn.commit();

            if (updated > 0) {
                log.info("Failed job {} revived for another round of attempts", jobId);
            }

            return updated > 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to retry job: " + jobId, e);
        }
    }

    @Override
    public boolean cancel(String jobId) {
        String sql = "DELETE FROM jobs WHERE id = ? AND status = 'PENDING'";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, jobId);
            int deleted = ps.executeUpdate();
            conn.commit();
            return deleted > 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to cancel job: " + jobId, e);
        }
    }

    @Override
    public Optional<Job> findById(String jobId) {
        return findOne("SELECT * FROM jobs WHERE id = ?", jobId);
    }

    @Override
    public Optional<Job> findByDedupKey(String dedupKey) {
        return findOne("SELECT * FROM jobs WHERE dedup_key = ?", dedupKey);
    }

    @Override
    public List<Job> findFailed(String queue, int limit) {
        String sql = queue == null
                ? "SELECT * FROM jobs WHERE status = 'FAILED' ORDER BY failed_at DESC LIMIT ?"
                : "SELECT * FROM jobs WHERE status = 'FAILED' AND queue = ? ORDER BY failed_at DESC LIMIT ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            int idx = 1;
            if (queue != null) {
                ps.setString(idx++, queue);
            }
            ps.setInt(idx, limit);
            List<Job> jobs = executeQuery(ps);
            conn.commit();
            return jobs;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find failed jobs", e);
        }
    }

    @Override
    public Map<String, Map<JobStatus, Integer>> countByQueueAndStatus() {
        String sql = "SELECT queue, status, COUNT(*) AS cnt FROM jobs GROUP BY queue, status";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            Map<String, Map<JobStatus, Integer>> counts = new TreeMap<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    counts.computeIfAbsent(rs.getString("queue"), q -> emptyCounts())
                            .put(JobStatus.valueOf(rs.getString("status")), rs.getInt("cnt"));
                }
            }
            conn.commit();
            return counts;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to count jobs", e);
        }
    }

    // Helper methods

    private static Map<JobStatus, Integer> emptyCounts() {
        Map<JobStatus, Integer> counts = new LinkedHashMap<>();
        for (JobStatus status : JobStatus.values()) {
            counts.put(status, 0);
        }
        return counts;
    }

    private Optional<Job> findOne(String sql, String param) {
        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, param);
            try (ResultSet rs = ps.executeQuery()) {
                Optional<Job> job = rs.next() ? Optional.of(mapRow(rs)) : Optional.empty();
                conn.commit();
                return job;
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find job: " + param, e);
        }
    }

    private List<Job> executeQuery(PreparedStatement ps) throws SQLException {
        List<Job> results = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                results.add(mapRow(rs));
            }
        }
        return results;
    }

    private Job mapRow(ResultSet rs) throws SQLException {
        return Job.builder()
                .id(rs.getString("id"))
                .dedupKey(rs.getString("dedup_key"))
                .queue(rs.getString("queue"))
                .payload(rs.getString("payload"))
                .status(JobStatus.valueOf(rs.getString("status")))
                .attempts(rs.getInt("attempts"))
                .maxAttempts(rs.getInt("max_attempts"))
                .runAt(toInstant(rs.getTimestamp("run_at")))
                .claimedAt(toInstant(rs.getTimestamp("claimed_at")))
                .claimToken(rs.getString("claim_token"))
                .failedAt(toInstant(rs.getTimestamp("failed_at")))
                .errorMessage(rs.getString("error_msg"))
                .createdAt(toInstant(rs.getTimestamp("created_at")))
                .build();
    }
}
