package workforce.backend.store;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import workforce.backend.config.BackendConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Database connection pool and schema management.
 * Uses HikariCP for connection pooling.
 */
public final class Database implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Database.class);

    private final HikariDataSource dataSource;

    public Database(BackendConfig config) {
        this(config.databaseUrl(), config.databasePoolSize());
    }

    public Database(String jdbcUrl, int poolSize) {
        HikariConfig hikariConfig = new HikariConfig();
        hikariConfig.setJdbcUrl(jdbcUrl);
        hikariConfig.setMaximumPoolSize(poolSize);
        hikariConfig.setMinimumIdle(2);
        hikariConfig.setConnectionTimeout(5000);
        hikariConfig.setIdleTimeout(300000);
        hikariConfig.setPoolName("workforce-db-pool");
        hikariConfig.setAutoCommit(false);

        // H2 specific settings
        if (jdbcUrl.contains("h2:")) {
            hikariConfig.addDataSourceProperty("MODE", "PostgreSQL");
        }

        this.dataSource = new HikariDataSource(hikariConfig);

        log.info("Database pool initialized: {}", jdbcUrl);

        initSchema();
    }

    /**
     * Get a connection from the pool.
     * Caller is responsible for closing the connection.
     */
    public Connection getConnection() throws SQLException {
        return dataSource.getConnection();
    }

    public DataSource getDataSource() {
        return dataSource;
    }

    /**
     * Run several statements on one connection and commit once.
     * Any exception rolls the whole unit back and is rethrown; SQLExceptions are wrapped.
     *
     * @param operation what the unit does, used in the error message
     */
    public <T> T inTransaction(String operation, SqlWork<T> work) {
        try (Connection conn = getConnection()) {
            try {
                T result = work.run(conn);
                conn.commit();
                return result;
            } catch (SQLException | RuntimeException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to " + operation, e);
        }
    }

    /**
     * Unit of work executed by {@link #inTransaction}. Must not commit.
     */
    @FunctionalInterface
    public interface SqlWork<T> {
        T run(Connection conn) throws SQLException;
    }

    /**
     * Check if database is healthy.
     */
    public boolean isHealthy() {
        try (Connection conn = getConnection()) {
            return conn.isValid(2);
        } catch (SQLException e) {
            log.warn("Database health check failed: {}", e.getMessage());
            return false;
        }
    }

    private void initSchema() {
        try (Connection conn = getConnection();
                Statement st = conn.createStatement()) {

            // ---------- TASKS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS tasks (
                            id              VARCHAR(64) PRIMARY KEY,
                            tenant_id       VARCHAR(64) NOT NULL,
                            assignee_id     VARCHAR(64),
                            title           VARCHAR(512),
                            description     VARCHAR(4096),
                            status          VARCHAR(20) NOT NULL DEFAULT 'ASSIGNED',
                            priority        VARCHAR(10) NOT NULL DEFAULT 'MEDIUM',
                            complexity      INT NOT NULL DEFAULT 3,
                            required_skills VARCHAR(2048),
                            due_date        TIMESTAMP,
                            completed_at    TIMESTAMP,
                            active          BOOLEAN NOT NULL DEFAULT TRUE,
                            created_at      TIMESTAMP DEFAULT CURRENT_TIMESTAMP,
                            CONSTRAINT ck_tasks_complexity CHECK (complexity BETWEEN 1 AND 5),
                            CONSTRAINT ck_tasks_completed_at CHECK (
                                (status = 'COMPLETED' AND completed_at IS NOT NULL)
                                OR (status <> 'COMPLETED' AND completed_at IS NULL))
                        );
                    """);

            // ---------- JOBS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS jobs (
                            id              VARCHAR(64) PRIMARY KEY,
                            dedup_key       VARCHAR(255) NOT NULL,
                            queue           VARCHAR(100) NOT NULL,
                            payload         VARCHAR(8192) NOT NULL,
                            status          VARCHAR(20) NOT NULL DEFAULT 'PENDING',
                            attempts        INT NOT NULL DEFAULT 0,
                            max_attempts    INT NOT NULL DEFAULT 3,
                            run_at          TIMESTAMP NOT NULL DEFAULT CURRENT_TIMESTAMP,
                            claimed_at      TIMESTAMP,
                            claim_token     VARCHAR(64),
                            failed_at       TIMESTAMP,
                            error_msg       VARCHAR(2048),
                            created_at      TIMESTAMP NOT NULL DEFAULT CURRENT_TIMESTAMP,
                            CONSTRAINT uq_jobs_dedup_key UNIQUE (dedup_key)
                        );
                    """);

            // ---------- PERFORMANCE LOGS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS performance_logs (
                            id              VARCHAR(64) PRIMARY KEY,
                            tenant_id       VARCHAR(64) NOT NULL,
                            employee_id     VARCHAR(64) NOT NULL,
                            score           DOUBLE PRECISION,
                            completion_rate DOUBLE PRECISION,
                            on_time_rate    DOUBLE PRECISION,
                            avg_complexity  DOUBLE PRECISION,
                            created_at      TIMESTAMP NOT NULL DEFAULT CURRENT_TIMESTAMP
                        );
                    """);

            // ---------- LEDGER ENTRIES ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS ledger_entries (
                            id              VARCHAR(64) PRIMARY KEY,
                            tenant_id       VARCHAR(64) NOT NULL,
                            task_id         VARCHAR(64) NOT NULL,
                            tx_reference    VARCHAR(128) NOT NULL,
                            event_kind      VARCHAR(40) NOT NULL DEFAULT 'TASK_COMPLETED',
                            logged_at       TIMESTAMP NOT NULL DEFAULT CURRENT_TIMESTAMP,
                            CONSTRAINT uq_ledger_entries_task UNIQUE (task_id)
                        );
                    """);

            // ---------- EMPLOYEES ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS employees (
                            id              VARCHAR(64) NOT NULL,
                            tenant_id       VARCHAR(64) NOT NULL,
                            name            VARCHAR(255),
                            job_title       VARCHAR(255),
                            department      VARCHAR(255),
                            skills          VARCHAR(2048),
                            active          BOOLEAN NOT NULL DEFAULT TRUE,
                            created_at      TIMESTAMP NOT NULL DEFAULT CURRENT_TIMESTAMP,
                            CONSTRAINT pk_employees PRIMARY KEY (tenant_id, id)
                        );
                    """);

            // Indexes
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_tasks_tenant_status ON tasks(tenant_id, status);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_tasks_tenant_assignee ON tasks(tenant_id, assignee_id);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_jobs_poll ON jobs(status, run_at);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_jobs_queue_status ON jobs(queue, status);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_perf_logs_employee "
                    + "ON performance_logs(tenant_id, employee_id, created_at);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_ledger_entries_tenant ON ledger_entries(tenant_id, logged_at);");

            st.executeBatch();
            conn.commit();

            log.info("Database schema initialized");
        } catch (SQLException e) {
            throw new RuntimeException("Failed to initialize database schema", e);
        }
    }

    @Override
    public void close() {
        if (dataSource != null && !dataSource.isClosed()) {
            dataSource.close();
            log.info("Database pool closed");
        }
    }
}
