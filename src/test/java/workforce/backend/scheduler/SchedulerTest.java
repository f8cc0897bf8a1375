package workforce.backend.scheduler;

import com.fasterxml.jackson.databind.ObjectMapper;
import workforce.backend.MutableClock;
import workforce.backend.config.BackendConfig;
import workforce.backend.store.Backoff;
import workforce.backend.store.Database;
import workforce.backend.store.JdbcJobStore;
import workforce.backend.worker.HandlerRegistry;
import org.junit.jupiter.api.*;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class SchedulerTest {

    private static Database db;
    private static JdbcJobStore store;
    private static final MutableClock clock = MutableClock.startingAt("2024-05-01T10:00:00Z");

    @BeforeAll
    static void setup() {
        db = new Database("jdbc:h2:mem:test-scheduler-" + System.nanoTime()
                + ";DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE", 2);
        store = new JdbcJobStore(db, new Backoff(Duration.ofSeconds(5), Duration.ofMinutes(10)), clock);
    }

    @AfterAll
    static void teardown() {
        if (db != null)
            db.close();
    }

    @Test
    void stuckThresholdMustExceedJobTimeout() {
        BackendConfig config = BackendConfig.defaults()
                .withJobTimeout(Duration.ofMinutes(5))
                .withJobStuckThreshold(Duration.ofMinutes(5));

        assertThrows(IllegalArgumentException.class,
                () -> new Scheduler(store, new HandlerRegistry(), new ObjectMapper(), config, clock));
    }

    @Test
    void defaultsAreAccepted() {
        try (Scheduler scheduler = new Scheduler(store, new HandlerRegistry(), new ObjectMapper(),
                BackendConfig.defaults(), clock)) {
            assertNotNull(scheduler);
        }
    }
}
