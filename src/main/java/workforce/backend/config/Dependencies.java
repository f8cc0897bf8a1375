package workforce.backend.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import workforce.backend.api.internal.v1.JobAdminController;
import workforce.backend.api.v1.DashboardController;
import workforce.backend.api.v1.EmployeeController;
import workforce.backend.api.v1.HealthController;
import workforce.backend.api.v1.LedgerController;
import workforce.backend.api.v1.TaskController;
import workforce.backend.ledger.LedgerClient;
import workforce.backend.narrative.GeminiNarrativeClient;
import workforce.backend.narrative.NarrativeClient;
import workforce.backend.repository.EmployeeRepository;
import workforce.backend.repository.JobStore;
import workforce.backend.repository.LedgerEntryRepository;
import workforce.backend.repository.PerformanceLogRepository;
import workforce.backend.repository.TaskRepository;
import workforce.backend.scheduler.Scheduler;
import workforce.backend.server.RouterHandler;
import workforce.backend.service.DashboardService;
import workforce.backend.service.EmployeeService;
import workforce.backend.service.JobAdminService;
import workforce.backend.service.JobDispatcher;
import workforce.backend.service.LedgerService;
import workforce.backend.service.ScoreService;
import workforce.backend.service.SkillService;
import workforce.backend.service.TaskLifecycle;
import workforce.backend.service.TaskService;
import workforce.backend.store.Backoff;
import workforce.backend.store.Database;
import workforce.backend.store.JdbcEmployeeRepository;
import workforce.backend.store.JdbcJobStore;
import workforce.backend.store.JdbcLedgerEntryRepository;
import workforce.backend.store.JdbcPerformanceLogRepository;
import workforce.backend.store.JdbcTaskRepository;
import workforce.backend.worker.HandlerRegistry;
import workforce.backend.worker.LedgerJobHandler;
import workforce.backend.worker.ScoringJobHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;

/**
 * Manual dependency injection container.
 * Creates and wires all service dependencies.
 *
 * Usage:
 *
 * <pre>
 * Dependencies deps = Dependencies.create(BackendConfig.load());
 * deps.startScheduler(); // start workers and the reaper
 * TaskService taskService = deps.taskService();
 * // ... use services ...
 * deps.close(); // cleanup
 * </pre>
 */
public final class Dependencies implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Dependencies.class);

    private final BackendConfig config;
    private final Clock clock;
    private final ObjectMapper queueMapper;
    private final Database database;
    private final TaskRepository taskRepository;
    private final PerformanceLogRepository performanceLogRepository;
    private final LedgerEntryRepository ledgerEntryRepository;
    private final EmployeeRepository employeeRepository;
    private final JobStore jobStore;

    // Collaborators
    private final LedgerClient ledgerClient;
    private final NarrativeClient narrativeClient;

    // Services
    private final TaskService taskService;
    private final JobDispatcher jobDispatcher;
    private final ScoreService scoreService;
    private final LedgerService ledgerService;
    private final JobAdminService jobAdminService;
    private final EmployeeService employeeService;
    private final SkillService skillService;
    private final DashboardService dashboardService;
    private final HandlerRegistry handlerRegistry;

    // Controllers
    private final HealthController healthController;
    private final TaskController taskController;
    private final EmployeeController employeeController;
    private final LedgerController ledgerController;
    private final DashboardController dashboardController;
    private final JobAdminController jobAdminController;

    // Router (lazy-initialized)
    private RouterHandler routerHandler;

    // Scheduler (lazy-initialized)
    private Scheduler scheduler;

    private Dependencies(BackendConfig config, LedgerClient ledgerClient, NarrativeClient narrativeClient,
            Clock clock) {
        this.config = config;
        this.clock = clock;
        this.queueMapper = new ObjectMapper().findAndRegisterModules();

        log.info("Initializing dependencies with config: {}", config);

        // Infrastructure
        this.database = new Database(config);

        // Repositories
        this.taskRepository = new JdbcTaskRepository(database, queueMapper);
        this.performanceLogRepository = new JdbcPerformanceLogRepository(database, clock);
        this.ledgerEntryRepository = new JdbcLedgerEntryRepository(database, clock);
        this.employeeRepository = new JdbcEmployeeRepository(database, queueMapper, clock);
        this.jobStore = new JdbcJobStore(database, new Backoff(config.jobBackoffBase(), config.jobBackoffCap()),
                clock);

        // Collaborators
        this.ledgerClient = ledgerClient;
        this.narrativeClient = narrativeClient;

        // Services
        this.jobDispatcher = new JobDispatcher(jobStore, queueMapper, config.jobMaxAttempts());
        this.taskService = new TaskService(taskRepository, new TaskLifecycle(taskRepository, clock), jobDispatcher,
                database, clock);
        this.scoreService = new ScoreService(taskRepository, performanceLogRepository, narrativeClient, clock);
        this.ledgerService = new LedgerService(ledgerClient, ledgerEntryRepository);
        this.jobAdminService = new JobAdminService(jobStore, clock);
        this.employeeService = new EmployeeService(employeeRepository);
        this.skillService = new SkillService(employeeRepository, taskRepository, performanceLogRepository);
        this.dashboardService = new DashboardService(employeeRepository, taskRepository, performanceLogRepository,
                ledgerEntryRepository, clock);

        // Job handlers
        this.handlerRegistry = new HandlerRegistry()
                .register(new ScoringJobHandler(scoreService))
                .register(new LedgerJobHandler(ledgerClient, ledgerEntryRepository));

        // Controllers (public API)
        this.healthController = new HealthController(database, jobAdminService, ledgerClient);
        this.taskController = new TaskController(taskService, skillService);
        this.employeeController = new EmployeeController(scoreService, employeeService, skillService);
        this.ledgerController = new LedgerController(ledgerService);
        this.dashboardController = new DashboardController(dashboardService);

        // Controllers (internal API)
        this.jobAdminController = new JobAdminController(jobAdminService);

        log.info("Dependencies initialized successfully");
    }

    /**
     * Create dependencies with the given config.
     * Ledger and narrative clients are built from the config.
     */
    public static Dependencies create(BackendConfig config) {
        return create(
                config,
                LedgerClient.create(config.ledgerSettings()),
                new GeminiNarrativeClient(config.narrativeApiKey(), config.narrativeModel(),
                        config.narrativeTimeout(), new ObjectMapper()));
    }

    /**
     * Create dependencies with explicit external collaborators (tests use fakes here).
     */
    public static Dependencies create(BackendConfig config, LedgerClient ledgerClient,
            NarrativeClient narrativeClient) {
        return new Dependencies(config, ledgerClient, narrativeClient, Clock.systemUTC());
    }

    /**
     * Create dependencies with config loaded from INI file and environment.
     */
    public static Dependencies create() {
        return create(BackendConfig.load());
    }

    // Getters
    public BackendConfig config() {
        return config;
    }

    public Database database() {
        return database;
    }

    public TaskRepository taskRepository() {
        return taskRepository;
    }

    public PerformanceLogRepository performanceLogRepository() {
        return performanceLogRepository;
    }

    public LedgerEntryRepository ledgerEntryRepository() {
        return ledgerEntryRepository;
    }

    public EmployeeRepository employeeRepository() {
        return employeeRepository;
    }

    public JobStore jobStore() {
        return jobStore;
    }

    public LedgerClient ledgerClient() {
        return ledgerClient;
    }

    public TaskService taskService() {
        return taskService;
    }

    public JobDispatcher jobDispatcher() {
        return jobDispatcher;
    }

    public ScoreService scoreService() {
        return scoreService;
    }

    public LedgerService ledgerService() {
        return ledgerService;
    }

    public JobAdminService jobAdminService() {
        return jobAdminService;
    }

    public SkillService skillService() {
        return skillService;
    }

    public DashboardService dashboardService() {
        return dashboardService;
    }

    public HandlerRegistry handlerRegistry() {
        return handlerRegistry;
    }

    /**
     * Get a fully configured RouterHandler with all controllers registered.
     * This is the main entry point for serving HTTP requests.
     */
    public RouterHandler routerHandler() {
        if (routerHandler == null) {
            routerHandler = new RouterHandler(config)
                    .registerController(healthController)
                    .registerController(taskController)
                    .registerController(employeeController)
                    .registerController(ledgerController)
                    .registerController(dashboardController)
                    .registerController(jobAdminController);
            log.info("RouterHandler created with {} controllers", 6);
        }
        return routerHandler;
    }

    /**
     * Get the scheduler (creates it if not yet created).
     */
    public Scheduler scheduler() {
        if (scheduler == null) {
            scheduler = new Scheduler(jobStore, handlerRegistry, queueMapper, config, clock);
        }
        return scheduler;
    }

    /**
     * Start the queue workers and the stuck-job reaper.
     * Should be called after server startup.
     */
    public void startScheduler() {
        scheduler().start();
    }

    /**
     * Stop the background scheduler.
     */
    public void stopScheduler() {
        if (scheduler != null) {
            scheduler.stop();
        }
    }

    @Override
    public void close() {
        log.info("Closing dependencies...");

        // Stop scheduler first so no handler touches a closed pool
        if (scheduler != null) {
            try {
                scheduler.close();
            } catch (Exception e) {
                log.warn("Error stopping scheduler: {}", e.getMessage());
            }
        }

        try {
            ledgerClient.close();
        } catch (Exception e) {
            log.warn("Error closing ledger client: {}", e.getMessage());
        }

        // Close database
        try {
            database.close();
        } catch (Exception e) {
            log.warn("Error closing database: {}", e.getMessage());
        }

        log.info("Dependencies closed");
    }
}
