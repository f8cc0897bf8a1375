package workforce.backend.scheduler;

import com.fasterxml.jackson.databind.ObjectMapper;
import workforce.backend.config.BackendConfig;
import workforce.backend.model.Queue;
import workforce.backend.repository.JobStore;
import workforce.backend.worker.HandlerRegistry;
import workforce.backend.worker.JobWorker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Coordinates background scheduled tasks:
 * - JobWorkers: poll each registered queue
 * - JobReaper: recovers jobs stuck in PROCESSING
 *
 * Worker loops run on a scheduled pool, one thread per worker.
 * Handlers run on a separate cached pool so a hung handler can be timed out.
 */
public class Scheduler implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Scheduler.class);

    private final ScheduledExecutorService executor;
    private final ExecutorService handlerExecutor;
    private final List<JobWorker> workers;
    private final JobReaper jobReaper;
    private final BackendConfig config;

    private volatile boolean running = false;

    /**
     * Create scheduler with workers for every queue that has a handler.
     *
     * @param jobStore store polled by the workers and the reaper
     * @param registry handlers by queue
     * @param mapper   payload decoder
     * @param config   configuration
     * @param clock    time source
     * @throws IllegalArgumentException if the stuck threshold does not exceed the job timeout
     */
    public Scheduler(JobStore jobStore, HandlerRegistry registry, ObjectMapper mapper, BackendConfig config,
            Clock clock) {
        // A handler still inside its timeout must never look stuck to the reaper
        if (config.jobStuckThreshold().compareTo(config.jobTimeout()) <= 0) {
            throw new IllegalArgumentException("Job stuck threshold " + config.jobStuckThreshold()
                    + " must exceed the job timeout " + config.jobTimeout());
        }

        int workerCount = registry.queues().size() * config.workersPerQueue();

        this.executor = Executors.newScheduledThreadPool(workerCount + 1, daemonThreads("workforce-scheduler"));
        this.handlerExecutor = Executors.newCachedThreadPool(daemonThreads("workforce-handler"));

        List<JobWorker> created = new ArrayList<>();
        for (Queue queue : registry.queues()) {
            for (int i = 0; i < config.workersPerQueue(); i++) {
                created.add(new JobWorker(
                        queue.queueName() + "-worker-" + i,
                        queue.queueName(),
                        jobStore,
                        registry,
                        mapper,
                        handlerExecutor,
                        config.claimBatchSize(),
                        config.jobTimeout(),
                        clock));
            }
        }
        this.workers = Collections.unmodifiableList(created);
        this.jobReaper = new JobReaper(jobStore, config.jobStuckThreshold(), clock);
        this.config = config;
    }

    /**
     * Start the scheduler.
     */
    public void start() {
        if (running) {
            log.warn("Scheduler already running");
            return;
        }

        running = true;

        long pollMs = config.pollInterval().toMillis();
        for (JobWorker worker : workers) {
            executor.scheduleWithFixedDelay(worker, 0, pollMs, TimeUnit.MILLISECONDS);
        }
        log.info("{} job workers polling every {}ms", workers.size(), pollMs);

        long reaperIntervalMs = config.jobReaperInterval().toMillis();
        executor.scheduleAtFixedRate(
                jobReaper,
                reaperIntervalMs, // initial delay
                reaperIntervalMs, // interval
                TimeUnit.MILLISECONDS);
        log.info("Job reaper scheduled every {}ms", reaperIntervalMs);

        log.info("Scheduler started");
    }

    /**
     * Stop the scheduler gracefully.
     */
    public void stop() {
        if (!running) {
            return;
        }

        running = false;
        executor.shutdown();
        handlerExecutor.shutdown();

        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
                log.warn("Scheduler forcefully stopped");
            } else {
                log.info("Scheduler stopped gracefully");
            }
            if (!handlerExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                handlerExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            handlerExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public void close() {
        stop();
    }

    /**
     * Check if scheduler is running.
     */
    public boolean isRunning() {
        return running;
    }

    public List<JobWorker> workers() {
        return workers;
    }

    /**
     * Get the job reaper for direct access (e.g., manual trigger).
     */
    public JobReaper jobReaper() {
        return jobReaper;
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
