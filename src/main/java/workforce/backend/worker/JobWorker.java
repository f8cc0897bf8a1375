package workforce.backend.worker;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import workforce.backend.model.FailOutcome;
import workforce.backend.model.Job;
import workforce.backend.model.JobPayload;
import workforce.backend.repository.JobStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Polls one queue: claims a batch, runs each job on the handler executor
 * with a timeout, then completes or fails it.
 * Several workers may poll the same queue; the store's claim keeps them apart.
 */
public class JobWorker implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(JobWorker.class);

    private final String name;
    private final String queue;
    private final JobStore jobStore;
    private final HandlerRegistry registry;
    private final ObjectMapper mapper;
    private final ExecutorService handlerExecutor;
    private final int batchSize;
    private final Duration jobTimeout;
    private final Clock clock;

    public JobWorker(String name, String queue, JobStore jobStore, HandlerRegistry registry, ObjectMapper mapper,
            ExecutorService handlerExecutor, int batchSize, Duration jobTimeout, Clock clock) {
        this.name = name;
        this.queue = queue;
        this.jobStore = jobStore;
        this.registry = registry;
        this.mapper = mapper;
        this.handlerExecutor = handlerExecutor;
        this.batchSize = batchSize;
        this.jobTimeout = jobTimeout;
        this.clock = clock;
    }

    @Override
    public void run() {
        try {
            pollOnce();
        } catch (Exception e) {
            log.error("Worker {} poll error", name, e);
        }
    }

    /**
     * Claim and process one batch.
     *
     * @return number of jobs claimed
     */
    public int pollOnce() {
        List<Job> jobs = jobStore.claim(queue, batchSize, clock.instant());
        for (Job job : jobs) {
            if (Thread.currentThread().isInterrupted()) {
                // Remaining claims are recovered by the reaper once their lease expires
                log.info("Worker {} interrupted, {} claimed jobs left to the reaper", name, jobs.size());
                break;
            }
            // Claims of a batch start together; restart the clock for the job about to run
            if (!jobStore.renewClaim(job.id(), job.claimToken(), clock.instant())) {
                log.warn("Worker {} lost the claim on job {} before running it, skipped", name, job.id());
                continue;
            }
            process(job);
        }
        return jobs.size();
    }

    private void process(Job job) {
        try {
            execute(job);
            if (jobStore.complete(job.id(), job.claimToken())) {
                log.debug("Job {} on queue {} done (attempt {})", job.id(), queue, job.attempts());
            } else {
                log.warn("Job {} on queue {} finished after its claim was lost", job.id(), queue);
            }
        } catch (HandlerExecutionException e) {
            FailOutcome outcome = jobStore.fail(job.id(), job.claimToken(), e.getMessage(), clock.instant());
            if (outcome == FailOutcome.LEASE_LOST) {
                log.warn("Job {} on queue {} failed after its claim was lost: {}", job.id(), queue, e.getMessage());
            } else if (outcome == FailOutcome.FAILED) {
                log.error("Job {} on queue {} failed permanently after {} attempts: {}",
                        job.id(), queue, job.attempts(), e.getMessage(), e.getCause());
            } else {
                log.warn("Job {} on queue {} attempt {}/{} failed: {}",
                        job.id(), queue, job.attempts(), job.maxAttempts(), e.getMessage());
            }
        }
    }

    private void execute(Job job) throws HandlerExecutionException {
        JobHandler<?> handler = registry.find(job.queue())
                .orElseThrow(() -> new HandlerExecutionException("No handler registered for queue " + job.queue()));

        Future<Void> future = handlerExecutor.submit(bind(handler, job));

        try {
            future.get(jobTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new HandlerExecutionException("Handler timed out after " + jobTimeout.toMillis() + "ms", e);
        } catch (ExecutionException e) {
            throw new HandlerExecutionException(describe(e.getCause()), e.getCause());
        } catch (CancellationException e) {
            throw new HandlerExecutionException("Handler was cancelled", e);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new HandlerExecutionException("Worker interrupted while waiting for handler", e);
        }
    }

    /**
     * Decode the payload for the handler's type and return the call to make.
     */
    private <P extends JobPayload> Callable<Void> bind(JobHandler<P> handler, Job job)
            throws HandlerExecutionException {
        P payload;
        try {
            payload = mapper.readValue(job.payload(), handler.payloadType());
        } catch (JsonProcessingException e) {
            throw new HandlerExecutionException("Malformed payload: " + e.getOriginalMessage(), e);
        }
        return () -> {
            handler.handle(payload);
            return null;
        };
    }

    private static String describe(Throwable cause) {
        if (cause == null) {
            return "Handler failed";
        }
        String message = cause.getMessage();
        return cause.getClass().getSimpleName() + (message != null ? ": " + message : "");
    }
}
