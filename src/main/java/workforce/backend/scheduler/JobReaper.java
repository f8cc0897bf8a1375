package workforce.backend.scheduler;

import workforce.backend.model.Job;
import workforce.backend.repository.JobStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Background task that recovers jobs stuck in PROCESSING.
 *
 * Jobs can get stuck if:
 * - The process crashes while a handler is running
 * - A worker is stopped between claim and complete
 *
 * Updates are conditional on the claim still being older than the threshold,
 * so a job whose worker renewed its claim in the meantime is left alone.
 *
 * The reaper:
 * 1. Finds jobs claimed longer ago than the threshold
 * 2. For each stuck job:
 * - If attempts < maxAttempts: put it back to PENDING
 * - Otherwise: mark as FAILED
 */
public class JobReaper implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(JobReaper.class);

    private final JobStore jobStore;
    private final Duration stuckThreshold;
    private final Clock clock;

    public JobReaper(JobStore jobStore, Duration stuckThreshold, Clock clock) {
        this.jobStore = jobStore;
        this.stuckThreshold = stuckThreshold;
        this.clock = clock;
    }

    @Override
    public void run() {
        try {
            reapStuckJobs();
        } catch (Exception e) {
            log.error("Job reaper error", e);
        }
    }

    /**
     * Find and recover stuck PROCESSING jobs.
     *
     * @return number of jobs recovered
     */
    public int reapStuckJobs() {
        Instant now = clock.instant();
        Instant claimedBefore = now.minus(stuckThreshold);
        List<Job> stuck = jobStore.findStuckProcessing(claimedBefore);

        if (stuck.isEmpty()) {
            log.debug("No stuck jobs found");
            return 0;
        }

        int requeued = 0;
        int failed = 0;

        for (Job job : stuck) {
            try {
                if (job.canRetry()) {
                    if (jobStore.requeue(job.id(), claimedBefore, now)) {
                        requeued++;
                        log.info("Reaped job {} on queue {} for retry (attempt {} of {})",
                                job.id(), job.queue(), job.attempts(), job.maxAttempts());
                    }
                } else if (jobStore.markFailed(job.id(), claimedBefore,
                        "Job stuck in PROCESSING - max attempts exceeded (" + job.attempts() + "/"
                                + job.maxAttempts() + ")",
                        now)) {
                    failed++;
                    log.error("Job {} on queue {} permanently failed after {} attempts (stuck in PROCESSING)",
                            job.id(), job.queue(), job.attempts());
                }
            } catch (Exception e) {
                log.error("Failed to reap job {}", job.id(), e);
            }
        }

        log.info("Job reaper: {} requeued, {} failed, {} total stuck", requeued, failed, stuck.size());

        return requeued + failed;
    }
}
