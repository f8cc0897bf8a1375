package workforce.backend.service;

import workforce.backend.model.Job;
import workforce.backend.model.JobStatus;
import workforce.backend.repository.JobStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Operational view of the job queue: counts, dead jobs and manual retry.
 */
public class JobAdminService {

    private static final Logger log = LoggerFactory.getLogger(JobAdminService.class);

    public static final int MAX_FAILED_LIMIT = 200;

    private final JobStore jobStore;
    private final Clock clock;

    public JobAdminService(JobStore jobStore, Clock clock) {
        this.jobStore = jobStore;
        this.clock = clock;
    }

    /**
     * Counts by queue, then status.
     */
    public Map<String, Map<JobStatus, Integer>> stats() {
        return jobStore.countByQueueAndStatus();
    }

    /**
     * Counts by status over all queues.
     */
    public Map<JobStatus, Integer> totals() {
        Map<JobStatus, Integer> totals = new EnumMap<>(JobStatus.class);
        for (JobStatus status : JobStatus.values()) {
            totals.put(status, 0);
        }
        stats().values().forEach(byStatus -> byStatus.forEach((status, count) -> totals.merge(status, count, Integer::sum)));
        return totals;
    }

    public List<Job> failed(String queue, int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive");
        }
        return jobStore.findFailed(queue, Math.min(limit, MAX_FAILED_LIMIT));
    }

    /**
     * Revive a FAILED job with a fresh attempt budget.
     *
     * @return false if the job exists but is not FAILED
     * @throws NotFoundException if there is no such job
     */
    public boolean retry(String jobId) {
        Job job = jobStore.findById(jobId)
                .orElseThrow(() -> new NotFoundException("Job not found: " + jobId));

        if (job.status() != JobStatus.FAILED) {
            log.debug("Retry of job {} ignored, status is {}", jobId, job.status());
            return false;
        }

        boolean revived = jobStore.retryFailed(jobId, clock.instant());
        if (revived) {
            log.info("Job {} on queue {} manually retried", jobId, job.queue());
        }
        return revived;
    }
}
