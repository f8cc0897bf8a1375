package workforce.backend.repository;

import workforce.backend.model.FailOutcome;
import workforce.backend.model.Job;
import workforce.backend.model.JobStatus;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Durable queue of outstanding work.
 * All coordination between workers goes through {@link #claim}.
 */
public interface JobStore {

    /**
     * Insert a job unless a row with the same dedup key exists.
     *
     * @param queue       queue name
     * @param dedupKey    unique key of the logical unit of work
     * @param payload     JSON payload
     * @param maxAttempts retry bound
     * @return true if a new row was created, false if the key already existed
     */
    boolean enqueue(String queue, String dedupKey, String payload, int maxAttempts);

    /**
     * Same as {@link #enqueue(String, String, String, int)} but on the caller's transaction.
     * Does not commit; a duplicate key leaves the transaction usable.
     */
    boolean enqueue(Connection conn, String queue, String dedupKey, String payload, int maxAttempts)
            throws SQLException;

    /**
     * Atomically claim up to batchSize PENDING jobs whose run_at is not after now,
     * oldest run_at first. Claimed rows move to PROCESSING, their attempts are incremented
     * and each gets a fresh claim token.
     * Rows locked by a concurrent claimant are skipped, not waited for.
     *
     * @param queue     queue name
     * @param batchSize maximum jobs to claim
     * @param now       claim time
     * @return claimed jobs in run_at order
     */
    List<Job> claim(String queue, int batchSize, Instant now);

    /**
     * Restart the claim clock of a job the caller still holds, right before running it.
     *
     * @return false if the claim was lost to the reaper or another claimant
     */
    boolean renewClaim(String jobId, String claimToken, Instant now);

    /**
     * Delete a successfully executed job, only while the caller's claim is current.
     *
     * @param jobId      the job ID
     * @param claimToken token handed out by {@link #claim}
     * @return true if a row was deleted
     */
    boolean complete(String jobId, String claimToken);

    /**
     * Record a failed attempt. Reschedules with backoff while attempts remain,
     * otherwise marks the job FAILED for good. A stale claim leaves the row unchanged.
     *
     * @param jobId        the job ID
     * @param claimToken   token handed out by {@link #claim}
     * @param errorMessage handler error message
     * @param now          failure time
     * @return what happened to the row
     */
    FailOutcome fail(String jobId, String claimToken, String errorMessage, Instant now);

    /**
     * Find jobs that have been PROCESSING since before the given time.
     * Used by the reaper to recover jobs of crashed workers.
     *
     * @param claimedBefore jobs claimed before this timestamp are considered stuck
     * @return stuck jobs, oldest claim first
     */
    List<Job> findStuckProcessing(Instant claimedBefore);

    /**
     * Put a PROCESSING job back to PENDING, eligible at now.
     * Only applies while the job is still claimed since before claimedBefore.
     *
     * @return true if the row was stuck and got reset
     */
    boolean requeue(String jobId, Instant claimedBefore, Instant now);

    /**
     * Mark a PROCESSING job as permanently failed.
     * Only applies while the job is still claimed since before claimedBefore.
     *
     * @return true if updated
     */
    boolean markFailed(String jobId, Instant claimedBefore, String errorMessage, Instant now);

    /**
     * Move a FAILED job back to PENDING with a fresh attempt budget.
     *
     * @return true if the row was FAILED and got revived
     */
    boolean retryFailed(String jobId, Instant now);

    /**
     * Delete a job that has not been claimed yet.
     *
     * @return true if a PENDING row was deleted
     */
    boolean cancel(String jobId);

    Optional<Job> findById(String jobId);

    Optional<Job> findByDedupKey(String dedupKey);

    /**
     * Dead jobs for operational visibility.
     *
     * @param queue queue filter, null for all queues
     * @param limit maximum results
     */
    List<Job> findFailed(String queue, int limit);

    /**
     * Row counts grouped by queue, then status.
     */
    Map<String, Map<JobStatus, Integer>> countByQueueAndStatus();
}
