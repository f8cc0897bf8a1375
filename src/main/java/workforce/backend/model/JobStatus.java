package workforce.backend.model;

/**
 * Queue row status. Successfully executed jobs are deleted, so there is no DONE.
 */
public enum JobStatus {
    /** Waiting until run_at, eligible for claim */
    PENDING,
    /** Claimed by a worker */
    PROCESSING,
    /** Retries exhausted, never claimed again */
    FAILED
}
