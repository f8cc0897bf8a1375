package workforce.backend.model;

/**
 * Result of reporting a job failure to the store.
 */
public enum FailOutcome {
    /** Put back to PENDING with a later run_at */
    RESCHEDULED,

    /** Attempts exhausted, row is now FAILED */
    FAILED,

    /** Row no longer exists */
    NOT_FOUND,

    /** Row was reclaimed or resolved by someone else, left unchanged */
    LEASE_LOST
}
