package workforce.backend.model;

/**
 * Which background jobs were newly enqueued by a dispatch.
 * False means either not applicable or absorbed by deduplication.
 */
public record DispatchResult(boolean scoringEnqueued, boolean ledgerEnqueued) {

    public static DispatchResult none() {
        return new DispatchResult(false, false);
    }
}
