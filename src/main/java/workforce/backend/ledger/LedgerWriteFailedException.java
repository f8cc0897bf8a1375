package workforce.backend.ledger;

/**
 * Raised by the ledger job handler when an enabled ledger did not confirm a
 * write, so that the job is retried.
 */
public class LedgerWriteFailedException extends RuntimeException {

    public LedgerWriteFailedException(String message) {
        super(message);
    }
}
