package workforce.backend.ledger;

/**
 * Failure of a single contract call or transaction. Carries the node's
 * revert data when the call was rejected by the contract.
 */
public class LedgerCallException extends Exception {

    private final String revertData;

    public LedgerCallException(String message) {
        this(message, null, null);
    }

    public LedgerCallException(String message, Throwable cause) {
        this(message, null, cause);
    }

    public LedgerCallException(String message, String revertData, Throwable cause) {
        super(message, cause);
        this.revertData = revertData;
    }

    /** Hex-encoded revert payload, or null */
    public String revertData() {
        return revertData;
    }
}
