package workforce.backend.ledger;

import java.math.BigInteger;
import java.util.Optional;

/**
 * Completion ledger handle, built once at startup.
 * No operation throws: failures are logged and reported as empty results.
 */
public interface LedgerClient extends AutoCloseable {

    /**
     * Record the completion of a task on the ledger and wait for one confirmation.
     *
     * @return transaction hash, empty when disabled or on any failure
     */
    Optional<String> recordCompletion(String taskId);

    /**
     * Register the signing wallet as a tenant of the contract.
     *
     * @return transaction hash, empty when disabled, already registered or on failure
     */
    Optional<String> registerTenant();

    /**
     * @return false when disabled or on any error
     */
    boolean isRegistered(String address);

    /**
     * Total completions ever recorded on the contract, empty when disabled or on error.
     */
    Optional<BigInteger> totalLogged();

    /** Address of the signing wallet, empty when disabled */
    Optional<String> signerAddress();

    boolean isEnabled();

    @Override
    default void close() {
    }

    /**
     * Disabled client when any setting is missing, web3j-backed client otherwise.
     */
    static LedgerClient create(LedgerSettings settings) {
        if (settings == null || !settings.isComplete()) {
            return new DisabledLedgerClient(settings != null ? settings : LedgerSettings.none());
        }
        return new Web3LedgerClient(new Web3jLedgerGateway(settings));
    }
}
