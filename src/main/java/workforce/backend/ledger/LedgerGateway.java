package workforce.backend.ledger;

import java.math.BigInteger;

/**
 * Raw access to the logger contract. Implementations may throw on any call;
 * {@link Web3LedgerClient} turns failures into empty results.
 */
public interface LedgerGateway extends AutoCloseable {

    /** Address of the signing wallet */
    String signerAddress();

    /**
     * Send {@code logTaskCompletion(taskId)} and wait for one receipt.
     *
     * @return transaction hash
     */
    String logTaskCompletion(BigInteger taskId) throws LedgerCallException;

    /**
     * Send {@code registerOrg()} for the signing wallet and wait for one receipt.
     *
     * @return transaction hash
     */
    String registerOrg() throws LedgerCallException;

    boolean isRegistered(String address) throws LedgerCallException;

    BigInteger totalLogged() throws LedgerCallException;

    @Override
    default void close() {
    }
}
