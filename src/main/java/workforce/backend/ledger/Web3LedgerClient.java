package workforce.backend.ledger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.Optional;

/**
 * Enabled ledger client. Delegates to a {@link LedgerGateway} and converts
 * every failure into an empty result with a log line.
 */
public final class Web3LedgerClient implements LedgerClient {

    private static final Logger log = LoggerFactory.getLogger(Web3LedgerClient.class);

    static final String ALREADY_REGISTERED = "AlreadyRegistered";

    private final LedgerGateway gateway;

    public Web3LedgerClient(LedgerGateway gateway) {
        this.gateway = gateway;
    }

    @Override
    public Optional<String> recordCompletion(String taskId) {
        try {
            BigInteger ledgerId = LedgerIds.toUint256(taskId);
            String txHash = gateway.logTaskCompletion(ledgerId);
            log.info("Task completion recorded on ledger: task={}, ledgerId={}, tx={}", taskId, ledgerId, txHash);
            return Optional.ofNullable(txHash);
        } catch (LedgerCallException | RuntimeException e) {
            log.error("Failed to record completion of task {} on ledger: {}", taskId, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public Optional<String> registerTenant() {
        try {
            String txHash = gateway.registerOrg();
            log.info("Tenant wallet registered on ledger, tx={}", txHash);
            return Optional.ofNullable(txHash);
        } catch (LedgerCallException | RuntimeException e) {
            if (isAlreadyRegistered(e)) {
                log.info("Tenant wallet already registered on ledger, skipping");
                return Optional.empty();
            }
            log.error("Failed to register tenant wallet on ledger: {}", e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public boolean isRegistered(String address) {
        try {
            return gateway.isRegistered(address);
        } catch (LedgerCallException | RuntimeException e) {
            log.debug("isRegistered({}) failed: {}", address, e.getMessage());
            return false;
        }
    }

    @Override
    public Optional<BigInteger> totalLogged() {
        try {
            return Optional.ofNullable(gateway.totalLogged());
        } catch (LedgerCallException | RuntimeException e) {
            log.debug("totalLogged failed: {}", e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public Optional<String> signerAddress() {
        return Optional.ofNullable(gateway.signerAddress());
    }

    @Override
    public boolean isEnabled() {
        return true;
    }

    @Override
    public void close() {
        gateway.close();
    }

    private static boolean isAlreadyRegistered(Exception e) {
        return e.getMessage() != null && e.getMessage().contains(ALREADY_REGISTERED);
    }
}
