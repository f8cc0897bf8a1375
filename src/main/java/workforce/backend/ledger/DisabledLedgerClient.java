package workforce.backend.ledger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.Optional;

/**
 * Ledger client used when the ledger is not configured. Every operation is a no-op.
 */
public final class DisabledLedgerClient implements LedgerClient {

    private static final Logger log = LoggerFactory.getLogger(DisabledLedgerClient.class);

    DisabledLedgerClient(LedgerSettings settings) {
        log.warn("Ledger logging disabled, missing setting(s): {}. Set them to enable on-chain completion records.",
                String.join(", ", settings.missing()));
    }

    @Override
    public Optional<String> recordCompletion(String taskId) {
        return Optional.empty();
    }

    @Override
    public Optional<String> registerTenant() {
        return Optional.empty();
    }

    @Override
    public boolean isRegistered(String address) {
        return false;
    }

    @Override
    public Optional<BigInteger> totalLogged() {
        return Optional.empty();
    }

    @Override
    public Optional<String> signerAddress() {
        return Optional.empty();
    }

    @Override
    public boolean isEnabled() {
        return false;
    }
}
